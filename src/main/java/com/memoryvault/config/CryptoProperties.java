package com.memoryvault.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Master key material ({@code memoryvault.crypto.*}). Keys are Base64-encoded
 * 32-byte AES keys.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "memoryvault.crypto")
public class CryptoProperties {

    @NotBlank
    @Pattern(regexp = "^[a-zA-Z0-9_-]+$")
    private String masterKeyId = "local-master-1";

    /** Active master key. When blank an ephemeral key is generated at startup. */
    private String masterKey;

    /** Earlier master keys by id, still accepted for decryption. */
    private Map<String, String> retiredKeys = new LinkedHashMap<>();
}
