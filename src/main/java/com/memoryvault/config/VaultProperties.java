package com.memoryvault.config;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Secret vault settings ({@code memoryvault.vault.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "memoryvault.vault")
public class VaultProperties {

    /** Upper bound for an asynchronous access check including decryption. */
    @NotNull
    private Duration accessTimeout = Duration.ofSeconds(5);

    /** Size of the access-check worker pool. */
    private int workerThreads = 8;

    private int queueCapacity = 256;
}
