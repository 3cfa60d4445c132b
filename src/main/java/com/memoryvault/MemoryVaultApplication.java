package com.memoryvault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the memory vault access-control core.
 *
 * <p>Hosts the tiered access-control services behind a thin REST adapter:
 *
 * <ul>
 *   <li><strong>Voice confidence authentication</strong>: three-way decision with knowledge challenges</li>
 *   <li><strong>Tiered secret vault</strong>: envelope-encrypted content, per-record access log</li>
 *   <li><strong>Designated disclosures</strong>: single designated reader and mutual romantic matching</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Hexagonal: repository ports with in-memory adapters</li>
 *   <li>Typed results for authentication and authorization failures</li>
 *   <li>Spring application events for sessions, access logs and matches</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class MemoryVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryVaultApplication.class, args);

        log.info("Memory vault core started: voice authentication, secret vault, disclosures");
    }
}
