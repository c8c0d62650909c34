package com.ietfdata.gateway;

import com.ietfdata.gateway.config.DatatrackerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Read-only HTTP gateway over the Datatracker client.
 *
 * <p>Exposes resolution, key lookups, filtered lists and history under {@code /api/v1}, with
 * correlation IDs on every request and RFC 7807 error bodies.
 */
@SpringBootApplication
@EnableConfigurationProperties(DatatrackerProperties.class)
public class DatatrackerGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(DatatrackerGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DatatrackerGatewayApplication.class, args);
        log.info("Datatracker gateway started");
    }
}
