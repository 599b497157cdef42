package com.proxy.link.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "proxy.relay")
public class RelayConfig {
    private int listenPort = 9999;
    private boolean tlsEnabled = false;
    // PEM certificate and key are declared under spring.ssl.bundle.pem.<sslBundle>
    private String sslBundle = "relay";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(15);
    private int queueWarnThreshold = 100;
}
