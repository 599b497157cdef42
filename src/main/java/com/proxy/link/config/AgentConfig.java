package com.proxy.link.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "proxy.agent")
public class AgentConfig {
    private int listenPort = 8080;
    private String relayHost = "localhost";
    private int relayPort = 9999;
    // Relay certificates are not validated, self-signed ones are expected
    private boolean tlsEnabled = false;
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration reconnectInterval = Duration.ofSeconds(5);
    private Duration responseTimeout = Duration.ofSeconds(20);
    private ConnectMode connectMode = ConnectMode.RELAY;
    private int queueWarnThreshold = 100;

    public enum ConnectMode {
        /** CONNECT tunnels are carried over the relay link as tunnel frames. */
        RELAY,
        /** CONNECT tunnels bypass the relay and go straight to the target. */
        DIRECT
    }
}
