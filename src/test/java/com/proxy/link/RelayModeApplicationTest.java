package com.proxy.link;

import com.proxy.link.agent.connection.RelayLinkManager;
import com.proxy.link.agent.listener.LocalProxyListener;
import com.proxy.link.config.RelayConfig;
import com.proxy.link.relay.connection.RelayConnectionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "proxy.mode=relay",
        "proxy.relay.listen-port=0",
        "proxy.relay.request-timeout=3s"
})
class RelayModeApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private RelayConfig relayConfig;

    @Test
    void startsOnlyRelayComponents() {
        assertThat(context.getBeansOfType(RelayConnectionManager.class)).hasSize(1);
        assertThat(context.getBeansOfType(LocalProxyListener.class)).isEmpty();
        assertThat(context.getBeansOfType(RelayLinkManager.class)).isEmpty();
        assertThat(context.getBean(RelayConnectionManager.class).getLocalPort()).isPositive();
    }

    @Test
    void bindsRelayProperties() {
        assertThat(relayConfig.getRequestTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(relayConfig.isTlsEnabled()).isFalse();
    }
}
