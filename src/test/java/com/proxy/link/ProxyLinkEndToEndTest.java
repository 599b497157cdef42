package com.proxy.link;

import com.proxy.link.agent.connection.RelayLinkManager;
import com.proxy.link.agent.dispatcher.SequentialDispatcher;
import com.proxy.link.agent.listener.LocalProxyListener;
import com.proxy.link.agent.tunnel.DirectTunnelBridge;
import com.proxy.link.config.AgentConfig;
import com.proxy.link.config.RelayConfig;
import com.proxy.link.relay.connection.RelayConnectionManager;
import com.proxy.link.relay.processor.HttpProcessor;
import com.proxy.link.relay.processor.TunnelProcessor;
import com.proxy.link.support.EchoServer;
import com.proxy.link.support.RawHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Agent and relay wired together over a real link, with a real HTTP client in front.
 */
class ProxyLinkEndToEndTest {

    private MockWebServer origin;
    private TunnelProcessor tunnelProcessor;
    private RelayConnectionManager relay;
    private RelayLinkManager linkManager;
    private DirectTunnelBridge directTunnelBridge;
    private SequentialDispatcher dispatcher;
    private LocalProxyListener listener;

    @BeforeEach
    void setUp() throws Exception {
        origin = new MockWebServer();
        origin.start();

        RelayConfig relayConfig = new RelayConfig();
        relayConfig.setListenPort(0);
        HttpProcessor httpProcessor = new HttpProcessor(relayConfig);
        httpProcessor.init();
        tunnelProcessor = new TunnelProcessor(relayConfig);
        relay = new RelayConnectionManager(relayConfig, httpProcessor, tunnelProcessor, null);
        relay.start();

        AgentConfig agentConfig = new AgentConfig();
        agentConfig.setListenPort(0);
        agentConfig.setRelayHost("127.0.0.1");
        agentConfig.setRelayPort(relay.getLocalPort());
        agentConfig.setReconnectInterval(Duration.ofMillis(200));
        agentConfig.setResponseTimeout(Duration.ofSeconds(10));
        linkManager = new RelayLinkManager(agentConfig);
        directTunnelBridge = new DirectTunnelBridge(agentConfig);
        dispatcher = new SequentialDispatcher(agentConfig, linkManager, directTunnelBridge);
        dispatcher.start();
        listener = new LocalProxyListener(agentConfig, dispatcher);
        listener.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        listener.destroy();
        dispatcher.shutdown();
        linkManager.shutdown();
        directTunnelBridge.shutdown();
        relay.shutdown();
        tunnelProcessor.shutdown();
        origin.shutdown();
    }

    private HttpURLConnection open(String path) throws Exception {
        Proxy proxy = new Proxy(Proxy.Type.HTTP, new InetSocketAddress("127.0.0.1", listener.getLocalPort()));
        HttpURLConnection connection = (HttpURLConnection) origin.url(path).url().openConnection(proxy);
        connection.setConnectTimeout(5000);
        connection.setReadTimeout(15000);
        return connection;
    }

    @Test
    void getThroughAgentAndRelay() throws Exception {
        origin.enqueue(new MockResponse().setBody("hello").setHeader("X-Origin", "mock"));

        HttpURLConnection connection = open("/hello");

        assertThat(connection.getResponseCode()).isEqualTo(200);
        assertThat(connection.getHeaderField("X-Origin")).isEqualTo("mock");
        try (InputStream in = connection.getInputStream()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello");
        }
        assertThat(origin.takeRequest(5, TimeUnit.SECONDS).getPath()).isEqualTo("/hello");
    }

    @Test
    void postBodyReachesOrigin() throws Exception {
        origin.enqueue(new MockResponse().setResponseCode(201).setBody("created"));

        HttpURLConnection connection = open("/items");
        connection.setRequestMethod("POST");
        connection.setDoOutput(true);
        connection.setRequestProperty("Content-Type", "application/json");
        try (OutputStream out = connection.getOutputStream()) {
            out.write("{\"name\":\"x\"}".getBytes(StandardCharsets.UTF_8));
        }

        assertThat(connection.getResponseCode()).isEqualTo(201);
        RecordedRequest recorded = origin.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"x\"}");
    }

    @Test
    void originErrorStatusIsPassedThrough() throws Exception {
        origin.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        assertThat(open("/missing").getResponseCode()).isEqualTo(404);
    }

    private String rawRequest(String method, String path) throws Exception {
        try (RawHttpClient client = new RawHttpClient(listener.getLocalPort())) {
            client.write(method + " " + origin.url(path) + " HTTP/1.1\r\nHost: " + origin.getHostName() + ":" + origin.getPort()
                    + "\r\nConnection: close\r\n\r\n");
            return client.readToEnd();
        }
    }

    @Test
    void everyCookieReachesTheClientOnItsOwnLine() throws Exception {
        origin.enqueue(new MockResponse()
                .addHeader("Set-Cookie", "a=1; Expires=Wed, 21 Oct 2026 07:28:00 GMT")
                .addHeader("Set-Cookie", "b=2")
                .setBody("ok"));

        String response = rawRequest("GET", "/cookies").toLowerCase();

        assertThat(response).contains("\r\nset-cookie: a=1; expires=wed, 21 oct 2026 07:28:00 gmt\r\n");
        assertThat(response).contains("\r\nset-cookie: b=2\r\n");
        assertThat(response).endsWith("\r\n\r\nok");
    }

    @Test
    void headResponseKeepsOriginContentLength() throws Exception {
        origin.enqueue(new MockResponse().setHeader("Content-Length", "1234"));

        String response = rawRequest("HEAD", "/page");

        assertThat(response).startsWith("HTTP/1.1 200 OK\r\n");
        assertThat(response.toLowerCase()).contains("\r\ncontent-length: 1234\r\n");
        assertThat(response).endsWith("\r\n\r\n");
        assertThat(origin.takeRequest(5, TimeUnit.SECONDS).getMethod()).isEqualTo("HEAD");
    }

    @Test
    void consecutiveRequestsAreAnsweredInOrder() throws Exception {
        for (int i = 0; i < 5; i++) {
            origin.enqueue(new MockResponse().setBody("response-" + i));
        }

        for (int i = 0; i < 5; i++) {
            HttpURLConnection connection = open("/seq/" + i);
            try (InputStream in = connection.getInputStream()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("response-" + i);
            }
        }
    }

    @Test
    void connectTunnelReachesTargetThroughRelay() throws Exception {
        try (EchoServer echo = new EchoServer();
             RawHttpClient client = new RawHttpClient(listener.getLocalPort())) {
            client.write("CONNECT 127.0.0.1:" + echo.getPort() + " HTTP/1.1\r\nHost: 127.0.0.1:" + echo.getPort() + "\r\n\r\n");
            String established = "HTTP/1.1 200 Connection Established\r\n\r\n";
            assertThat(client.readExactly(established.length())).isEqualTo(established);

            client.write("round trip");
            assertThat(client.readExactly("round trip".length())).isEqualTo("round trip");
        }

        // the relay's slot is released once the tunnel is gone
        origin.enqueue(new MockResponse().setBody("after"));
        try (InputStream in = open("/after").getInputStream()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("after");
        }
    }
}
