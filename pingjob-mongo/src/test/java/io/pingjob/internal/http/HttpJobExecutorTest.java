package io.pingjob.internal.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.pingjob.core.AuthHeader;
import io.pingjob.core.JobConfig;
import io.pingjob.core.ProbeResult;
import io.pingjob.core.Task;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpJobExecutorTest {

    private HttpServer server;
    private ExecutorService serverThreads;
    private CloseableHttpClient client;
    private HttpJobExecutor executor;
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/json", exchange -> {
            record(exchange.getRequestMethod(), exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
            respond(exchange, 200, "{\"status\":\"ok\",\"n\":3}");
        });
        server.createContext("/text", exchange -> {
            record(exchange.getRequestMethod(), exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.getResponseHeaders().add("Content-Type", "text/plain");
            respond(exchange, 503, "down");
        });
        server.createContext("/broken-json", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            respond(exchange, 200, "{not json");
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        server.createContext("/trickle", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "text/plain");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                for (int i = 0; i < 20; i++) {
                    os.write('x');
                    os.flush();
                    Thread.sleep(300);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // client gave up
            }
            exchange.close();
        });
        server.createContext("/huge-json", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            respond(exchange, 200, "[" + "1,".repeat(HttpJobExecutor.MAX_BODY_CHARS) + "1]");
        });
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);
        server.start();

        client = HttpJobExecutor.defaultClient(Duration.ofSeconds(2));
        executor = new HttpJobExecutor(client, new ObjectMapper(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.stop(0);
        serverThreads.shutdownNow();
        client.close();
    }

    @Test
    void decodesJsonBody() {
        ProbeResult result = executor.execute(job("/json", null, null));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.body().get("status").asText()).isEqualTo("ok");
        assertThat(result.body().get("n").asInt()).isEqualTo(3);
        assertThat(lastMethod.get()).isEqualTo("GET");
        assertThat(lastAuthorization.get()).isNull();
    }

    @Test
    void sendsAuthorizationHeader() {
        executor.execute(job("/json", null, new AuthHeader("Bearer", "abc123")));

        assertThat(lastAuthorization.get()).isEqualTo("Bearer abc123");
    }

    @Test
    void emptySchemeSendsNoHeader() {
        executor.execute(job("/json", null, AuthHeader.none()));

        assertThat(lastAuthorization.get()).isNull();
    }

    @Test
    void nonJsonResponseKeepsStatusWithoutBody() {
        ProbeResult result = executor.execute(job("/text", null, null));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.body()).isNull();
    }

    @Test
    void undecodableJsonIsNotAFailure() {
        ProbeResult result = executor.execute(job("/broken-json", null, null));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.body()).isNull();
    }

    @Test
    void timeoutIsReportedNotThrown() {
        ProbeResult result = executor.execute(job("/slow", Duration.ofMillis(200), null));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.statusCode()).isEqualTo(-1);
        assertThat(result.duration()).isLessThan(Duration.ofMillis(1_900));
    }

    @Test
    void slowBodyIsCutOffAtTaskTimeout() {
        ProbeResult result = executor.execute(job("/trickle", Duration.ofMillis(500), null));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure()).isInstanceOf(ProbeTimeoutException.class);
        assertThat(result.duration()).isLessThan(Duration.ofMillis(1_500));
    }

    @Test
    void oversizedBodyIsNotDecoded() {
        ProbeResult result = executor.execute(job("/huge-json", null, null));

        assertThat(result.body()).isNull();
    }

    @Test
    void connectionFailureIsReportedNotThrown() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        Task task = Task.of("http://127.0.0.1:" + closedPort + "/ping", Duration.ofSeconds(1));

        ProbeResult result = executor.execute(new JobConfig("* * * * * *", UUID.randomUUID(), task));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure()).isInstanceOf(IOException.class);
    }

    @Test
    void malformedUrlIsReportedNotThrown() {
        Task task = Task.of("http://bad host/ping", Duration.ofSeconds(1));

        ProbeResult result = executor.execute(new JobConfig("* * * * * *", UUID.randomUUID(), task));

        assertThat(result.succeeded()).isFalse();
    }

    private JobConfig job(String path, Duration timeout, AuthHeader auth) {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + path;
        return new JobConfig("* * * * * *", UUID.randomUUID(), Task.of(url, timeout, auth));
    }

    private void record(String method, String authorization) {
        lastMethod.set(method);
        lastAuthorization.set(authorization);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
