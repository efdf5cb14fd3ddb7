package com.feed.shield.gateway.test.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feed.shield.gateway.common.exception.StoreUnavailableException;
import com.feed.shield.gateway.core.store.RestStoreBackend;
import com.feed.shield.gateway.core.store.StoreCommand;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestStoreBackendTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "[]";
    private final Queue<String> queuedReplies = new ConcurrentLinkedQueue<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.createContext("/pipeline", this::handle);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        bodies.add(lastBody.get());
        lastAuth.set(ex.getRequestHeaders().getFirst("Authorization"));
        String next = queuedReplies.poll();
        byte[] bytes = (next != null ? next : reply).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private RestStoreBackend backend() {
        return new RestStoreBackend(baseUrl, "tok", "fs:", new ObjectMapper(), HttpClient.newHttpClient(),
                Duration.ofSeconds(2));
    }

    @Test
    void sendsOnePipelineAndNormalizesReplies() {
        reply = "[{\"result\":\"OK\"},{\"result\":\"v\"},{\"result\":3},{\"result\":[\"m\",\"1714521600000\"]},{\"result\":[]}]";

        List<Object> r = backend().execute(List.of(
                StoreCommand.setEx("k", 10, "v"),
                StoreCommand.get("k"),
                StoreCommand.incr("n"),
                StoreCommand.zMinScore("w"),
                StoreCommand.zMinScore("empty"))).join();

        assertThat(r).containsExactly(true, "v", 3L, 1714521600000d, null);
        assertThat(lastAuth.get()).isEqualTo("Bearer tok");
        assertThat(lastBody.get())
                .contains("[\"SETEX\",\"fs:k\",\"10\",\"v\"]")
                .contains("[\"GET\",\"fs:k\"]")
                .contains("[\"ZRANGE\",\"fs:w\",\"0\",\"0\",\"WITHSCORES\"]");
    }

    @Test
    void errorReplyFailsTheCall() {
        reply = "[{\"error\":\"WRONGTYPE Operation against a key holding the wrong kind of value\"}]";

        assertThatThrownBy(() -> backend().execute(List.of(StoreCommand.zCard("s"))).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void unauthorizedFailsTheCall() {
        status = 401;
        reply = "{\"error\":\"Unauthorized\"}";

        assertThatThrownBy(() -> backend().execute(List.of(StoreCommand.get("k"))).join())
                .hasCauseInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void keyCountUsesDbSize() {
        reply = "[{\"result\":42}]";

        assertThat(backend().keyCount().join()).isEqualTo(42L);
        assertThat(lastBody.get()).isEqualTo("[[\"DBSIZE\"]]");
    }

    @Test
    void rejectsMissingToken() {
        assertThatThrownBy(() -> new RestStoreBackend(baseUrl, " ", "fs:", new ObjectMapper(),
                HttpClient.newHttpClient(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteByPrefixListsMatchingKeysThenDeletesThem() {
        queuedReplies.add("[{\"result\":[\"fs:news:a\",\"fs:news:b\"]}]");
        queuedReplies.add("[{\"result\":2}]");

        assertThat(backend().deleteByPrefix("news:*").join()).isEqualTo(2L);
        assertThat(bodies).containsExactly(
                "[[\"KEYS\",\"fs:news:\\\\**\"]]",
                "[[\"DEL\",\"fs:news:a\",\"fs:news:b\"]]");
    }

    @Test
    void deleteByPrefixWithNoMatchesSkipsTheDelete() {
        reply = "[{\"result\":[]}]";

        assertThat(backend().deleteByPrefix("news:").join()).isZero();
        assertThat(bodies).hasSize(1);
    }
}
