package com.feed.shield.gateway.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.feed.shield.gateway.common.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Stateless request/response backend speaking the Upstash-style JSON command protocol:
 * {@code POST {url}/pipeline} with a body of {@code [["CMD","key",...], ...]} and a bearer token,
 * answered by {@code [{"result": ...} | {"error": "..."}, ...]}.
 *
 * <p>There is no connection to track: each call stands on its own outcome.</p>
 */
@Slf4j
public final class RestStoreBackend implements StoreBackend {

    private final URI pipelineUri;
    private final String token;
    private final String prefix;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RestStoreBackend(String baseUrl, String token, String prefix, ObjectMapper mapper,
                            HttpClient httpClient, Duration requestTimeout) {
        if (baseUrl == null || baseUrl.isBlank() || token == null || token.isBlank()) {
            throw new IllegalArgumentException("REST store needs both url and token");
        }
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.pipelineUri = URI.create(trimmed + "/pipeline");
        this.token = token;
        this.prefix = prefix == null ? "" : prefix;
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return "rest";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CompletableFuture<List<Object>> execute(List<StoreCommand> commands) {
        ArrayNode body = mapper.createArrayNode();
        for (StoreCommand c : commands) {
            body.add(toWire(c));
        }
        return post(body).thenApply(replies -> {
            if (replies.size() != commands.size()) {
                throw new StoreUnavailableException("REST store returned " + replies.size()
                        + " replies for " + commands.size() + " commands");
            }
            List<Object> out = new ArrayList<>(replies.size());
            for (int i = 0; i < replies.size(); i++) {
                out.add(StoreReplies.normalize(commands.get(i).op(), replies.get(i)));
            }
            return out;
        });
    }

    @Override
    public CompletableFuture<Long> keyCount() {
        ArrayNode body = mapper.createArrayNode();
        body.addArray().add("DBSIZE");
        return post(body).thenApply(replies -> {
            Object v = replies.isEmpty() ? null : replies.get(0);
            return v instanceof Number n ? n.longValue() : 0L;
        });
    }

    @Override
    public CompletableFuture<Long> deleteByPrefix(String keyPrefix) {
        ArrayNode find = mapper.createArrayNode();
        find.addArray().add("KEYS").add(StoreCommand.prefixPattern(prefix + keyPrefix));
        return post(find).thenCompose(replies -> {
            Object found = replies.isEmpty() ? null : replies.get(0);
            if (!(found instanceof List<?> keys) || keys.isEmpty()) {
                return CompletableFuture.completedFuture(0L);
            }
            ArrayNode del = mapper.createArrayNode();
            ArrayNode cmd = del.addArray().add("DEL");
            keys.forEach(k -> cmd.add(String.valueOf(k)));
            return post(del).thenApply(r -> {
                Object v = r.isEmpty() ? null : r.get(0);
                return v instanceof Number n ? n.longValue() : 0L;
            });
        });
    }

    private ArrayNode toWire(StoreCommand c) {
        ArrayNode cmd = mapper.createArrayNode();
        if (c.op() == StoreOp.ZMINSCORE) {
            cmd.add("ZRANGE").add(prefix + c.key()).add("0").add("0").add("WITHSCORES");
            return cmd;
        }
        cmd.add(c.op().name()).add(prefix + c.key());
        c.args().forEach(cmd::add);
        return cmd;
    }

    private CompletableFuture<List<Object>> post(ArrayNode body) {
        final String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("cannot encode pipeline", ex));
        }
        HttpRequest request = HttpRequest.newBuilder(pipelineUri)
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::parse);
    }

    private List<Object> parse(HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new StoreUnavailableException("REST store answered HTTP " + response.statusCode());
        }
        final JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new StoreUnavailableException("REST store sent malformed JSON", ex);
        }
        if (root == null || !root.isArray()) {
            throw new StoreUnavailableException("REST store reply is not an array");
        }
        List<Object> replies = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            if (item.hasNonNull("error")) {
                throw new StoreUnavailableException("REST store error: " + item.get("error").asText());
            }
            replies.add(toJava(item.get("result")));
        }
        return replies;
    }

    private static Object toJava(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(n -> list.add(toJava(n)));
            return list;
        }
        return node.toString();
    }
}
