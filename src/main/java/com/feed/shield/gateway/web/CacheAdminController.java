package com.feed.shield.gateway.web;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.exception.Http;
import com.feed.shield.gateway.service.cache.CacheOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheOrchestrator cache;

    /**
     * Local entries plus shared store connectivity.
     */
    @GetMapping
    public CompletableFuture<ResponseEntity<?>> introspect() {
        return cache.introspect().thenApply(i -> Http.from(Result.ok(i)));
    }

    /**
     * Drops a whole key family, e.g. {@code DELETE /api/admin/cache?prefix=news:}.
     */
    @DeleteMapping(params = "prefix")
    public CompletableFuture<ResponseEntity<?>> invalidatePrefix(@RequestParam("prefix") String prefix) {
        return cache.invalidatePrefix(prefix).thenApply(r -> Http.from(Result.ok(r)));
    }

    @DeleteMapping("/{key}")
    public CompletableFuture<ResponseEntity<?>> invalidate(@PathVariable("key") String key) {
        return cache.invalidate(key).thenApply(removed -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("key", key);
            body.put("removed", removed);
            return Http.from(Result.ok(body));
        });
    }
}
