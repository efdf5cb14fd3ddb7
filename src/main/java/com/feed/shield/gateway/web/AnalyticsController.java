package com.feed.shield.gateway.web;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.exception.Http;
import com.feed.shield.gateway.service.analytics.UsageAnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AnalyticsController {

    private final UsageAnalyticsService analytics;

    /**
     * Usage counters for a UTC day (defaults to today).
     */
    @GetMapping("/analytics")
    public CompletableFuture<ResponseEntity<?>> summary(
            @RequestParam(name = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return analytics.summarize(date).thenApply(s -> Http.from(Result.ok(s)));
    }
}
