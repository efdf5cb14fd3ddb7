package com.feed.shield.gateway.web;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.exception.Http;
import com.feed.shield.gateway.service.market.MarketPriceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketPriceController {

    private final MarketPriceService market;

    /**
     * Current price for a coin id (e.g. "bitcoin"), at most 30 s old unless upstream is down.
     */
    @GetMapping("/price/{coinId}")
    public CompletableFuture<ResponseEntity<?>> getPrice(@PathVariable("coinId") String coinId) {
        return market.getPrice(coinId).thenApply(q -> Http.from(Result.ok(q)));
    }
}
