package com.feed.shield.gateway.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.cache.LocalCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ShieldProperties.class)
public class CustomConfig {

    @Bean
    public RestTemplate template(RestTemplateBuilder builder, ShieldProperties props) {
        return builder
                .setConnectTimeout(props.getUpstream().getTimeout())
                .setReadTimeout(props.getUpstream().getTimeout())
                .build();
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.READ_ENUMS_USING_TO_STRING, true);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient storeHttpClient(ShieldProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(props.getStore().getTimeout())
                .build();
    }

    @Bean
    public LocalCache<String> localCache(ShieldProperties props, Clock clock) {
        return new LocalCache<>(props.getCache().getMaxSize(), props.getCache().getRetentionFactor(), clock);
    }

    /**
     * Blocking Redis template calls.
     */
    @Bean(name = "storeExecutor")
    public Executor storeExecutor(ShieldProperties props) {
        return pool(props.getStore().getThreads(), props.getStore().getThreads() * 2, 500, "StoreIO-", new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Stale-while-revalidate refreshes. A saturated pool rejects instead of running the
     * refresh on the request thread; the stale value is still served.
     */
    @Bean(name = "refreshExecutor")
    public Executor refreshExecutor(ShieldProperties props) {
        int n = props.getCache().getRefreshThreads();
        return pool(n, n * 2, 200, "CacheRefresh-", new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Blocking upstream HTTP calls.
     */
    @Bean(name = "upstreamExecutor")
    public Executor upstreamExecutor() {
        return pool(4, 16, 200, "Upstream-", new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static Executor pool(int core, int max, int queue, String prefix, RejectedExecutionHandler onFull) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(onFull);
        executor.initialize();
        return executor;
    }
}
