package com.feed.shield.gateway.config;

import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.InMemoryStoreBackend;
import com.feed.shield.gateway.core.store.RedisStoreBackend;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.RestStoreBackend;
import com.feed.shield.gateway.core.store.StoreBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * One adapter per process, backends in failover order: Redis, REST, in-memory.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public RemoteStoreAdapter remoteStoreAdapter(ObjectProvider<RedisStoreBackend> redis,
                                                 ObjectProvider<RestStoreBackend> rest,
                                                 ObjectProvider<InMemoryStoreBackend> inMemory,
                                                 ShieldProperties props) {
        List<StoreBackend> backends = new ArrayList<>();
        redis.ifAvailable(backends::add);
        rest.ifAvailable(backends::add);
        inMemory.ifAvailable(backends::add);
        if (backends.isEmpty()) {
            log.info("No shared store configured: caching and rate limiting are per worker only");
        } else {
            log.info("Shared store backends (in order): {}", backends.stream().map(StoreBackend::name).toList());
        }
        return new RemoteStoreAdapter(backends, props.getStore().getTimeout());
    }
}
