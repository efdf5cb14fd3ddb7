package com.feed.shield.gateway.config;

import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.InMemoryStoreBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "shield.store.in-memory", havingValue = "true")
public class InMemoryStoreConfig {

    @Bean
    public InMemoryStoreBackend inMemoryStoreBackend(ShieldProperties props, Clock clock) {
        return new InMemoryStoreBackend(props.getStore().getKeyPrefix(), clock);
    }
}
