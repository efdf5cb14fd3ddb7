package com.feed.shield.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.RestStoreBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
@ConditionalOnExpression("!'${shield.store.rest-url:}'.isBlank() and !'${shield.store.rest-token:}'.isBlank()")
public class RestStoreConfig {

    @Bean
    public RestStoreBackend restStoreBackend(ShieldProperties props, ObjectMapper mapper, HttpClient storeHttpClient) {
        ShieldProperties.Store s = props.getStore();
        return new RestStoreBackend(s.getRestUrl().trim(), s.getRestToken().trim(), s.getKeyPrefix(),
                mapper, storeHttpClient, s.getTimeout());
    }
}
