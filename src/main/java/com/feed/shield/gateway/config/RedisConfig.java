package com.feed.shield.gateway.config;

import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.RedisStoreBackend;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.net.URI;
import java.util.concurrent.Executor;

@Configuration
@ConditionalOnExpression("!'${shield.store.redis-url:}'.isBlank()")
public class RedisConfig {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(ShieldProperties props) {
        URI uri = URI.create(props.getStore().getRedisUrl().trim());
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(
                uri.getHost() == null ? "localhost" : uri.getHost(),
                uri.getPort() > 0 ? uri.getPort() : 6379);
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                if (colon > 0) standalone.setUsername(userInfo.substring(0, colon));
                standalone.setPassword(userInfo.substring(colon + 1));
            } else {
                standalone.setPassword(userInfo);
            }
        }
        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            standalone.setDatabase(Integer.parseInt(path.substring(1)));
        }
        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder();
        if ("rediss".equalsIgnoreCase(uri.getScheme())) {
            client.useSsl();
        }
        client.commandTimeout(props.getStore().getTimeout());
        return new LettuceConnectionFactory(standalone, client.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RedisStoreBackend redisStoreBackend(StringRedisTemplate template,
                                               @Qualifier("storeExecutor") Executor storeExecutor,
                                               ShieldProperties props) {
        ShieldProperties.Store s = props.getStore();
        return new RedisStoreBackend(template, s.getKeyPrefix(), storeExecutor, s.getReconnectBase(), s.getReconnectMax());
    }
}
