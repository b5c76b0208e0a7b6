package com.example.kvdriver.redis;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

@FunctionalInterface
public interface RedisConnector {

    RedisHandle open(RedisDriverOptions options) throws Exception;

    /** Starts a Lettuce connection factory for a standalone server and pings it. */
    static RedisConnector standard() {
        return options -> {
            RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(options.getHost(), options.getPort());
            server.setDatabase(options.getDatabase());
            if (options.getPassword() != null) {
                server.setPassword(RedisPassword.of(options.getPassword()));
            }
            LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder();
            if (options.getCommandTimeout() != null) {
                client.commandTimeout(options.getCommandTimeout());
            }

            LettuceConnectionFactory factory = new LettuceConnectionFactory(server, client.build());
            factory.afterPropertiesSet();
            factory.start();
            try {
                StringRedisTemplate template = new StringRedisTemplate(factory);
                template.execute((RedisCallback<String>) RedisConnection::ping);
                return new RedisHandle(factory, template);
            } catch (RuntimeException e) {
                factory.destroy();
                throw e;
            }
        };
    }
}
