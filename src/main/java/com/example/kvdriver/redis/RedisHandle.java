package com.example.kvdriver.redis;

import lombok.Value;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Value
public class RedisHandle {
    LettuceConnectionFactory connectionFactory;
    StringRedisTemplate template;
}
