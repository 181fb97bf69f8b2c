package com.dronetrack.tracker.sink.redis;

import com.dronetrack.tracker.config.TrackerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisSinkConfig {

  @Bean(destroyMethod = "")
  @ConditionalOnProperty(prefix = "dronetrack.sinks.redis", name = "enabled", havingValue = "true")
  public RedisDroneSink redisDroneSink(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      TrackerProperties properties) {
    return new RedisDroneSink(redisTemplate, objectMapper, properties);
  }
}
