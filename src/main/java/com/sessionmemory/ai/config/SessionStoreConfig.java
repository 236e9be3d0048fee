package com.sessionmemory.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionmemory.ai.store.InMemorySessionSnapshotStore;
import com.sessionmemory.ai.store.RedisSessionSnapshotStore;
import com.sessionmemory.ai.store.SessionSnapshotStore;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class SessionStoreConfig {

  @Bean
  @ConditionalOnProperty(name = "app.memory.store", havingValue = "redis")
  public SessionSnapshotStore redisSessionSnapshotStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper mapper,
      @Value("${app.memory.redis-ttl:PT30M}") Duration ttl,
      @Value("${app.memory.redis-key-prefix:session-memory:}") String keyPrefix) {
    return new RedisSessionSnapshotStore(redisTemplate, mapper, ttl, keyPrefix);
  }

  @Bean
  @ConditionalOnMissingBean(SessionSnapshotStore.class)
  public SessionSnapshotStore inMemorySessionSnapshotStore() {
    return new InMemorySessionSnapshotStore();
  }
}
