package com.example.accounttransfer.repository;

import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.LogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisOperationLogStore implements OperationLogStore {

  private static final TypeReference<List<LogEntry>> ENTRIES_TYPE = new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;
  private final String logKey;

  public RedisOperationLogStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      TransferProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.logKey = properties.logKey();
  }

  @Override
  public void save(List<LogEntry> entries, Duration ttl) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(entries);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize operation log", e);
    }
    // 直近 1 回分のみ保持するため、常に同じキーを上書きする
    redisTemplate.opsForValue().set(logKey, json, ttl);
  }

  @Override
  public Optional<List<LogEntry>> load() {
    final String json = redisTemplate.opsForValue().get(logKey);
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(List.copyOf(objectMapper.readValue(json, ENTRIES_TYPE)));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to deserialize operation log", e);
    }
  }
}
