package com.example.accounttransfer.repository;

import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.RecordAttributes;
import com.example.accounttransfer.model.StoredRecord;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.model.UserWriteRequest;
import com.example.common.UtcTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
public class JdbcRecordStore implements RecordStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String rolesMetadataKey;

  public JdbcRecordStore(
      NamedParameterJdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      TransferProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.rolesMetadataKey = properties.rolesMetadataKey();
  }

  @Override
  public Optional<StoredRecord> findByKey(String key) {
    final String sql =
        """
        SELECT id, user_key
        FROM users
        WHERE user_key = :key
        """;
    try {
      return jdbcTemplate
          .query(
              sql,
              new MapSqlParameterSource().addValue("key", key),
              (rs, rowNum) -> new StoredRecord(rs.getLong("id"), rs.getString("user_key")))
          .stream()
          .findFirst();
    } catch (DataAccessException ex) {
      throw new StoreException("failed to look up user " + key + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public List<TransferRecord> findAll() {
    final String usersSql =
        """
        SELECT id, user_key, credential_hash, email, url, nice_key, display_name,
               first_name, last_name, description, registered_at
        FROM users
        ORDER BY id ASC
        """;
    final String metadataSql =
        """
        SELECT user_id, meta_key, meta_value::text AS meta_value
        FROM user_metadata
        ORDER BY user_id ASC, meta_key ASC
        """;
    try {
      final Map<Long, Map<String, Object>> metadataByUser = new LinkedHashMap<>();
      jdbcTemplate.query(
          metadataSql,
          new MapSqlParameterSource(),
          rs -> {
            metadataByUser
                .computeIfAbsent(rs.getLong("user_id"), id -> new LinkedHashMap<>())
                .put(rs.getString("meta_key"), readJson(rs.getString("meta_value")));
          });
      return jdbcTemplate.query(
          usersSql,
          new MapSqlParameterSource(),
          (rs, rowNum) ->
              mapRecord(rs, metadataByUser.getOrDefault(rs.getLong("id"), Map.of())));
    } catch (DataAccessException ex) {
      throw new StoreException("failed to list users: " + ex.getMessage(), ex);
    }
  }

  @Override
  public long create(UserWriteRequest request) {
    final String sql =
        """
        INSERT INTO users (user_key, credential_hash, email, url, nice_key, display_name,
                           first_name, last_name, description, registered_at,
                           created_at, updated_at)
        VALUES (:key, :credentialHash, :email, :url, :niceKey, :displayName,
                :firstName, :lastName, :description, :registeredAt,
                :now, :now)
        RETURNING id
        """;
    try {
      final Long id = jdbcTemplate.queryForObject(sql, writeParams(request), Long.class);
      if (id == null) {
        throw new StoreException("insert of user " + request.key() + " returned no id");
      }
      return id;
    } catch (DataAccessException ex) {
      throw new StoreException(
          "failed to create user " + request.key() + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void update(long id, UserWriteRequest request) {
    final String sql =
        """
        UPDATE users
        SET user_key = :key,
            credential_hash = :credentialHash,
            email = :email,
            url = :url,
            nice_key = :niceKey,
            display_name = :displayName,
            first_name = :firstName,
            last_name = :lastName,
            description = :description,
            registered_at = :registeredAt,
            updated_at = :now
        WHERE id = :id
        """;
    final int updated;
    try {
      updated = jdbcTemplate.update(sql, writeParams(request).addValue("id", id));
    } catch (DataAccessException ex) {
      throw new StoreException("failed to update user " + id + ": " + ex.getMessage(), ex);
    }
    if (updated == 0) {
      throw new StoreException("user " + id + " no longer exists");
    }
  }

  @Override
  public void setMetadata(long id, String key, Object value) {
    final String sql =
        """
        INSERT INTO user_metadata (user_id, meta_key, meta_value)
        VALUES (:userId, :metaKey, CAST(:metaValue AS jsonb))
        ON CONFLICT (user_id, meta_key) DO UPDATE SET meta_value = EXCLUDED.meta_value
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", id)
            .addValue("metaKey", key)
            .addValue("metaValue", writeJson(value));
    try {
      jdbcTemplate.update(sql, params);
      if (rolesMetadataKey.equals(key)) {
        grantRoles(id, roleNames(value));
      }
    } catch (DataAccessException ex) {
      throw new StoreException(
          "failed to write metadata " + key + " for user " + id + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void clearRoles(long id) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", id).addValue("metaKey", rolesMetadataKey);
    try {
      jdbcTemplate.update("DELETE FROM account_roles WHERE user_id = :userId", params);
      jdbcTemplate.update(
          "DELETE FROM user_metadata WHERE user_id = :userId AND meta_key = :metaKey", params);
    } catch (DataAccessException ex) {
      throw new StoreException(
          "failed to clear roles for user " + id + ": " + ex.getMessage(), ex);
    }
  }

  public List<String> findRolesByUserId(long id) {
    final String sql =
        """
        SELECT role
        FROM account_roles
        WHERE user_id = :userId
        ORDER BY role ASC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("userId", id),
        (rs, rowNum) -> rs.getString("role"));
  }

  private void grantRoles(long id, Set<String> roles) {
    final String sql =
        """
        INSERT INTO account_roles (user_id, role)
        VALUES (:userId, :role)
        ON CONFLICT (user_id, role) DO NOTHING
        """;
    for (String role : roles) {
      jdbcTemplate.update(
          sql, new MapSqlParameterSource().addValue("userId", id).addValue("role", role));
    }
  }

  // ロール集合は {role: true} 形式、配列形式、単一文字列のいずれも受け付ける
  static Set<String> roleNames(Object value) {
    final Set<String> roles = new LinkedHashSet<>();
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() != null && isGranted(entry.getValue())) {
          roles.add(String.valueOf(entry.getKey()));
        }
      }
    } else if (value instanceof Collection<?> collection) {
      for (Object role : collection) {
        if (role != null && !String.valueOf(role).isBlank()) {
          roles.add(String.valueOf(role));
        }
      }
    } else if (value instanceof String role && !role.isBlank()) {
      roles.add(role);
    }
    return roles;
  }

  private static boolean isGranted(Object flag) {
    if (flag == null) {
      return false;
    }
    if (flag instanceof Boolean granted) {
      return granted;
    }
    if (flag instanceof Number number) {
      return number.intValue() != 0;
    }
    final String text = String.valueOf(flag);
    return !text.isEmpty() && !"0".equals(text) && !"false".equalsIgnoreCase(text);
  }

  private MapSqlParameterSource writeParams(UserWriteRequest request) {
    final Instant now = Instant.now(clock);
    return new MapSqlParameterSource()
        .addValue("key", request.key())
        .addValue("credentialHash", request.credentialHash())
        .addValue("email", request.email())
        .addValue("url", request.url())
        .addValue("niceKey", request.niceKey())
        .addValue("displayName", request.displayName())
        .addValue("firstName", request.firstName())
        .addValue("lastName", request.lastName())
        .addValue("description", request.description())
        .addValue("registeredAt", request.registeredAt())
        .addValue("now", UtcTimestamps.toJdbc(now));
  }

  private TransferRecord mapRecord(ResultSet rs, Map<String, Object> metadata)
      throws SQLException {
    return new TransferRecord(
        rs.getString("user_key"),
        rs.getString("credential_hash"),
        new RecordAttributes(
            rs.getString("email"),
            rs.getString("url"),
            rs.getString("nice_key"),
            rs.getString("display_name"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("description"),
            rs.getString("registered_at")),
        new LinkedHashMap<>(metadata));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StoreException("metadata value is not serializable: " + e.getOriginalMessage(), e);
    }
  }

  private Object readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      throw new StoreException("stored metadata is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }
}
