package com.example.accounttransfer.service;

import com.example.accounttransfer.model.RecordAttributes;
import com.example.accounttransfer.model.StoredRecord;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.model.UserWriteRequest;
import com.example.accounttransfer.repository.RecordStore;
import com.example.accounttransfer.repository.StoreException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Map-backed store that records every mutating call. */
final class InMemoryRecordStore implements RecordStore {

  final Map<Long, UserWriteRequest> users = new LinkedHashMap<>();
  final Map<Long, Map<String, Object>> metadata = new LinkedHashMap<>();
  final List<String> mutations = new ArrayList<>();
  final Set<String> failingWriteKeys = new HashSet<>();
  final Set<String> failingMetadataKeys = new HashSet<>();
  boolean failClearRoles;
  private final String rolesKey;
  private long nextId = 100;

  InMemoryRecordStore(String rolesKey) {
    this.rolesKey = rolesKey;
  }

  long seed(String key, Map<String, Object> initialMetadata) {
    final long id = nextId++;
    users.put(id, new UserWriteRequest(key, "seed-hash", "", "", key, key, "", "", "", "x"));
    metadata.put(id, new LinkedHashMap<>(initialMetadata));
    return id;
  }

  @Override
  public Optional<StoredRecord> findByKey(String key) {
    return users.entrySet().stream()
        .filter(entry -> entry.getValue().key().equals(key))
        .findFirst()
        .map(entry -> new StoredRecord(entry.getKey(), key));
  }

  @Override
  public List<TransferRecord> findAll() {
    final List<TransferRecord> records = new ArrayList<>();
    users.forEach(
        (id, user) ->
            records.add(
                new TransferRecord(
                    user.key(),
                    user.credentialHash(),
                    new RecordAttributes(
                        user.email(),
                        user.url(),
                        user.niceKey(),
                        user.displayName(),
                        user.firstName(),
                        user.lastName(),
                        user.description(),
                        user.registeredAt()),
                    metadata.getOrDefault(id, Map.of()))));
    return records;
  }

  @Override
  public long create(UserWriteRequest request) {
    mutations.add("create:" + request.key());
    if (failingWriteKeys.contains(request.key())) {
      throw new StoreException("duplicate key " + request.key());
    }
    final long id = nextId++;
    users.put(id, request);
    metadata.put(id, new LinkedHashMap<>());
    return id;
  }

  @Override
  public void update(long id, UserWriteRequest request) {
    mutations.add("update:" + id);
    if (failingWriteKeys.contains(request.key())) {
      throw new StoreException("row locked for " + request.key());
    }
    users.put(id, request);
  }

  @Override
  public void setMetadata(long id, String key, Object value) {
    mutations.add("setMetadata:" + id + ":" + key);
    if (failingMetadataKeys.contains(key)) {
      throw new StoreException("cannot store " + key);
    }
    metadata.computeIfAbsent(id, ignored -> new LinkedHashMap<>()).put(key, value);
  }

  @Override
  public void clearRoles(long id) {
    mutations.add("clearRoles:" + id);
    if (failClearRoles) {
      throw new StoreException("roles table unavailable");
    }
    metadata.getOrDefault(id, new LinkedHashMap<>()).remove(rolesKey);
  }
}
