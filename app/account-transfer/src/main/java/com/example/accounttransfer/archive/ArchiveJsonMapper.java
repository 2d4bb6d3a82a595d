package com.example.accounttransfer.archive;

import com.example.accounttransfer.model.RecordAttributes;
import com.example.accounttransfer.model.TransferRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps records to and from the JSON array stored inside an archive.
 *
 * <p>Reading is lenient: fields outside the known record shape are kept as metadata, and the
 * column names used by archives of the previous exporter are accepted as aliases. Roles written
 * under {@code wp_capabilities} are moved to the configured roles key unless that key is present.
 */
class ArchiveJsonMapper {

  static final String FIELD_KEY = "key";
  static final String FIELD_CREDENTIAL_HASH = "credentialHash";
  static final String FIELD_EMAIL = "email";
  static final String FIELD_URL = "url";
  static final String FIELD_NICE_KEY = "niceKey";
  static final String FIELD_DISPLAY_NAME = "displayName";
  static final String FIELD_FIRST_NAME = "firstName";
  static final String FIELD_LAST_NAME = "lastName";
  static final String FIELD_DESCRIPTION = "description";
  static final String FIELD_REGISTERED_AT = "registeredAt";
  static final String FIELD_METADATA = "metadata";

  // 旧エクスポーターはロールを user_meta_data.wp_capabilities に書く
  static final String LEGACY_ROLES_KEY = "wp_capabilities";

  private static final Map<String, String> LEGACY_ALIASES = legacyAliases();

  private final ObjectMapper objectMapper;
  private final String rolesMetadataKey;

  ArchiveJsonMapper(ObjectMapper objectMapper, String rolesMetadataKey) {
    this.objectMapper = objectMapper;
    this.rolesMetadataKey = rolesMetadataKey;
  }

  ArrayNode toJson(List<TransferRecord> records) {
    final ArrayNode array = objectMapper.createArrayNode();
    for (TransferRecord record : records) {
      final ObjectNode node = array.addObject();
      node.put(FIELD_KEY, record.key());
      putIfPresent(node, FIELD_CREDENTIAL_HASH, record.credentialHash());
      final RecordAttributes attributes = record.attributes();
      putIfPresent(node, FIELD_EMAIL, attributes.email());
      putIfPresent(node, FIELD_URL, attributes.url());
      putIfPresent(node, FIELD_NICE_KEY, attributes.niceKey());
      putIfPresent(node, FIELD_DISPLAY_NAME, attributes.displayName());
      putIfPresent(node, FIELD_FIRST_NAME, attributes.firstName());
      putIfPresent(node, FIELD_LAST_NAME, attributes.lastName());
      putIfPresent(node, FIELD_DESCRIPTION, attributes.description());
      putIfPresent(node, FIELD_REGISTERED_AT, attributes.registeredAt());
      node.set(FIELD_METADATA, objectMapper.valueToTree(record.metadata()));
    }
    return array;
  }

  List<TransferRecord> fromJson(JsonNode root) {
    if (root == null || !root.isArray()) {
      throw new CodecException(
          CodecErrorCode.PARSE_FAILED, "archive payload is not a list of records");
    }
    final List<TransferRecord> records = new ArrayList<>(root.size());
    int position = 0;
    for (JsonNode element : root) {
      position++;
      if (!element.isObject()) {
        throw new CodecException(
            CodecErrorCode.PARSE_FAILED, "archive entry #" + position + " is not an object");
      }
      records.add(toRecord(element));
    }
    return records;
  }

  private TransferRecord toRecord(JsonNode node) {
    final Set<String> consumed = new HashSet<>();
    final String key = text(node, FIELD_KEY, consumed);
    final String credentialHash = text(node, FIELD_CREDENTIAL_HASH, consumed);
    final RecordAttributes attributes =
        new RecordAttributes(
            text(node, FIELD_EMAIL, consumed),
            text(node, FIELD_URL, consumed),
            text(node, FIELD_NICE_KEY, consumed),
            text(node, FIELD_DISPLAY_NAME, consumed),
            text(node, FIELD_FIRST_NAME, consumed),
            text(node, FIELD_LAST_NAME, consumed),
            text(node, FIELD_DESCRIPTION, consumed),
            text(node, FIELD_REGISTERED_AT, consumed));
    final JsonNode metadataNode = field(node, FIELD_METADATA, consumed);

    final Map<String, Object> metadata = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> entry = fields.next();
      if (!consumed.contains(entry.getKey())) {
        metadata.put(entry.getKey(), toValue(entry.getValue()));
      }
    }
    if (metadataNode != null && metadataNode.isObject()) {
      // metadata オブジェクト側の値を優先する
      final Iterator<Map.Entry<String, JsonNode>> entries = metadataNode.fields();
      while (entries.hasNext()) {
        final Map.Entry<String, JsonNode> entry = entries.next();
        metadata.put(entry.getKey(), toValue(entry.getValue()));
      }
    } else if (metadataNode != null && !metadataNode.isNull()) {
      metadata.put(FIELD_METADATA, toValue(metadataNode));
    }
    renameLegacyRoles(metadata);
    return new TransferRecord(key, credentialHash, attributes, metadata);
  }

  private void renameLegacyRoles(Map<String, Object> metadata) {
    if (LEGACY_ROLES_KEY.equals(rolesMetadataKey)
        || !metadata.containsKey(LEGACY_ROLES_KEY)
        || metadata.containsKey(rolesMetadataKey)) {
      return;
    }
    metadata.put(rolesMetadataKey, metadata.remove(LEGACY_ROLES_KEY));
  }

  private JsonNode field(JsonNode node, String name, Set<String> consumed) {
    consumed.add(name);
    final String alias = LEGACY_ALIASES.get(name);
    if (alias != null) {
      consumed.add(alias);
    }
    final JsonNode value = node.get(name);
    if ((value == null || value.isNull()) && alias != null && node.has(alias)) {
      return node.get(alias);
    }
    return value;
  }

  private String text(JsonNode node, String name, Set<String> consumed) {
    final JsonNode value = field(node, name, consumed);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }

  private Object toValue(JsonNode node) {
    return objectMapper.convertValue(node, Object.class);
  }

  private static void putIfPresent(ObjectNode node, String name, String value) {
    if (value != null) {
      node.put(name, value);
    }
  }

  private static Map<String, String> legacyAliases() {
    final Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put(FIELD_KEY, "user_login");
    aliases.put(FIELD_CREDENTIAL_HASH, "user_pass");
    aliases.put(FIELD_EMAIL, "user_email");
    aliases.put(FIELD_URL, "user_url");
    aliases.put(FIELD_NICE_KEY, "user_nicename");
    aliases.put(FIELD_DISPLAY_NAME, "display_name");
    aliases.put(FIELD_FIRST_NAME, "first_name");
    aliases.put(FIELD_LAST_NAME, "last_name");
    aliases.put(FIELD_REGISTERED_AT, "user_registered");
    aliases.put(FIELD_METADATA, "user_meta_data");
    return Map.copyOf(aliases);
  }
}
