/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/archive/ArchiveCodec.java
 * 何を: レコード列 <-> .k7 アーカイブのバイト列を相互変換する
 * なぜ: JSON 化・圧縮・暗号化の各段階の失敗を区別して呼び出し側へ返すため
 */
package com.example.accounttransfer.archive;

import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.TransferRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.springframework.stereotype.Component;

@Component
public class ArchiveCodec {

  public static final String FILE_EXTENSION = "k7";

  private final ArchiveEncryptionService encryptionService;
  private final ObjectMapper objectMapper;
  private final ObjectReader strictReader;
  private final ArchiveJsonMapper jsonMapper;

  public ArchiveCodec(
      ArchiveEncryptionService encryptionService,
      ObjectMapper objectMapper,
      TransferProperties properties) {
    this.encryptionService = encryptionService;
    this.objectMapper = objectMapper;
    // 配列の後ろに続くトークンも解析失敗とする
    this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.jsonMapper = new ArchiveJsonMapper(objectMapper, properties.rolesMetadataKey());
  }

  /**
   * 役割: レコード列を JSON → gzip(最大圧縮) → 暗号化し、base64 テキストのバイト列を返す。
   *
   * <p>期待動作: どの段階で失敗しても CodecException を投げ、途中までの出力は返さない。
   */
  public byte[] seal(List<TransferRecord> records, String password) {
    final byte[] json = serialize(records);
    final byte[] compressed = compress(json);
    try {
      return encryptionService.seal(compressed, password).encodeToBytes();
    } catch (CryptoException ex) {
      throw new CodecException(CodecErrorCode.ENCRYPT_FAILED, ex.getMessage(), ex);
    }
  }

  /**
   * 役割: アーカイブを復号 → 展開 → JSON 解析し、格納順のままレコード列を返す。
   *
   * <p>期待動作: 復号段階の失敗は CryptoException のまま伝播し、展開/解析の失敗は CodecException とする。
   */
  public List<TransferRecord> open(byte[] archive, String password) {
    final String encoded =
        archive == null ? "" : new String(archive, StandardCharsets.US_ASCII);
    final byte[] compressed = encryptionService.open(encoded, password);
    final byte[] json = decompress(compressed);
    return parse(json);
  }

  private byte[] serialize(List<TransferRecord> records) {
    try {
      return objectMapper.writeValueAsBytes(jsonMapper.toJson(records));
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new CodecException(
          CodecErrorCode.SERIALIZE_FAILED, "failed to encode records as JSON", ex);
    }
  }

  private byte[] compress(byte[] data) {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new MaxCompressionGzipOutputStream(buffer)) {
      gzip.write(data);
    } catch (IOException ex) {
      throw new CodecException(CodecErrorCode.COMPRESS_FAILED, "failed to compress archive", ex);
    }
    return buffer.toByteArray();
  }

  private byte[] decompress(byte[] data) {
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
      return gzip.readAllBytes();
    } catch (IOException ex) {
      throw new CodecException(
          CodecErrorCode.DECOMPRESS_FAILED,
          "decrypted archive is not a valid compressed stream",
          ex);
    }
  }

  private List<TransferRecord> parse(byte[] json) {
    final JsonNode root;
    try {
      root = strictReader.readTree(json);
    } catch (IOException ex) {
      throw new CodecException(CodecErrorCode.PARSE_FAILED, "archive payload is not JSON", ex);
    }
    return jsonMapper.fromJson(root);
  }

  private static final class MaxCompressionGzipOutputStream extends GZIPOutputStream {

    MaxCompressionGzipOutputStream(OutputStream out) throws IOException {
      super(out);
      def.setLevel(Deflater.BEST_COMPRESSION);
    }
  }
}
