/*
 * どこで: Account Transfer Repository 層
 * 何を: アカウントの参照/作成/更新/メタデータ/ロール操作を抽象化する
 * なぜ: 照合処理をストア実装(JDBC やテスト用実装)から切り離すため
 */
package com.example.accounttransfer.repository;

import com.example.accounttransfer.model.StoredRecord;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.model.UserWriteRequest;
import java.util.List;
import java.util.Optional;

public interface RecordStore {

  /** 役割: 正規化済みキーで既存アカウントを探す。 動作: 見つからなければ empty を返す。 */
  Optional<StoredRecord> findByKey(String key);

  /** 役割: export 用に全アカウントを id 昇順で返す。 動作: メタデータも含めて返す。 */
  List<TransferRecord> findAll();

  /** 役割: 新規アカウントを作成する。 動作: 採番された id を返し、失敗時は StoreException。 */
  long create(UserWriteRequest request);

  /** 役割: 既存アカウントの項目を上書きする。 動作: 対象が無い場合も StoreException。 */
  void update(long id, UserWriteRequest request);

  /** 役割: メタデータ 1 キーを作成または上書きする。 動作: 他のキーには触れない。 */
  void setMetadata(long id, String key, Object value);

  /** 役割: アカウントの全ロールを外す。 動作: ロール用メタデータも合わせて消す。 */
  void clearRoles(long id);
}
