/*
 * どこで: Matching サービス補助
 * 何を: ペア/オーナー単位の 64-bit advisory lock キーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.model.PairId;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class LockKeyGenerator {

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  static final String PAIR_PREFIX = "pair:";
  static final String OWNER_PREFIX = "owner:";

  /** どちらのユーザーから操作しても同じキーになるよう正規化済みの pair id を使う。 */
  public long forPair(PairId pairId) {
    return generate(PAIR_PREFIX + pairId.value());
  }

  public long forOwner(long ownerUserId) {
    return generate(OWNER_PREFIX + ownerUserId);
  }

  long generate(String source) {
    // ペアとオーナーで名前空間を分けるため、呼び出し側で接頭辞を付けてからハッシュする。
    final byte[] hashed = hash(source);
    // ByteBuffer は Big Endian が既定。言語間での再現性を優先して変更しない。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String source) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(source.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      // JVM が SHA-256 を提供しない場合は実行環境の前提が崩れているため即失敗させる。
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
