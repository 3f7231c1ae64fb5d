/*
 * どこで: Matching ドメインモデル
 * 何を: users テーブル相当のレコード (実ユーザー/合成ユーザー共通)
 * なぜ: Repository と Service 間で受け渡す構造を固定するため
 */
package com.skillswap.matching.model;

import java.time.Instant;

public record UserRecord(
    long userId,
    String displayName,
    Double latitude,
    Double longitude,
    boolean synthetic,
    Long ownerUserId,
    Instant createdAt) {

  public boolean hasLocation() {
    return latitude != null && longitude != null;
  }

  public boolean isOwnedBy(long ownerId) {
    return synthetic && ownerUserId != null && ownerUserId == ownerId;
  }
}
