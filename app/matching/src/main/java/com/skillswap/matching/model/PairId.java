/*
 * どこで: Matching ドメインモデル
 * 何を: 2 ユーザーの正規化されたペア識別子 ("小さい id-大きい id") を表現する
 * なぜ: どちらが先に操作してもペア単位の状態 (ミーティング/ロック) を同じキーで扱うため
 */
package com.skillswap.matching.model;

public record PairId(long lowUserId, long highUserId) {

  public PairId {
    if (lowUserId >= highUserId) {
      throw new IllegalArgumentException("pair must consist of two distinct ordered user ids");
    }
  }

  public static PairId of(long userA, long userB) {
    return new PairId(Math.min(userA, userB), Math.max(userA, userB));
  }

  /**
   * 役割: API で受け取った pair id 文字列を内部表現へ変換する。
   * 動作: "低 id-高 id" 以外の形式 (順序逆転/同一 id/非数値) は IllegalArgumentException を送出する。
   */
  public static PairId parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("pair id is required");
    }
    final int separator = value.indexOf('-');
    if (separator <= 0 || separator == value.length() - 1) {
      throw new IllegalArgumentException("invalid pair id: " + value);
    }
    try {
      final long low = Long.parseLong(value.substring(0, separator));
      final long high = Long.parseLong(value.substring(separator + 1));
      return new PairId(low, high);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid pair id: " + value, ex);
    }
  }

  public boolean contains(long userId) {
    return userId == lowUserId || userId == highUserId;
  }

  public long other(long userId) {
    if (userId == lowUserId) {
      return highUserId;
    }
    if (userId == highUserId) {
      return lowUserId;
    }
    throw new IllegalArgumentException("user " + userId + " is not part of pair " + value());
  }

  public String value() {
    return lowUserId + "-" + highUserId;
  }

  @Override
  public String toString() {
    return value();
  }
}
