/*
 * どこで: Matching ドメインモデル
 * 何を: 興味表明後のペア状態を定義する
 * なぜ: 片側のみ (pending) と双方向 (mutual) を API 応答で区別するため
 */
package com.skillswap.matching.model;

public enum InterestStatus {
  PENDING("pending"),
  MUTUAL("mutual");

  private final String value;

  InterestStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
