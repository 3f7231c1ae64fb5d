/*
 * どこで: Matching ドメインモデル
 * 何を: ミーティングの状態遷移 (proposed → scheduled → completed) を定義する
 * なぜ: DB の CHECK 制約と API 応答の値を一致させるため
 */
package com.skillswap.matching.model;

public enum MeetingStatus {
  PROPOSED("proposed"),
  SCHEDULED("scheduled"),
  COMPLETED("completed");

  /** ミーティングが存在しないペアに対する API 表現。 */
  public static final String NONE = "none";

  private final String value;

  MeetingStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
