/*
 * どこで: Matching ドメインモデル
 * 何を: meetings テーブル相当のレコード
 * なぜ: 状態遷移の判定に必要な参加者/提案者/確認フラグをまとめて扱うため
 */
package com.skillswap.matching.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public record MeetingRecord(
    long meetingId,
    long userLowId,
    long userHighId,
    long proposerId,
    String location,
    LocalDate proposedDate,
    LocalTime proposedTime,
    MeetingStatus status,
    boolean confirmedByLow,
    boolean confirmedByHigh,
    Instant createdAt,
    Instant updatedAt) {

  public PairId pairId() {
    return new PairId(userLowId, userHighId);
  }

  public boolean isParticipant(long userId) {
    return userId == userLowId || userId == userHighId;
  }

  public long otherParticipant(long userId) {
    return pairId().other(userId);
  }

  public boolean isConfirmedBy(long userId) {
    return userId == userLowId ? confirmedByLow : confirmedByHigh;
  }

  public boolean bothConfirmed() {
    return confirmedByLow && confirmedByHigh;
  }
}
