/*
 * どこで: Matching API レスポンス DTO
 * 何を: ミーティングの状態を呼び出しユーザー視点で定義する
 * なぜ: 自分/相手の確認状況とスワップ解放の有無を 1 つの応答で返すため
 */
package com.skillswap.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeetingResponse(
    long meetingId,
    String pairId,
    String location,
    String proposedDate,
    String proposedTime,
    long proposerId,
    String proposerName,
    String status,
    long otherUserId,
    String otherUserName,
    boolean userConfirmed,
    boolean otherConfirmed,
    boolean bothConfirmed,
    boolean swapUnlocked,
    String createdAt) {}
