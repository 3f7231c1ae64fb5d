/*
 * どこで: Matching API レスポンス DTO
 * 何を: 相互マッチ 1 件 (相手/交換スキル/ミーティング状態) を定義する
 * なぜ: meeting_status が none の場合も含めて共通構造で返すため
 */
package com.skillswap.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MutualMatchResponse(
    String pairId,
    MatchedUserPayload otherUser,
    SkillExchangePayload skillsExchange,
    String meetingStatus,
    Long meetingId,
    String matchedAt) {}
