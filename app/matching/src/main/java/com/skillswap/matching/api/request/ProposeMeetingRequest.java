/*
 * どこで: Matching API リクエスト DTO
 * 何を: ミーティング提案の入力を定義する
 * なぜ: 日付 (yyyy-MM-dd) と時刻 (HH:mm) は文字列で受け、サービス側でフィールド名付きで検証するため
 */
package com.skillswap.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposeMeetingRequest(
    @NotBlank String pairId,
    @NotBlank String location,
    @NotBlank String proposedDate,
    @NotBlank String proposedTime) {}
