/*
 * どこで: Matching API リクエスト DTO
 * 何を: offer/need スキルの全置換の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.skillswap.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotNull;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record UpdateSkillsRequest(@NotNull List<String> offers, @NotNull List<String> needs) {}
