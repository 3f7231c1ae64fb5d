/*
 * どこで: Matching API レスポンス DTO
 * 何を: 探索結果の候補 1 件を定義する
 * なぜ: 双方向に噛み合うスキルと興味フラグを一覧画面へそのまま渡すため
 */
package com.skillswap.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record MatchCandidateResponse(
    long userId,
    String name,
    double distance,
    List<String> theyOffer,
    List<String> theyNeed,
    boolean myInterest,
    boolean theirInterest,
    boolean synthetic) {}
