/*
 * どこで: Matching API レスポンス DTO
 * 何を: ユーザープロフィール (位置/スキル込み) を定義する
 * なぜ: 位置未設定のユーザーも null で表現して同じ構造で返すため
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
public record UserProfileResponse(
    long userId,
    String displayName,
    Double latitude,
    Double longitude,
    boolean synthetic,
    List<String> offers,
    List<String> needs) {}
