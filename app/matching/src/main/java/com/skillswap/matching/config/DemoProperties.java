/*
 * どこで: Matching 設定
 * 何を: デモ用の合成ユーザー生成パラメータを保持する
 * なぜ: デモモードの有効/無効をプロセス内フラグではなく明示的な設定値として渡すため
 */
package com.skillswap.matching.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "skillswap.demo")
public record DemoProperties(
    boolean enabled,
    @PositiveOrZero double minDistanceMiles,
    @Positive double maxDistanceMiles,
    @Min(1) int minCohortSize,
    @Min(1) int maxCohortSize,
    @Min(1) int maxOfferCoverage,
    @PositiveOrZero double minDistanceStdDevMiles,
    @Min(1) int placementAttempts) {}
