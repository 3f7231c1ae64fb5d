/*
 * どこで: Matching 設定
 * 何を: マッチ候補の探索半径を保持する
 * なぜ: 距離条件をコード外で調整できるようにするため
 */
package com.skillswap.matching.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "skillswap.matching")
public record MatchingProperties(@Positive double radiusMiles) {}
