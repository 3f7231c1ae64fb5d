package com.skillswap.matching.model;

/** シード処理の結果と、処理後にオーナーが保有する合成ユーザー数。 */
public record SeedResult(SeedOutcome outcome, int syntheticUserCount) {}
