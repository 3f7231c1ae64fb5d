/*
 * どこで: Matching API リクエスト DTO
 * 何を: 実ユーザー登録の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.skillswap.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterUserRequest(@NotBlank @Size(max = 100) String displayName) {}
