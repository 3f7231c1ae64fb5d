/*
 * どこで: Matching API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.skillswap.matching.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  USER_NOT_FOUND,
  MEETING_NOT_FOUND,
  FORBIDDEN,
  INTERNAL_ERROR
}
