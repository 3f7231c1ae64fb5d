/*
 * どこで: Matching API
 * 何を: 入力妥当性エラーを表現する
 * なぜ: 変更前に検出した不正入力を 400 へ正規化し、対象フィールドを伝えるため
 */
package com.skillswap.matching.api;

public class InvalidSkillSwapRequestException extends RuntimeException {

  private final String field;

  public InvalidSkillSwapRequestException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String field() {
    return field;
  }
}
