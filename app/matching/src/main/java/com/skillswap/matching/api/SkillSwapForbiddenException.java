/*
 * どこで: Matching API
 * 何を: 現在の状態では許可されない操作を表現する
 * なぜ: 未成立ペアへの操作や自分の提案の承認などを 404 と区別して 403 へ変換するため
 */
package com.skillswap.matching.api;

public class SkillSwapForbiddenException extends RuntimeException {
  public SkillSwapForbiddenException(String message) {
    super(message);
  }
}
