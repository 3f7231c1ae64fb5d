/*
 * どこで: Matching API
 * 何を: 候補探索/興味表明/相互マッチ一覧/辞退のエンドポイントを公開する
 * なぜ: 興味グラフへの操作を呼び出しユーザー (X-User-Id) 単位で受け付けるため
 */
package com.skillswap.matching.api;

import com.skillswap.matching.api.response.DeclineMatchResponse;
import com.skillswap.matching.api.response.InterestResponse;
import com.skillswap.matching.api.response.MatchCandidateResponse;
import com.skillswap.matching.api.response.MutualMatchResponse;
import com.skillswap.matching.service.MatchService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matches")
@RequiredArgsConstructor
public class MatchController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MatchService matchService;

  @GetMapping("/discover")
  public ResponseEntity<List<MatchCandidateResponse>> discover(
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(matchService.findMatches(userId));
  }

  @PostMapping("/{targetUserId}/interest")
  public ResponseEntity<InterestResponse> expressInterest(
      @PathVariable("targetUserId") long targetUserId,
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(matchService.expressInterest(userId, targetUserId));
  }

  @GetMapping
  public ResponseEntity<List<MutualMatchResponse>> listMutualMatches(
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(matchService.getMutualMatches(userId));
  }

  @DeleteMapping("/{targetUserId}")
  public ResponseEntity<DeclineMatchResponse> declineMatch(
      @PathVariable("targetUserId") long targetUserId,
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(matchService.declineMatch(userId, targetUserId));
  }
}
