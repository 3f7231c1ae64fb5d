/*
 * どこで: Matching API
 * 何を: 呼び出しユーザーのデモ母集団 (合成ユーザー) の生成/状態/削除のエンドポイントを公開する
 * なぜ: 位置更新を待たずにシード/再配置をやり直せるようにするため
 */
package com.skillswap.matching.api;

import com.skillswap.matching.api.request.SeedDemoRequest;
import com.skillswap.matching.api.response.DemoResetResponse;
import com.skillswap.matching.api.response.DemoSeedResponse;
import com.skillswap.matching.api.response.DemoStatusResponse;
import com.skillswap.matching.model.SeedResult;
import com.skillswap.matching.service.SeedService;
import jakarta.validation.Valid;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/demo")
@RequiredArgsConstructor
public class DemoController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final SeedService seedService;

  @PostMapping("/seed")
  public ResponseEntity<DemoSeedResponse> seed(
      @RequestHeader(HEADER_USER_ID) long userId, @Valid @RequestBody SeedDemoRequest request) {
    final SeedResult result =
        seedService.seedForOwner(userId, request.latitude(), request.longitude());
    return ResponseEntity.ok(
        new DemoSeedResponse(
            result.outcome().name().toLowerCase(Locale.ROOT), result.syntheticUserCount()));
  }

  @GetMapping("/status")
  public ResponseEntity<DemoStatusResponse> status(@RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(
        new DemoStatusResponse(seedService.isDemoEnabled(), seedService.countSyntheticUsers(userId)));
  }

  @DeleteMapping
  public ResponseEntity<DemoResetResponse> reset(@RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(new DemoResetResponse(seedService.resetForOwner(userId)));
  }
}
