/*
 * どこで: Matching API
 * 何を: スキルカタログと実ユーザーのプロフィール/位置/スキルのエンドポイントを公開する
 * なぜ: 位置/スキル更新をデモ母集団のシード契機として受け付ける入口を提供するため
 */
package com.skillswap.matching.api;

import com.skillswap.matching.api.request.RegisterUserRequest;
import com.skillswap.matching.api.request.UpdateLocationRequest;
import com.skillswap.matching.api.request.UpdateProfileRequest;
import com.skillswap.matching.api.request.UpdateSkillsRequest;
import com.skillswap.matching.api.response.SkillCatalogResponse;
import com.skillswap.matching.api.response.UserProfileResponse;
import com.skillswap.matching.api.response.UserSkillsResponse;
import com.skillswap.matching.service.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ProfileController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final ProfileService profileService;

  @GetMapping("/skills")
  public ResponseEntity<SkillCatalogResponse> listSkills() {
    return ResponseEntity.ok(profileService.listSkills());
  }

  @PostMapping("/users")
  public ResponseEntity<UserProfileResponse> register(
      @Valid @RequestBody RegisterUserRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(profileService.register(request.displayName()));
  }

  @GetMapping("/users/me")
  public ResponseEntity<UserProfileResponse> getProfile(
      @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(profileService.getProfile(userId));
  }

  @PutMapping("/users/me")
  public ResponseEntity<UserProfileResponse> updateProfile(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody UpdateProfileRequest request) {
    return ResponseEntity.ok(profileService.updateDisplayName(userId, request.displayName()));
  }

  @PutMapping("/users/me/location")
  public ResponseEntity<UserProfileResponse> updateLocation(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody UpdateLocationRequest request) {
    return ResponseEntity.ok(
        profileService.updateLocation(userId, request.latitude(), request.longitude()));
  }

  @GetMapping("/users/me/skills")
  public ResponseEntity<UserSkillsResponse> getSkills(@RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(profileService.getSkills(userId));
  }

  @PutMapping("/users/me/skills")
  public ResponseEntity<UserSkillsResponse> replaceSkills(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody UpdateSkillsRequest request) {
    return ResponseEntity.ok(
        profileService.replaceSkills(userId, request.offers(), request.needs()));
  }
}
