/*
 * どこで: Matching サービス
 * 何を: 実ユーザーの登録/プロフィール/位置/スキルの更新を扱う
 * なぜ: 位置とスキルの更新をデモ母集団のシード契機として SeedService に橋渡しするため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.api.UserNotFoundException;
import com.skillswap.matching.api.response.SkillCatalogResponse;
import com.skillswap.matching.api.response.UserProfileResponse;
import com.skillswap.matching.api.response.UserSkillsResponse;
import com.skillswap.matching.model.GeoPoint;
import com.skillswap.matching.model.SeedResult;
import com.skillswap.matching.model.UserRecord;
import com.skillswap.matching.model.UserSkills;
import com.skillswap.matching.repository.SkillAssignmentRepository;
import com.skillswap.matching.repository.UserRepository;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProfileService {

  private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

  static final int MAX_DISPLAY_NAME_LENGTH = 100;

  private final UserRepository userRepository;
  private final SkillAssignmentRepository skillRepository;
  private final SkillCatalog skillCatalog;
  private final GeoService geoService;
  private final SeedService seedService;
  private final SkillSwapMetrics metrics;
  private final Clock clock;

  public SkillCatalogResponse listSkills() {
    return new SkillCatalogResponse(skillCatalog.skills());
  }

  public UserProfileResponse register(String displayName) {
    final UserRecord user =
        userRepository.insertRealUser(validateDisplayName(displayName), clock.instant());
    logger.info("user registered userId={}", user.userId());
    return toProfile(user, UserSkills.empty());
  }

  public UserProfileResponse getProfile(long userId) {
    final UserRecord user = requireUser(userId);
    return toProfile(user, skillRepository.findByUserId(userId));
  }

  public UserProfileResponse updateDisplayName(long userId, String displayName) {
    final String validated = validateDisplayName(displayName);
    final UserRecord user =
        userRepository
            .updateDisplayName(userId, validated)
            .orElseThrow(() -> new UserNotFoundException(userId));
    return toProfile(user, skillRepository.findByUserId(userId));
  }

  /**
   * 役割: 位置を保存し、実ユーザーならデモ母集団のシード/再配置を行う。
   * 動作: 座標検証は変更前に行う。シードの失敗はログとメトリクスに残すだけで、位置更新自体は成功させる。
   */
  public UserProfileResponse updateLocation(long userId, Double latitude, Double longitude) {
    geoService.validateCoordinates(latitude, longitude);
    final UserRecord user =
        userRepository
            .updateLocation(userId, latitude, longitude)
            .orElseThrow(() -> new UserNotFoundException(userId));
    if (!user.synthetic()) {
      try {
        final SeedResult result = seedService.seedForOwner(userId, latitude, longitude);
        logger.debug(
            "seed after location update userId={} outcome={} size={}",
            userId,
            result.outcome(),
            result.syntheticUserCount());
      } catch (RuntimeException ex) {
        metrics.recordSeedFailure("location");
        logger.warn("demo seeding failed after location update userId={}", userId, ex);
      }
    }
    return toProfile(user, skillRepository.findByUserId(userId));
  }

  public UserSkillsResponse getSkills(long userId) {
    requireUser(userId);
    return toSkills(skillRepository.findByUserId(userId));
  }

  /**
   * 役割: offer/need を全置換する。
   * 動作: カタログ外の名前と offer/need の重複を変更前に 400 として弾く。
   * 位置を持つ実ユーザーには、保存後に相補的な合成ユーザーを保証する (失敗は握りつぶさずログに残す)。
   * コホートがまだ無いオーナーはここで初回シードを行う。
   */
  public UserSkillsResponse replaceSkills(long userId, List<String> offers, List<String> needs) {
    final Set<String> validOffers = skillCatalog.requireValid("offers", offers);
    final Set<String> validNeeds = skillCatalog.requireValid("needs", needs);
    final Set<String> overlap = UserSkills.intersection(validOffers, validNeeds);
    if (!overlap.isEmpty()) {
      throw new InvalidSkillSwapRequestException(
          "needs", "cannot also be offered: " + String.join(", ", overlap));
    }
    final UserRecord user = requireUser(userId);
    skillRepository.replaceAll(userId, validOffers, validNeeds);
    final UserSkills saved = new UserSkills(validOffers, validNeeds);
    if (!user.synthetic() && user.hasLocation() && seedService.isDemoEnabled()) {
      try {
        // コホート未生成なら通常のシードに任せる (保存済みスキルを前提に相補ユーザーも作られる)
        if (userRepository.countSyntheticByOwner(userId) == 0) {
          seedService.seedForOwner(userId, user.latitude(), user.longitude());
        } else {
          seedService.ensureComplementaryMatches(
              userId, validOffers, validNeeds, new GeoPoint(user.latitude(), user.longitude()));
        }
      } catch (RuntimeException ex) {
        metrics.recordSeedFailure("skills");
        logger.warn("complementary match update failed userId={}", userId, ex);
      }
    }
    return toSkills(saved);
  }

  private String validateDisplayName(String displayName) {
    if (displayName == null || displayName.isBlank()) {
      throw new InvalidSkillSwapRequestException("displayName", "is required");
    }
    final String trimmed = displayName.trim();
    if (trimmed.length() > MAX_DISPLAY_NAME_LENGTH) {
      throw new InvalidSkillSwapRequestException(
          "displayName", "must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
    }
    return trimmed;
  }

  private UserRecord requireUser(long userId) {
    return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
  }

  private UserProfileResponse toProfile(UserRecord user, UserSkills skills) {
    return new UserProfileResponse(
        user.userId(),
        user.displayName(),
        user.latitude(),
        user.longitude(),
        user.synthetic(),
        skillCatalog.inCatalogOrder(skills.offers()),
        skillCatalog.inCatalogOrder(skills.needs()));
  }

  private UserSkillsResponse toSkills(UserSkills skills) {
    return new UserSkillsResponse(
        skillCatalog.inCatalogOrder(skills.offers()), skillCatalog.inCatalogOrder(skills.needs()));
  }
}
