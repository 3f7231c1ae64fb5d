/*
 * どこで: Matching サービス (デモ母集団)
 * 何を: オーナーごとの合成ユーザーコホートを生成/再配置/削除し、相補的な相手を保証する
 * なぜ: 1 人のテスターだけで interest → meeting → confirm の全フローを試せるようにするため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.api.UserNotFoundException;
import com.skillswap.matching.config.DemoProperties;
import com.skillswap.matching.model.CohortMemberPlan;
import com.skillswap.matching.model.GeoPoint;
import com.skillswap.matching.model.SeedOutcome;
import com.skillswap.matching.model.SeedResult;
import com.skillswap.matching.model.UserRecord;
import com.skillswap.matching.model.UserSkills;
import com.skillswap.matching.repository.AdvisoryLockRepository;
import com.skillswap.matching.repository.SkillAssignmentRepository;
import com.skillswap.matching.repository.UserRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SeedService {

  private static final Logger logger = LoggerFactory.getLogger(SeedService.class);

  private final UserRepository userRepository;
  private final SkillAssignmentRepository skillRepository;
  private final AdvisoryLockRepository lockRepository;
  private final LockKeyGenerator lockKeyGenerator;
  private final GeoService geoService;
  private final DemoCohortPlanner planner;
  private final SyntheticNamePool namePool;
  private final SkillCatalog skillCatalog;
  private final DemoProperties properties;
  private final SkillSwapMetrics metrics;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RandomGenerator は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RandomGenerator random;

  public SeedService(
      UserRepository userRepository,
      SkillAssignmentRepository skillRepository,
      AdvisoryLockRepository lockRepository,
      LockKeyGenerator lockKeyGenerator,
      GeoService geoService,
      DemoCohortPlanner planner,
      SyntheticNamePool namePool,
      SkillCatalog skillCatalog,
      DemoProperties properties,
      SkillSwapMetrics metrics,
      Clock clock,
      RandomGenerator random) {
    this.userRepository = userRepository;
    this.skillRepository = skillRepository;
    this.lockRepository = lockRepository;
    this.lockKeyGenerator = lockKeyGenerator;
    this.geoService = geoService;
    this.planner = planner;
    this.namePool = namePool;
    this.skillCatalog = skillCatalog;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.random = random;
  }

  public boolean isDemoEnabled() {
    return properties.enabled();
  }

  /**
   * 役割: オーナーのコホートを用意する冪等なエントリポイント。
   * 動作: 既に合成ユーザーを保有していれば位置だけを引き直し (RELOCATED)、
   * 無ければ全件生成して相補的な相手を保証する (SEEDED)。デモ無効時は何もしない (SKIPPED)。
   * 「シード済み」は保有件数 > 0 から導出し、別のフラグは持たない。
   */
  @Transactional
  public SeedResult seedForOwner(long ownerId, Double latitude, Double longitude) {
    geoService.validateCoordinates(latitude, longitude);
    final UserRecord owner = requireRealOwner(ownerId);
    if (!properties.enabled()) {
      metrics.recordSeedOutcome(SeedOutcome.SKIPPED);
      return new SeedResult(SeedOutcome.SKIPPED, userRepository.countSyntheticByOwner(ownerId));
    }
    lockOwner(ownerId);
    final GeoPoint center = new GeoPoint(latitude, longitude);
    final List<UserRecord> existing = userRepository.findSyntheticByOwner(ownerId);
    if (!existing.isEmpty()) {
      relocate(existing, center);
      metrics.recordSeedOutcome(SeedOutcome.RELOCATED);
      logger.info("demo cohort relocated ownerId={} size={}", ownerId, existing.size());
      return new SeedResult(SeedOutcome.RELOCATED, existing.size());
    }
    final List<CohortMemberPlan> plans = planner.planCohort(skillCatalog.skills());
    final List<GeoPoint> points = planner.placeAround(center, plans.size());
    final List<String> names = namePool.draw(plans.size(), List.of(), random);
    final Instant now = clock.instant();
    for (int i = 0; i < plans.size(); i++) {
      insertSynthetic(owner.userId(), names.get(i), plans.get(i), points.get(i), now);
    }
    final UserSkills ownerSkills = skillRepository.findByUserId(ownerId);
    final int adjusted = ensureComplementary(ownerId, ownerSkills, center);
    final int size = userRepository.countSyntheticByOwner(ownerId);
    metrics.recordSeedOutcome(SeedOutcome.SEEDED);
    metrics.recordCohortSize(size);
    logger.info(
        "demo cohort seeded ownerId={} size={} complementaryAdjusted={}",
        ownerId,
        size,
        adjusted);
    return new SeedResult(SeedOutcome.SEEDED, size);
  }

  /** オーナーの合成ユーザーの位置だけを引き直す。スキル/興味/ミーティングは保持する。 */
  @Transactional
  public int relocateForOwner(long ownerId, Double latitude, Double longitude) {
    geoService.validateCoordinates(latitude, longitude);
    requireRealOwner(ownerId);
    lockOwner(ownerId);
    final List<UserRecord> existing = userRepository.findSyntheticByOwner(ownerId);
    relocate(existing, new GeoPoint(latitude, longitude));
    logger.info("demo cohort relocated ownerId={} size={}", ownerId, existing.size());
    return existing.size();
  }

  /**
   * 役割: オーナーが need する各スキル n について、n を offer しつつオーナーの offer を need する
   * 合成ユーザーが少なくとも 1 人いる状態にする。
   * 動作: 既存ユーザーの need を付け替えられればそれを優先し、できなければ被覆上限とコホート上限の範囲で
   * 新しいユーザーを追加する。保証用ユーザーもスキルごとの被覆上限に数える。
   * 返り値は付け替え/追加したユーザー数。
   */
  @Transactional
  public int ensureComplementaryMatches(
      long ownerId, Set<String> ownerOffers, Set<String> ownerNeeds, GeoPoint ownerLocation) {
    if (!properties.enabled() || ownerOffers.isEmpty() || ownerNeeds.isEmpty()) {
      return 0;
    }
    lockOwner(ownerId);
    return ensureComplementary(ownerId, new UserSkills(ownerOffers, ownerNeeds), ownerLocation);
  }

  /** オーナーの合成ユーザーを削除する。関連する興味/ミーティング/スキルはカスケードで消える。 */
  @Transactional
  public int resetForOwner(long ownerId) {
    requireRealOwner(ownerId);
    lockOwner(ownerId);
    final int deleted = userRepository.deleteSyntheticByOwner(ownerId);
    logger.info("demo cohort reset ownerId={} deleted={}", ownerId, deleted);
    return deleted;
  }

  public int countSyntheticUsers(long ownerId) {
    requireRealOwner(ownerId);
    return userRepository.countSyntheticByOwner(ownerId);
  }

  /** 計画済みの offer/need を持つ合成ユーザー 1 人を、オーナーの周囲に配置して作成する。 */
  @Transactional
  public UserRecord generateSyntheticUser(
      long ownerId, String name, CohortMemberPlan plan, GeoPoint ownerLocation) {
    return insertSynthetic(ownerId, name, plan, planner.placeOne(ownerLocation), clock.instant());
  }

  private int ensureComplementary(long ownerId, UserSkills ownerSkills, GeoPoint ownerLocation) {
    if (!ownerSkills.hasOffersAndNeeds()) {
      return 0;
    }
    final List<UserRecord> owned = new ArrayList<>(userRepository.findSyntheticByOwner(ownerId));
    final List<Long> ownedIds = owned.stream().map(UserRecord::userId).toList();
    final Map<Long, UserSkills> skillsById =
        new HashMap<>(skillRepository.findByUserIds(ownedIds));
    final Map<String, Integer> coverage =
        new HashMap<>(skillRepository.countOffersBySkillForOwner(ownerId));
    final List<String> ownerOffers = skillCatalog.inCatalogOrder(ownerSkills.offers());
    int adjusted = 0;
    for (String need : skillCatalog.inCatalogOrder(ownerSkills.needs())) {
      if (hasCounterpart(owned, skillsById, need, ownerSkills.offers())) {
        continue;
      }
      final String offer = RandomSelections.pick(ownerOffers, random);
      final Optional<UserRecord> retargetable =
          findRetargetable(owned, skillsById, need, ownerOffers);
      if (retargetable.isPresent()) {
        final UserRecord user = retargetable.get();
        final UserSkills current = skillsById.get(user.userId());
        final String target =
            current.offers().contains(offer) ? firstUsable(current, ownerOffers) : offer;
        final Set<String> needs = retargetNeeds(current.needs(), target);
        skillRepository.replaceNeeds(user.userId(), needs);
        skillsById.put(user.userId(), new UserSkills(current.offers(), needs));
        adjusted++;
        continue;
      }
      if (coverage.getOrDefault(need, 0) >= properties.maxOfferCoverage()
          || owned.size() >= properties.maxCohortSize()
          || ownerLocation == null) {
        logger.warn(
            "complementary counterpart skipped ownerId={} skill={} coverage={} cohortSize={}",
            ownerId,
            need,
            coverage.getOrDefault(need, 0),
            owned.size());
        continue;
      }
      final List<String> takenNames = owned.stream().map(UserRecord::displayName).toList();
      final String name = namePool.draw(1, takenNames, random).get(0);
      final CohortMemberPlan plan = new CohortMemberPlan(Set.of(need), Set.of(offer));
      final UserRecord created = generateSyntheticUser(ownerId, name, plan, ownerLocation);
      owned.add(created);
      skillsById.put(created.userId(), new UserSkills(plan.offers(), plan.needs()));
      coverage.merge(need, 1, Integer::sum);
      adjusted++;
    }
    return adjusted;
  }

  private boolean hasCounterpart(
      List<UserRecord> owned, Map<Long, UserSkills> skillsById, String need, Set<String> offers) {
    for (UserRecord user : owned) {
      final UserSkills skills = skillsById.getOrDefault(user.userId(), UserSkills.empty());
      if (skills.offers().contains(need)
          && !UserSkills.intersection(skills.needs(), offers).isEmpty()) {
        return true;
      }
    }
    return false;
  }

  // need を offer していて、かつオーナーの offer のどれかを need に加えられる (自分で offer していない) ユーザー
  private Optional<UserRecord> findRetargetable(
      List<UserRecord> owned,
      Map<Long, UserSkills> skillsById,
      String need,
      List<String> ownerOffers) {
    return owned.stream()
        .filter(
            user -> {
              final UserSkills skills = skillsById.getOrDefault(user.userId(), UserSkills.empty());
              return skills.offers().contains(need) && firstUsable(skills, ownerOffers) != null;
            })
        .findFirst();
  }

  private static String firstUsable(UserSkills skills, List<String> ownerOffers) {
    return ownerOffers.stream().filter(o -> !skills.offers().contains(o)).findFirst().orElse(null);
  }

  private Set<String> retargetNeeds(Set<String> currentNeeds, String target) {
    final Set<String> needs = new LinkedHashSet<>();
    if (currentNeeds.size() >= DemoCohortPlanner.MAX_NEEDS_PER_USER) {
      // 1 件残して 1 件を差し替える
      final List<String> ordered = skillCatalog.inCatalogOrder(currentNeeds);
      needs.add(RandomSelections.pick(ordered, random));
    } else {
      needs.addAll(currentNeeds);
    }
    needs.add(target);
    return needs;
  }

  private void relocate(List<UserRecord> users, GeoPoint center) {
    final List<GeoPoint> points = planner.placeAround(center, users.size());
    for (int i = 0; i < users.size(); i++) {
      final GeoPoint point = points.get(i);
      userRepository.updateLocation(users.get(i).userId(), point.latitude(), point.longitude());
    }
  }

  private UserRecord insertSynthetic(
      long ownerId, String name, CohortMemberPlan plan, GeoPoint point, Instant now) {
    final UserRecord user =
        userRepository.insertSyntheticUser(
            ownerId, name, point.latitude(), point.longitude(), now);
    skillRepository.insertAll(user.userId(), plan.offers(), plan.needs());
    return user;
  }

  private UserRecord requireRealOwner(long ownerId) {
    final UserRecord owner =
        userRepository.findById(ownerId).orElseThrow(() -> new UserNotFoundException(ownerId));
    if (owner.synthetic()) {
      throw new InvalidSkillSwapRequestException(
          "userId", "synthetic users cannot own a demo cohort");
    }
    return owner;
  }

  private void lockOwner(long ownerId) {
    lockRepository.lockByKey(lockKeyGenerator.forOwner(ownerId));
  }
}
