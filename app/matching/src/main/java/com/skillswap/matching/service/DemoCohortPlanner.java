/*
 * どこで: Matching サービス (デモ母集団)
 * 何を: スキル被覆数の割り当て、合成ユーザーへの offer/need の詰め込み、配置の分散判定を行う
 * なぜ: ストアに触れない計算部分を分離し、乱数を固定して検証できるようにするため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.config.DemoProperties;
import com.skillswap.matching.model.CohortMemberPlan;
import com.skillswap.matching.model.GeoPoint;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class DemoCohortPlanner {

  static final int MAX_OFFERS_PER_USER = 2;
  static final int MAX_NEEDS_PER_USER = 2;

  private final DemoProperties properties;
  private final GeoService geoService;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RandomGenerator は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RandomGenerator random;

  public DemoCohortPlanner(
      DemoProperties properties, GeoService geoService, RandomGenerator random) {
    this.properties = properties;
    this.geoService = geoService;
    this.random = random;
  }

  /**
   * 役割: 各スキルを何人の合成ユーザーが offer するか (1..maxOfferCoverage) を決める。
   * 動作: カタログをシャッフルして各スキルに独立に件数を引き、offer スロット総数が
   * [minCohortSize, maxCohortSize] 人 (1 人 1..2 offer) に詰め込めない場合は件数をランダムに上下させる。
   * 返り値はシャッフル後の順序を保った LinkedHashMap。
   */
  public Map<String, Integer> skillCoverageAssignment(List<String> catalog) {
    requireUsableCatalog(catalog);
    final List<String> shuffled = RandomSelections.shuffled(catalog, random);
    final Map<String, Integer> coverage = new LinkedHashMap<>();
    for (String skill : shuffled) {
      coverage.put(skill, RandomSelections.between(1, properties.maxOfferCoverage(), random));
    }
    final int maxSlots = properties.maxCohortSize() * MAX_OFFERS_PER_USER;
    while (totalSlots(coverage) > maxSlots) {
      final List<String> reducible =
          coverage.entrySet().stream()
              .filter(e -> e.getValue() > 1)
              .map(Map.Entry::getKey)
              .toList();
      if (reducible.isEmpty()) {
        // カタログが大きすぎる場合は被覆 1 件ずつを優先する
        break;
      }
      coverage.merge(RandomSelections.pick(reducible, random), -1, Integer::sum);
    }
    while (totalSlots(coverage) < properties.minCohortSize()) {
      final List<String> growable =
          coverage.entrySet().stream()
              .filter(e -> e.getValue() < properties.maxOfferCoverage())
              .map(Map.Entry::getKey)
              .toList();
      if (growable.isEmpty()) {
        break;
      }
      coverage.merge(RandomSelections.pick(growable, random), 1, Integer::sum);
    }
    return coverage;
  }

  /** カタログ全体を被覆するコホート (offer/need 済み) を計画する。 */
  public List<CohortMemberPlan> planCohort(List<String> catalog) {
    final Map<String, Integer> coverage = skillCoverageAssignment(catalog);
    final List<Set<String>> offerSets = packOffers(coverage);
    final List<CohortMemberPlan> plans = new ArrayList<>(offerSets.size());
    for (Set<String> offers : offerSets) {
      plans.add(new CohortMemberPlan(offers, drawNeeds(catalog, offers)));
    }
    return plans;
  }

  /**
   * 役割: offer スロットを 1..2 スキルずつユーザーへ詰め込む。
   * 動作: 人数 U を実現可能な範囲から一様に選び、S - U 組のペアを「残数の多い 2 スキル」から貪欲に作る。
   * 同じユーザーが同じスキルを 2 回 offer することはない。
   */
  List<Set<String>> packOffers(Map<String, Integer> coverage) {
    final int slots = totalSlots(coverage);
    final int lower = Math.max(properties.minCohortSize(), (slots + 1) / 2);
    final int upper = Math.min(properties.maxCohortSize(), slots);
    final int userCount;
    if (slots < properties.minCohortSize()) {
      userCount = slots;
    } else if (lower > upper) {
      userCount = lower;
    } else {
      userCount = RandomSelections.between(lower, upper, random);
    }
    final Map<String, Integer> remaining = new LinkedHashMap<>(coverage);
    final List<Set<String>> users = new ArrayList<>(userCount);
    final int pairs = slots - userCount;
    for (int i = 0; i < pairs; i++) {
      final List<String> ranked = rankByRemaining(remaining);
      final String first = ranked.get(0);
      final String second = ranked.get(1);
      remaining.merge(first, -1, Integer::sum);
      remaining.merge(second, -1, Integer::sum);
      users.add(new LinkedHashSet<>(List.of(first, second)));
    }
    for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
      for (int i = 0; i < entry.getValue(); i++) {
        users.add(new LinkedHashSet<>(List.of(entry.getKey())));
      }
    }
    return RandomSelections.shuffled(users, random);
  }

  /** offers を除いたカタログから 1..2 件の need を引く。 */
  public Set<String> drawNeeds(List<String> catalog, Set<String> offers) {
    final List<String> available = catalog.stream().filter(s -> !offers.contains(s)).toList();
    if (available.isEmpty()) {
      throw new IllegalStateException("no skill left to need outside of " + offers);
    }
    final int count =
        Math.min(available.size(), RandomSelections.between(1, MAX_NEEDS_PER_USER, random));
    return new LinkedHashSet<>(RandomSelections.shuffled(available, random).subList(0, count));
  }

  /**
   * 役割: center の周囲 [minDistance, maxDistance] に count 人分の位置を引く。
   * 動作: 距離の標準偏差が下限以下なら全員分を引き直す (placementAttempts 回まで)。
   */
  public List<GeoPoint> placeAround(GeoPoint center, int count) {
    List<GeoPoint> points = List.of();
    for (int attempt = 0; attempt < properties.placementAttempts(); attempt++) {
      points = drawPoints(center, count);
      if (count < 2 || distanceStdDev(center, points) > properties.minDistanceStdDevMiles()) {
        return points;
      }
    }
    return points;
  }

  public GeoPoint placeOne(GeoPoint center) {
    return geoService.randomPointNear(
        center, properties.minDistanceMiles(), properties.maxDistanceMiles());
  }

  double distanceStdDev(GeoPoint center, List<GeoPoint> points) {
    final List<Double> distances =
        points.stream().map(point -> geoService.distance(center, point)).toList();
    return standardDeviation(distances);
  }

  /** 母標準偏差。要素が 0 件なら 0。 */
  static double standardDeviation(List<Double> values) {
    if (values.isEmpty()) {
      return 0.0;
    }
    final double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    double sumSquares = 0.0;
    for (double value : values) {
      sumSquares += (value - mean) * (value - mean);
    }
    return Math.sqrt(sumSquares / values.size());
  }

  private List<GeoPoint> drawPoints(GeoPoint center, int count) {
    final List<GeoPoint> points = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      points.add(placeOne(center));
    }
    return points;
  }

  private List<String> rankByRemaining(Map<String, Integer> remaining) {
    // 同数の場合の偏りを避けるため、シャッフル後に安定ソートする
    final List<String> candidates =
        RandomSelections.shuffled(
            remaining.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .toList(),
            random);
    candidates.sort(Comparator.comparing(remaining::get, Comparator.reverseOrder()));
    if (candidates.size() < 2) {
      throw new IllegalStateException("cannot pair offers from fewer than two skills");
    }
    return candidates;
  }

  private static int totalSlots(Map<String, Integer> coverage) {
    return coverage.values().stream().mapToInt(Integer::intValue).sum();
  }

  private static void requireUsableCatalog(List<String> catalog) {
    if (catalog.size() < 2) {
      throw new IllegalStateException("skill catalog needs at least two skills to build a cohort");
    }
  }
}
