/*
 * どこで: Matching サービス
 * 何を: 相補スキル×距離による候補探索と、有向の興味グラフ (pending/mutual) を管理する
 * なぜ: 「相互成立」をミーティング状態機械の唯一の前提条件として提供するため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.api.UserNotFoundException;
import com.skillswap.matching.api.response.DeclineMatchResponse;
import com.skillswap.matching.api.response.InterestResponse;
import com.skillswap.matching.api.response.MatchCandidateResponse;
import com.skillswap.matching.api.response.MatchedUserPayload;
import com.skillswap.matching.api.response.MutualMatchResponse;
import com.skillswap.matching.api.response.SkillExchangePayload;
import com.skillswap.matching.config.MatchingProperties;
import com.skillswap.matching.model.InterestStatus;
import com.skillswap.matching.model.MeetingRecord;
import com.skillswap.matching.model.MeetingStatus;
import com.skillswap.matching.model.MutualInterestRecord;
import com.skillswap.matching.model.PairId;
import com.skillswap.matching.model.UserRecord;
import com.skillswap.matching.model.UserSkills;
import com.skillswap.matching.repository.AdvisoryLockRepository;
import com.skillswap.matching.repository.InterestRepository;
import com.skillswap.matching.repository.MeetingRepository;
import com.skillswap.matching.repository.SkillAssignmentRepository;
import com.skillswap.matching.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MatchService {

  private static final Logger logger = LoggerFactory.getLogger(MatchService.class);

  private final UserRepository userRepository;
  private final SkillAssignmentRepository skillRepository;
  private final InterestRepository interestRepository;
  private final MeetingRepository meetingRepository;
  private final AdvisoryLockRepository lockRepository;
  private final LockKeyGenerator lockKeyGenerator;
  private final GeoService geoService;
  private final SkillCatalog skillCatalog;
  private final MatchingProperties properties;
  private final SkillSwapMetrics metrics;
  private final Clock clock;

  /**
   * 役割: userId に対する候補を距離の昇順で返す。
   * 動作: 実ユーザーと userId 自身が保有する合成ユーザーだけを走査し、
   * 相補判定 → 半径判定の順で絞り込む。距離は小数 2 桁に丸めて返すが、並べ替えは丸め前の値と id で行う。
   * 位置/スキル未設定の本人には空リスト、座標の無い候補は除外する。
   */
  @Transactional(readOnly = true)
  public List<MatchCandidateResponse> findMatches(long userId) {
    final UserRecord user = requireUser(userId);
    if (!user.hasLocation()) {
      return List.of();
    }
    final UserSkills mySkills = skillRepository.findByUserId(userId);
    if (!mySkills.hasOffersAndNeeds()) {
      return List.of();
    }
    final List<UserRecord> candidates = userRepository.findDiscoverableCandidates(userId);
    final Map<Long, UserSkills> skillsById =
        skillRepository.findByUserIds(candidates.stream().map(UserRecord::userId).toList());
    final Set<Long> myTargets = interestRepository.findTargetsOf(userId);
    final Set<Long> mySources = interestRepository.findSourcesOf(userId);

    final List<ScoredCandidate> scored = new ArrayList<>();
    for (UserRecord candidate : candidates) {
      // 他オーナーの合成ユーザーはクエリで除外済みだが、所有関係はここでも確認する
      if (!candidate.hasLocation() || (candidate.synthetic() && !candidate.isOwnedBy(userId))) {
        continue;
      }
      final UserSkills theirSkills =
          skillsById.getOrDefault(candidate.userId(), UserSkills.empty());
      final List<String> theyOffer = theirSkills.offersNeededBy(mySkills, skillCatalog.skills());
      final List<String> theyNeed = mySkills.offersNeededBy(theirSkills, skillCatalog.skills());
      if (theyOffer.isEmpty() || theyNeed.isEmpty()) {
        continue;
      }
      final double distance = distanceBetween(user, candidate);
      if (Double.isNaN(distance) || distance > properties.radiusMiles()) {
        continue;
      }
      scored.add(new ScoredCandidate(candidate, distance, theyOffer, theyNeed));
    }
    scored.sort(
        Comparator.comparingDouble(ScoredCandidate::distance)
            .thenComparingLong(c -> c.user().userId()));
    return scored.stream()
        .map(
            c ->
                new MatchCandidateResponse(
                    c.user().userId(),
                    c.user().displayName(),
                    roundMiles(c.distance()),
                    c.theyOffer(),
                    c.theyNeed(),
                    myTargets.contains(c.user().userId()),
                    mySources.contains(c.user().userId()),
                    c.user().synthetic()))
        .toList();
  }

  /**
   * 役割: userId → targetUserId の興味エッジを登録し、pending/mutual を返す。
   * 動作: ペアの advisory lock を取った上で「挿入 → 逆向きエッジ確認」を行うため、
   * 双方が同時に送っても少なくとも一方は mutual を観測する。相手が合成ユーザーなら逆向きエッジも登録する。
   */
  @Transactional
  public InterestResponse expressInterest(long userId, long targetUserId) {
    if (userId == targetUserId) {
      throw new InvalidSkillSwapRequestException(
          "targetUserId", "cannot express interest in yourself");
    }
    requireUser(userId);
    final UserRecord target = requireVisibleTarget(userId, targetUserId);
    final PairId pairId = PairId.of(userId, targetUserId);
    lockPair(pairId);
    final Instant now = clock.instant();
    interestRepository.insertIfAbsent(userId, targetUserId, now);
    if (target.synthetic()) {
      interestRepository.insertIfAbsent(targetUserId, userId, now);
    }
    final InterestStatus status =
        interestRepository.exists(targetUserId, userId)
            ? InterestStatus.MUTUAL
            : InterestStatus.PENDING;
    metrics.recordInterest(status.value());
    logger.info(
        "interest expressed userId={} targetUserId={} status={}",
        userId,
        targetUserId,
        status.value());
    return new InterestResponse(pairId.value(), status.value(), targetUserId);
  }

  /** 双方向のエッジが揃っている相手を、自分のエッジ作成時刻の新しい順で返す。 */
  @Transactional(readOnly = true)
  public List<MutualMatchResponse> getMutualMatches(long userId) {
    final UserRecord user = requireUser(userId);
    final List<MutualInterestRecord> mutual = interestRepository.findMutual(userId);
    if (mutual.isEmpty()) {
      return List.of();
    }
    final UserSkills mySkills = skillRepository.findByUserId(userId);
    final Map<Long, UserSkills> skillsById =
        skillRepository.findByUserIds(
            mutual.stream().map(record -> record.otherUser().userId()).toList());
    final Map<PairId, MeetingRecord> meetingsByPair =
        meetingRepository.findByParticipant(userId).stream()
            .collect(Collectors.toMap(MeetingRecord::pairId, Function.identity()));

    final List<MutualMatchResponse> responses = new ArrayList<>(mutual.size());
    for (MutualInterestRecord record : mutual) {
      final UserRecord other = record.otherUser();
      final PairId pairId = PairId.of(userId, other.userId());
      final UserSkills theirSkills = skillsById.getOrDefault(other.userId(), UserSkills.empty());
      final MeetingRecord meeting = meetingsByPair.get(pairId);
      final double distance = distanceBetween(user, other);
      responses.add(
          new MutualMatchResponse(
              pairId.value(),
              new MatchedUserPayload(
                  other.userId(),
                  other.displayName(),
                  Double.isNaN(distance) ? null : roundMiles(distance),
                  other.synthetic()),
              new SkillExchangePayload(
                  mySkills.offersNeededBy(theirSkills, skillCatalog.skills()),
                  theirSkills.offersNeededBy(mySkills, skillCatalog.skills())),
              meeting == null ? MeetingStatus.NONE : meeting.status().value(),
              meeting == null ? null : meeting.meetingId(),
              toIsoOrNull(record.matchedAt())));
    }
    return responses;
  }

  /** 自分のエッジだけを削除する。相手のエッジはそのまま残し、存在しない場合も成功扱い。 */
  @Transactional
  public DeclineMatchResponse declineMatch(long userId, long targetUserId) {
    if (userId == targetUserId) {
      throw new InvalidSkillSwapRequestException("targetUserId", "cannot decline yourself");
    }
    requireUser(userId);
    lockPair(PairId.of(userId, targetUserId));
    final boolean removed = interestRepository.delete(userId, targetUserId) > 0;
    logger.info(
        "match declined userId={} targetUserId={} removed={}", userId, targetUserId, removed);
    return new DeclineMatchResponse(targetUserId, removed);
  }

  public boolean hasMutualInterest(long userA, long userB) {
    return interestRepository.exists(userA, userB) && interestRepository.exists(userB, userA);
  }

  private double distanceBetween(UserRecord from, UserRecord to) {
    if (!from.hasLocation() || !to.hasLocation()) {
      return Double.NaN;
    }
    return geoService.distance(from.latitude(), from.longitude(), to.latitude(), to.longitude());
  }

  static double roundMiles(double miles) {
    return Math.round(miles * 100.0) / 100.0;
  }

  private UserRecord requireUser(long userId) {
    return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
  }

  // 他オーナーの合成ユーザーは存在しないものとして扱う
  private UserRecord requireVisibleTarget(long userId, long targetUserId) {
    final UserRecord target = requireUser(targetUserId);
    if (target.synthetic() && !target.isOwnedBy(userId)) {
      throw new UserNotFoundException(targetUserId);
    }
    return target;
  }

  private void lockPair(PairId pairId) {
    lockRepository.lockByKey(lockKeyGenerator.forPair(pairId));
  }

  private String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private record ScoredCandidate(
      UserRecord user, double distance, List<String> theyOffer, List<String> theyNeed) {}
}
