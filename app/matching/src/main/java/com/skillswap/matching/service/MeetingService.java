/*
 * どこで: Matching サービス
 * 何を: ミーティングの状態機械 (proposed → scheduled → completed) を管理する
 * なぜ: 相互成立したペアだけが、両者の確認を経てスワップ解放に到達できるようにするため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.api.MeetingNotFoundException;
import com.skillswap.matching.api.SkillSwapForbiddenException;
import com.skillswap.matching.api.UserNotFoundException;
import com.skillswap.matching.api.request.ProposeMeetingRequest;
import com.skillswap.matching.api.response.MeetingResponse;
import com.skillswap.matching.api.response.PairMeetingResponse;
import com.skillswap.matching.model.MeetingRecord;
import com.skillswap.matching.model.MeetingStatus;
import com.skillswap.matching.model.PairId;
import com.skillswap.matching.model.UserRecord;
import com.skillswap.matching.repository.AdvisoryLockRepository;
import com.skillswap.matching.repository.MeetingRepository;
import com.skillswap.matching.repository.UserRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MeetingService {

  private static final Logger logger = LoggerFactory.getLogger(MeetingService.class);

  static final int MAX_LOCATION_LENGTH = 200;
  static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
  static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("HH:mm").withResolverStyle(ResolverStyle.STRICT);

  private final MeetingRepository meetingRepository;
  private final UserRepository userRepository;
  private final MatchService matchService;
  private final AdvisoryLockRepository lockRepository;
  private final LockKeyGenerator lockKeyGenerator;
  private final SkillSwapMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 相互成立したペアにミーティングを提案する。
   * 動作: 入力検証 → 参加者/存在確認 → ペアロック → 相互成立と既存ミーティングの確認の順に評価する。
   * 相手が合成ユーザーの場合は同じトランザクション内で受諾まで進め、scheduled で返す。
   */
  @Transactional
  public MeetingResponse proposeMeeting(long userId, ProposeMeetingRequest request) {
    final PairId pairId = parsePairId(request.pairId());
    final String location = validateLocation(request.location());
    final LocalDate date = parseDate(request.proposedDate());
    final LocalTime time = parseTime(request.proposedTime());
    if (!pairId.contains(userId)) {
      throw new SkillSwapForbiddenException("user is not part of pair " + pairId.value());
    }
    final UserRecord proposer = requireUser(userId);
    final UserRecord other = requireUser(pairId.other(userId));
    if (other.synthetic() && !other.isOwnedBy(userId)) {
      throw new UserNotFoundException(other.userId());
    }
    lockPair(pairId);
    if (!matchService.hasMutualInterest(userId, other.userId())) {
      throw new SkillSwapForbiddenException("pair " + pairId.value() + " is not a mutual match");
    }
    if (meetingRepository.findByPair(pairId).isPresent()) {
      throw new SkillSwapForbiddenException("pair " + pairId.value() + " already has a meeting");
    }
    MeetingRecord meeting =
        meetingRepository.insert(pairId, userId, location, date, time, clock.instant());
    metrics.recordMeetingTransition(MeetingStatus.PROPOSED.value());
    logger.info(
        "meeting proposed meetingId={} pairId={} proposerId={}",
        meeting.meetingId(),
        pairId.value(),
        userId);
    if (other.synthetic()) {
      meeting = schedule(meeting);
    }
    return toResponse(meeting, userId, proposer, other);
  }

  /** 提案者ではない側の参加者だけが proposed → scheduled に進められる。 */
  @Transactional
  public MeetingResponse acceptMeeting(long userId, long meetingId) {
    final MeetingRecord current = lockAndLoad(meetingId);
    requireParticipant(current, userId);
    if (current.proposerId() == userId) {
      throw new SkillSwapForbiddenException("proposer cannot accept their own meeting");
    }
    if (current.status() != MeetingStatus.PROPOSED) {
      throw new InvalidSkillSwapRequestException(
          "status", "meeting cannot be accepted from " + current.status().value());
    }
    final MeetingRecord scheduled = schedule(current);
    return toResponse(scheduled, userId);
  }

  /**
   * 役割: 参加者自身の確認フラグを立て、両者が揃ったら completed に進める。
   * 動作: proposed は不正な遷移、completed は何もせず現状を返す。
   * 相手が合成ユーザーなら相手のフラグも同じトランザクション内で立てる。
   */
  @Transactional
  public MeetingResponse confirmMeeting(long userId, long meetingId) {
    final MeetingRecord current = lockAndLoad(meetingId);
    requireParticipant(current, userId);
    if (current.status() == MeetingStatus.PROPOSED) {
      throw new InvalidSkillSwapRequestException(
          "status", "meeting must be scheduled before it can be confirmed");
    }
    if (current.status() == MeetingStatus.COMPLETED) {
      return toResponse(current, userId);
    }
    MeetingRecord updated = confirmBy(current, userId);
    final long otherId = current.otherParticipant(userId);
    final UserRecord other = requireUser(otherId);
    if (other.synthetic() && !updated.isConfirmedBy(otherId)) {
      updated = confirmBy(updated, otherId);
    }
    return toResponse(updated, userId, requireUser(userId), other);
  }

  /** ペアのミーティングを呼び出しユーザー視点で返す。無い場合は meeting が null。 */
  @Transactional(readOnly = true)
  public PairMeetingResponse getMeeting(long userId, String rawPairId) {
    final PairId pairId = parsePairId(rawPairId);
    if (!pairId.contains(userId)) {
      throw new SkillSwapForbiddenException("user is not part of pair " + pairId.value());
    }
    final MeetingResponse meeting =
        meetingRepository.findByPair(pairId).map(m -> toResponse(m, userId)).orElse(null);
    return new PairMeetingResponse(pairId.value(), meeting);
  }

  /** ミーティングが completed のペアだけがスキル交換を解放される。 */
  @Transactional(readOnly = true)
  public boolean isSwapUnlocked(PairId pairId) {
    return meetingRepository
        .findByPair(pairId)
        .map(meeting -> meeting.status() == MeetingStatus.COMPLETED)
        .orElse(false);
  }

  private MeetingRecord schedule(MeetingRecord meeting) {
    final MeetingRecord scheduled =
        meetingRepository.updateStatus(
            meeting.meetingId(), MeetingStatus.SCHEDULED, clock.instant());
    metrics.recordMeetingTransition(MeetingStatus.SCHEDULED.value());
    logger.info(
        "meeting scheduled meetingId={} pairId={}", meeting.meetingId(), meeting.pairId().value());
    return scheduled;
  }

  private MeetingRecord confirmBy(MeetingRecord meeting, long userId) {
    final boolean lowSide = userId == meeting.userLowId();
    final MeetingRecord updated =
        meetingRepository.markConfirmed(meeting.meetingId(), lowSide, clock.instant());
    metrics.recordMeetingTransition("confirmed");
    if (updated.status() == MeetingStatus.COMPLETED
        && meeting.status() != MeetingStatus.COMPLETED) {
      metrics.recordMeetingTransition(MeetingStatus.COMPLETED.value());
      logger.info(
          "meeting completed meetingId={} pairId={}",
          updated.meetingId(),
          updated.pairId().value());
    }
    return updated;
  }

  // ペアが分からないと lock できないため、一度読んでから lock し、lock 後の状態を読み直す
  private MeetingRecord lockAndLoad(long meetingId) {
    final MeetingRecord found =
        meetingRepository
            .findById(meetingId)
            .orElseThrow(() -> new MeetingNotFoundException(meetingId));
    lockPair(found.pairId());
    return meetingRepository
        .findById(meetingId)
        .orElseThrow(() -> new MeetingNotFoundException(meetingId));
  }

  private void requireParticipant(MeetingRecord meeting, long userId) {
    if (!meeting.isParticipant(userId)) {
      throw new SkillSwapForbiddenException("user is not a participant of this meeting");
    }
  }

  private MeetingResponse toResponse(MeetingRecord meeting, long userId) {
    final UserRecord user = requireUser(userId);
    final UserRecord other = requireUser(meeting.otherParticipant(userId));
    return toResponse(meeting, userId, user, other);
  }

  private MeetingResponse toResponse(
      MeetingRecord meeting, long userId, UserRecord user, UserRecord other) {
    final UserRecord proposer = meeting.proposerId() == userId ? user : other;
    return new MeetingResponse(
        meeting.meetingId(),
        meeting.pairId().value(),
        meeting.location(),
        meeting.proposedDate().format(DATE_FORMAT),
        meeting.proposedTime().format(TIME_FORMAT),
        meeting.proposerId(),
        proposer.displayName(),
        meeting.status().value(),
        other.userId(),
        other.displayName(),
        meeting.isConfirmedBy(userId),
        meeting.isConfirmedBy(other.userId()),
        meeting.bothConfirmed(),
        meeting.status() == MeetingStatus.COMPLETED,
        meeting.createdAt() == null ? null : meeting.createdAt().toString());
  }

  private PairId parsePairId(String rawPairId) {
    try {
      return PairId.parse(rawPairId);
    } catch (IllegalArgumentException ex) {
      throw new InvalidSkillSwapRequestException("pairId", ex.getMessage());
    }
  }

  private String validateLocation(String location) {
    if (location == null || location.isBlank()) {
      throw new InvalidSkillSwapRequestException("location", "is required");
    }
    final String trimmed = location.trim();
    if (trimmed.length() > MAX_LOCATION_LENGTH) {
      throw new InvalidSkillSwapRequestException(
          "location", "must be at most " + MAX_LOCATION_LENGTH + " characters");
    }
    return trimmed;
  }

  private LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value == null ? "" : value, DATE_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new InvalidSkillSwapRequestException("proposedDate", "must be formatted as yyyy-MM-dd");
    }
  }

  private LocalTime parseTime(String value) {
    try {
      return LocalTime.parse(value == null ? "" : value, TIME_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new InvalidSkillSwapRequestException("proposedTime", "must be formatted as HH:mm");
    }
  }

  private UserRecord requireUser(long userId) {
    return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
  }

  private void lockPair(PairId pairId) {
    lockRepository.lockByKey(lockKeyGenerator.forPair(pairId));
  }
}
