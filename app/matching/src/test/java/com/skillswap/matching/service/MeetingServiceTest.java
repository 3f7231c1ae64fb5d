/*
 * どこで: MeetingService の単体テスト
 * 何を: proposed → scheduled → completed の遷移条件と、合成ユーザー相手の自動受諾/自動確認を検証する
 * なぜ: 不正な遷移を forbidden / validation に正しく振り分けることを保証するため
 */
package com.skillswap.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import com.skillswap.matching.repository.AdvisoryLockRepository;
import com.skillswap.matching.repository.MeetingRepository;
import com.skillswap.matching.repository.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class MeetingServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final LocalDate DATE = LocalDate.of(2026, 3, 7);
  private static final LocalTime TIME = LocalTime.of(14, 30);
  private static final long MEETING_ID = 40L;

  private MeetingRepository meetingRepository;
  private UserRepository userRepository;
  private MatchService matchService;
  private AdvisoryLockRepository lockRepository;
  private final LockKeyGenerator lockKeyGenerator = new LockKeyGenerator();
  private MeetingService service;

  @BeforeEach
  void setUp() {
    meetingRepository = Mockito.mock(MeetingRepository.class);
    userRepository = Mockito.mock(UserRepository.class);
    matchService = Mockito.mock(MatchService.class);
    lockRepository = Mockito.mock(AdvisoryLockRepository.class);
    service =
        new MeetingService(
            meetingRepository,
            userRepository,
            matchService,
            lockRepository,
            lockKeyGenerator,
            new SkillSwapMetrics(new SimpleMeterRegistry()),
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(userRepository.findById(1)).thenReturn(Optional.of(MatchServiceTest.real(1, 1.0, 1.0)));
    when(userRepository.findById(2)).thenReturn(Optional.of(MatchServiceTest.real(2, 1.0, 1.0)));
    when(userRepository.findById(3))
        .thenReturn(Optional.of(MatchServiceTest.synthetic(3, 1L, 1.0, 1.0)));
    when(userRepository.findById(7))
        .thenReturn(Optional.of(MatchServiceTest.synthetic(7, 99L, 1.0, 1.0)));
    when(userRepository.findById(9)).thenReturn(Optional.of(MatchServiceTest.real(9, 1.0, 1.0)));
  }

  @Test
  void proposeRejectsMalformedPairIdBeforeAnyLookup() {
    assertThatThrownBy(() -> service.proposeMeeting(1, request("2-1", "Cafe", "2026-03-07", "14:30")))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("pairId:");
    verify(lockRepository, never()).lockByKey(anyLong());
  }

  @Test
  void proposeRejectsMalformedMeetingInput() {
    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-2", " ", "2026-03-07", "14:30")))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("location:");
    assertThatThrownBy(
            () -> service.proposeMeeting(1, request("1-2", "x".repeat(201), "2026-03-07", "14:30")))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("location:");
    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-2", "Cafe", "2026-02-30", "14:30")))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("proposedDate:");
    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-2", "Cafe", "2026-03-07", "25:00")))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("proposedTime:");
    verify(meetingRepository, never()).insert(any(), anyLong(), any(), any(), any(), any());
  }

  @Test
  void proposeRejectsCallerOutsidePair() {
    assertThatThrownBy(() -> service.proposeMeeting(9, request("1-2", "Cafe", "2026-03-07", "14:30")))
        .isInstanceOf(SkillSwapForbiddenException.class);
  }

  @Test
  void proposeRejectsPairWithoutMutualInterest() {
    when(matchService.hasMutualInterest(1, 2)).thenReturn(false);

    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-2", "Cafe", "2026-03-07", "14:30")))
        .isInstanceOf(SkillSwapForbiddenException.class)
        .hasMessageContaining("not a mutual match");
    verify(lockRepository).lockByKey(lockKeyGenerator.forPair(PairId.of(1, 2)));
    verify(meetingRepository, never()).insert(any(), anyLong(), any(), any(), any(), any());
  }

  @Test
  void proposeRejectsSecondMeetingForPair() {
    when(matchService.hasMutualInterest(1, 2)).thenReturn(true);
    when(meetingRepository.findByPair(PairId.of(1, 2)))
        .thenReturn(Optional.of(meeting(1, 2, 2, MeetingStatus.PROPOSED, false, false)));

    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-2", "Cafe", "2026-03-07", "14:30")))
        .isInstanceOf(SkillSwapForbiddenException.class)
        .hasMessageContaining("already has a meeting");
  }

  @Test
  void proposeCreatesProposedMeetingForRealCounterpart() {
    when(matchService.hasMutualInterest(1, 2)).thenReturn(true);
    when(meetingRepository.findByPair(PairId.of(1, 2))).thenReturn(Optional.empty());
    when(meetingRepository.insert(PairId.of(1, 2), 1L, "Cafe", DATE, TIME, NOW))
        .thenReturn(meeting(1, 2, 1, MeetingStatus.PROPOSED, false, false));

    final MeetingResponse response =
        service.proposeMeeting(1, request("1-2", " Cafe ", "2026-03-07", "14:30"));

    assertThat(response.status()).isEqualTo("proposed");
    assertThat(response.proposerId()).isEqualTo(1L);
    assertThat(response.proposerName()).isEqualTo("user-1");
    assertThat(response.otherUserId()).isEqualTo(2L);
    assertThat(response.proposedDate()).isEqualTo("2026-03-07");
    assertThat(response.proposedTime()).isEqualTo("14:30");
    assertThat(response.userConfirmed()).isFalse();
    assertThat(response.otherConfirmed()).isFalse();
    verify(meetingRepository, never()).updateStatus(anyLong(), any(), any());
  }

  @Test
  void proposeToSyntheticCounterpartIsAcceptedAutomatically() {
    when(matchService.hasMutualInterest(1, 3)).thenReturn(true);
    when(meetingRepository.findByPair(PairId.of(1, 3))).thenReturn(Optional.empty());
    when(meetingRepository.insert(PairId.of(1, 3), 1L, "Park", DATE, TIME, NOW))
        .thenReturn(meeting(1, 3, 1, MeetingStatus.PROPOSED, false, false));
    when(meetingRepository.updateStatus(MEETING_ID, MeetingStatus.SCHEDULED, NOW))
        .thenReturn(meeting(1, 3, 1, MeetingStatus.SCHEDULED, false, false));

    final MeetingResponse response =
        service.proposeMeeting(1, request("1-3", "Park", "2026-03-07", "14:30"));

    assertThat(response.status()).isEqualTo("scheduled");
  }

  @Test
  void proposeTreatsSyntheticUserOfAnotherOwnerAsMissing() {
    when(matchService.hasMutualInterest(1, 7)).thenReturn(true);

    assertThatThrownBy(() -> service.proposeMeeting(1, request("1-7", "Park", "2026-03-07", "14:30")))
        .isInstanceOf(UserNotFoundException.class);
    verify(lockRepository, never()).lockByKey(anyLong());
    verify(meetingRepository, never()).insert(any(), anyLong(), any(), any(), any(), any());
  }

  @Test
  void acceptRejectsProposer() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.PROPOSED, false, false));

    assertThatThrownBy(() -> service.acceptMeeting(1, MEETING_ID))
        .isInstanceOf(SkillSwapForbiddenException.class);
  }

  @Test
  void acceptRejectsNonParticipant() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.PROPOSED, false, false));

    assertThatThrownBy(() -> service.acceptMeeting(9, MEETING_ID))
        .isInstanceOf(SkillSwapForbiddenException.class);
  }

  @Test
  void acceptRejectsMeetingThatIsNotProposed() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.SCHEDULED, false, false));

    assertThatThrownBy(() -> service.acceptMeeting(2, MEETING_ID))
        .isInstanceOf(InvalidSkillSwapRequestException.class)
        .hasMessageStartingWith("status:");
  }

  @Test
  void acceptThrowsWhenMeetingMissing() {
    when(meetingRepository.findById(MEETING_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.acceptMeeting(2, MEETING_ID))
        .isInstanceOf(MeetingNotFoundException.class);
  }

  @Test
  void acceptByCounterpartSchedulesMeeting() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.PROPOSED, false, false));
    when(meetingRepository.updateStatus(MEETING_ID, MeetingStatus.SCHEDULED, NOW))
        .thenReturn(meeting(1, 2, 1, MeetingStatus.SCHEDULED, false, false));

    final MeetingResponse response = service.acceptMeeting(2, MEETING_ID);

    assertThat(response.status()).isEqualTo("scheduled");
    assertThat(response.proposerName()).isEqualTo("user-1");
    verify(lockRepository).lockByKey(lockKeyGenerator.forPair(PairId.of(1, 2)));
  }

  @Test
  void confirmRejectsProposedMeeting() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.PROPOSED, false, false));

    assertThatThrownBy(() -> service.confirmMeeting(1, MEETING_ID))
        .isInstanceOf(InvalidSkillSwapRequestException.class);
  }

  @Test
  void confirmRejectsNonParticipant() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.SCHEDULED, false, false));

    assertThatThrownBy(() -> service.confirmMeeting(9, MEETING_ID))
        .isInstanceOf(SkillSwapForbiddenException.class);
  }

  @Test
  void confirmOnCompletedMeetingIsNoOp() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.COMPLETED, true, true));

    final MeetingResponse response = service.confirmMeeting(2, MEETING_ID);

    assertThat(response.status()).isEqualTo("completed");
    assertThat(response.swapUnlocked()).isTrue();
    verify(meetingRepository, never()).markConfirmed(anyLong(), anyBoolean(), any());
  }

  @Test
  void confirmSetsOnlyCallersFlagWhenCounterpartIsReal() {
    stubMeeting(meeting(1, 2, 1, MeetingStatus.SCHEDULED, false, false));
    when(meetingRepository.markConfirmed(MEETING_ID, false, NOW))
        .thenReturn(meeting(1, 2, 1, MeetingStatus.SCHEDULED, false, true));

    final MeetingResponse response = service.confirmMeeting(2, MEETING_ID);

    assertThat(response.status()).isEqualTo("scheduled");
    assertThat(response.userConfirmed()).isTrue();
    assertThat(response.otherConfirmed()).isFalse();
    assertThat(response.bothConfirmed()).isFalse();
    verify(meetingRepository, never()).markConfirmed(MEETING_ID, true, NOW);
  }

  @Test
  void confirmCompletesMeetingWhenSyntheticCounterpartConfirmsAutomatically() {
    stubMeeting(meeting(1, 3, 1, MeetingStatus.SCHEDULED, false, false));
    when(meetingRepository.markConfirmed(MEETING_ID, true, NOW))
        .thenReturn(meeting(1, 3, 1, MeetingStatus.SCHEDULED, true, false));
    when(meetingRepository.markConfirmed(MEETING_ID, false, NOW))
        .thenReturn(meeting(1, 3, 1, MeetingStatus.COMPLETED, true, true));

    final MeetingResponse response = service.confirmMeeting(1, MEETING_ID);

    assertThat(response.status()).isEqualTo("completed");
    assertThat(response.bothConfirmed()).isTrue();
    assertThat(response.userConfirmed()).isTrue();
    assertThat(response.otherConfirmed()).isTrue();
    assertThat(response.swapUnlocked()).isTrue();
  }

  @Test
  void getMeetingReturnsEmptyMeetingWhenPairHasNone() {
    when(meetingRepository.findByPair(PairId.of(1, 2))).thenReturn(Optional.empty());

    final PairMeetingResponse response = service.getMeeting(1, "1-2");

    assertThat(response.pairId()).isEqualTo("1-2");
    assertThat(response.meeting()).isNull();
  }

  @Test
  void getMeetingRejectsCallerOutsidePair() {
    assertThatThrownBy(() -> service.getMeeting(9, "1-2"))
        .isInstanceOf(SkillSwapForbiddenException.class);
  }

  @Test
  void getMeetingReturnsCallersView() {
    when(meetingRepository.findByPair(PairId.of(1, 2)))
        .thenReturn(Optional.of(meeting(1, 2, 1, MeetingStatus.SCHEDULED, true, false)));

    final MeetingResponse meeting = service.getMeeting(2, "1-2").meeting();

    assertThat(meeting.otherUserId()).isEqualTo(1L);
    assertThat(meeting.userConfirmed()).isFalse();
    assertThat(meeting.otherConfirmed()).isTrue();
    assertThat(meeting.swapUnlocked()).isFalse();
  }

  @Test
  void isSwapUnlockedOnlyForCompletedMeeting() {
    when(meetingRepository.findByPair(PairId.of(1, 2)))
        .thenReturn(Optional.of(meeting(1, 2, 1, MeetingStatus.COMPLETED, true, true)));
    when(meetingRepository.findByPair(PairId.of(1, 3))).thenReturn(Optional.empty());

    assertThat(service.isSwapUnlocked(PairId.of(1, 2))).isTrue();
    assertThat(service.isSwapUnlocked(PairId.of(1, 3))).isFalse();
  }

  private void stubMeeting(MeetingRecord meeting) {
    when(meetingRepository.findById(MEETING_ID)).thenReturn(Optional.of(meeting));
  }

  private static ProposeMeetingRequest request(
      String pairId, String location, String date, String time) {
    return new ProposeMeetingRequest(pairId, location, date, time);
  }

  private static MeetingRecord meeting(
      long low,
      long high,
      long proposer,
      MeetingStatus status,
      boolean confirmedByLow,
      boolean confirmedByHigh) {
    return new MeetingRecord(
        MEETING_ID,
        low,
        high,
        proposer,
        "Cafe",
        DATE,
        TIME,
        status,
        confirmedByLow,
        confirmedByHigh,
        NOW,
        NOW);
  }
}
