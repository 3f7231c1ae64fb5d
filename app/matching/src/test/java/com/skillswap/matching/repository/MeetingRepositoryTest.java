/*
 * どこで: Matching リポジトリの統合テスト
 * 何を: ミーティングの挿入/状態更新/確認フラグと、両者確認時の completed 遷移を Postgres で検証する
 * なぜ: CHECK 制約と CASE 式の遷移条件が食い違わないことを保証するため
 */
package com.skillswap.matching.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skillswap.matching.AbstractPostgresContainerTest;
import com.skillswap.matching.model.MeetingRecord;
import com.skillswap.matching.model.MeetingStatus;
import com.skillswap.matching.model.PairId;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MeetingRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final Instant LATER = Instant.parse("2026-03-01T12:00:00Z");
  private static final LocalDate DATE = LocalDate.of(2026, 3, 7);
  private static final LocalTime TIME = LocalTime.of(14, 30);

  @Autowired private MeetingRepository meetingRepository;
  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private PairId pair;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM users", new MapSqlParameterSource());
    final long alice = userRepository.insertRealUser("Alice", NOW).userId();
    final long bob = userRepository.insertRealUser("Bob", NOW).userId();
    pair = PairId.of(alice, bob);
  }

  @Test
  void insertStartsProposedWithoutConfirmations() {
    final MeetingRecord meeting =
        meetingRepository.insert(pair, pair.lowUserId(), "Cafe", DATE, TIME, NOW);

    assertThat(meeting.status()).isEqualTo(MeetingStatus.PROPOSED);
    assertThat(meeting.pairId()).isEqualTo(pair);
    assertThat(meeting.proposedDate()).isEqualTo(DATE);
    assertThat(meeting.proposedTime()).isEqualTo(TIME);
    assertThat(meeting.bothConfirmed()).isFalse();
    assertThat(meetingRepository.findByPair(pair)).contains(meeting);
    assertThat(meetingRepository.findByParticipant(pair.highUserId())).containsExactly(meeting);
  }

  @Test
  void secondMeetingForSamePairIsRejected() {
    meetingRepository.insert(pair, pair.lowUserId(), "Cafe", DATE, TIME, NOW);

    assertThatThrownBy(
            () -> meetingRepository.insert(pair, pair.highUserId(), "Park", DATE, TIME, NOW))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void markConfirmedCompletesOnlyWhenBothSidesConfirmed() {
    final MeetingRecord proposed =
        meetingRepository.insert(pair, pair.lowUserId(), "Cafe", DATE, TIME, NOW);
    meetingRepository.updateStatus(proposed.meetingId(), MeetingStatus.SCHEDULED, NOW);

    final MeetingRecord lowConfirmed =
        meetingRepository.markConfirmed(proposed.meetingId(), true, NOW);
    assertThat(lowConfirmed.status()).isEqualTo(MeetingStatus.SCHEDULED);
    assertThat(lowConfirmed.confirmedByLow()).isTrue();
    assertThat(lowConfirmed.confirmedByHigh()).isFalse();

    // 同じ側の再確認は状態を変えない
    assertThat(meetingRepository.markConfirmed(proposed.meetingId(), true, NOW).status())
        .isEqualTo(MeetingStatus.SCHEDULED);

    final MeetingRecord completed =
        meetingRepository.markConfirmed(proposed.meetingId(), false, LATER);
    assertThat(completed.status()).isEqualTo(MeetingStatus.COMPLETED);
    assertThat(completed.bothConfirmed()).isTrue();
    assertThat(completed.updatedAt()).isEqualTo(LATER);
  }
}
