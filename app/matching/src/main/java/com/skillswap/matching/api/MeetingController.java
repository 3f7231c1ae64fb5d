/*
 * どこで: Matching API
 * 何を: ミーティングの提案/参照/受諾/確認のエンドポイントを公開する
 * なぜ: ミーティング状態機械への操作を参加者単位で受け付けるため
 */
package com.skillswap.matching.api;

import com.skillswap.matching.api.request.ProposeMeetingRequest;
import com.skillswap.matching.api.response.MeetingResponse;
import com.skillswap.matching.api.response.PairMeetingResponse;
import com.skillswap.matching.service.MeetingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/meetings")
@RequiredArgsConstructor
public class MeetingController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MeetingService meetingService;

  @PostMapping
  public ResponseEntity<MeetingResponse> proposeMeeting(
      @RequestHeader(HEADER_USER_ID) long userId,
      @Valid @RequestBody ProposeMeetingRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(meetingService.proposeMeeting(userId, request));
  }

  @GetMapping("/{pairId}")
  public ResponseEntity<PairMeetingResponse> getMeeting(
      @PathVariable("pairId") String pairId, @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(meetingService.getMeeting(userId, pairId));
  }

  @PutMapping("/{meetingId}/accept")
  public ResponseEntity<MeetingResponse> acceptMeeting(
      @PathVariable("meetingId") long meetingId, @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(meetingService.acceptMeeting(userId, meetingId));
  }

  @PutMapping("/{meetingId}/confirm")
  public ResponseEntity<MeetingResponse> confirmMeeting(
      @PathVariable("meetingId") long meetingId, @RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(meetingService.confirmMeeting(userId, meetingId));
  }
}
