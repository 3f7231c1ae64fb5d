package com.skillswap.matching.api;

public class MeetingNotFoundException extends RuntimeException {
  public MeetingNotFoundException(long meetingId) {
    super("meeting not found: " + meetingId);
  }
}
