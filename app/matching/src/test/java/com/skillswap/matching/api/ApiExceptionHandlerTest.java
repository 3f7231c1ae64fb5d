package com.skillswap.matching.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400WithFieldName() {
    final var response =
        handler.handleInvalidRequest(
            new InvalidSkillSwapRequestException("latitude", "must be between -90 and 90"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                ApiErrorCode.VALIDATION_ERROR, "latitude: must be between -90 and 90"));
  }

  @Test
  void handleUserNotFoundReturns404() {
    final var response = handler.handleUserNotFound(new UserNotFoundException(42L));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.USER_NOT_FOUND);
  }

  @Test
  void handleMeetingNotFoundReturns404() {
    final var response = handler.handleMeetingNotFound(new MeetingNotFoundException(7L));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.MEETING_NOT_FOUND);
  }

  @Test
  void handleForbiddenReturns403() {
    final var response =
        handler.handleForbidden(new SkillSwapForbiddenException("pair 1-2 is not a mutual match"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.FORBIDDEN, "pair 1-2 is not a mutual match"));
  }

  @Test
  void handleUnreadableBodyHidesParserDetails() {
    final var response =
        handler.handleUnreadableBody(
            new HttpMessageNotReadableException(
                "JSON parse error: Unexpected character ('}' (code 125))",
                new MockHttpInputMessage(new byte[0])));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().message()).isEqualTo("request body is invalid");
  }

  @Test
  void handleRuntimeReturns500WithoutLeakingMessage() {
    final var response = handler.handleRuntime(new IllegalStateException("db password=secret"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }
}
