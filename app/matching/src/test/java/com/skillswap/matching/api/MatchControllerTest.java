package com.skillswap.matching.api;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.skillswap.matching.api.response.DeclineMatchResponse;
import com.skillswap.matching.api.response.InterestResponse;
import com.skillswap.matching.api.response.MatchCandidateResponse;
import com.skillswap.matching.api.response.MatchedUserPayload;
import com.skillswap.matching.api.response.MutualMatchResponse;
import com.skillswap.matching.api.response.SkillExchangePayload;
import com.skillswap.matching.service.MatchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class MatchControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchService matchService;

  @Test
  void discoverReturnsSnakeCaseCandidates() throws Exception {
    when(matchService.findMatches(1L))
        .thenReturn(
            List.of(
                new MatchCandidateResponse(
                    3L, "Maya Chen", 0.35, List.of("Guitar"), List.of("Cooking"), true, false,
                    true)));

    mockMvc
        .perform(get("/v1/matches/discover").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].user_id").value(3))
        .andExpect(jsonPath("$[0].distance").value(0.35))
        .andExpect(jsonPath("$[0].they_offer[0]").value("Guitar"))
        .andExpect(jsonPath("$[0].they_need[0]").value("Cooking"))
        .andExpect(jsonPath("$[0].my_interest").value(true))
        .andExpect(jsonPath("$[0].their_interest").value(false))
        .andExpect(jsonPath("$[0].synthetic").value(true));
  }

  @Test
  void expressInterestReturnsPairStatus() throws Exception {
    when(matchService.expressInterest(1L, 3L))
        .thenReturn(new InterestResponse("1-3", "mutual", 3L));

    mockMvc
        .perform(post("/v1/matches/3/interest").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pair_id").value("1-3"))
        .andExpect(jsonPath("$.status").value("mutual"))
        .andExpect(jsonPath("$.target_user_id").value(3));
  }

  @Test
  void expressInterestMapsForbiddenAndNotFound() throws Exception {
    when(matchService.expressInterest(1L, 1L))
        .thenThrow(new InvalidSkillSwapRequestException("targetUserId", "cannot be yourself"));
    when(matchService.expressInterest(1L, 404L)).thenThrow(new UserNotFoundException(404L));

    mockMvc
        .perform(post("/v1/matches/1/interest").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("targetUserId: cannot be yourself"));
    mockMvc
        .perform(post("/v1/matches/404/interest").header("X-User-Id", "1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
  }

  @Test
  void listMutualMatchesReturnsSkillExchange() throws Exception {
    when(matchService.getMutualMatches(1L))
        .thenReturn(
            List.of(
                new MutualMatchResponse(
                    "1-3",
                    new MatchedUserPayload(3L, "Maya Chen", 0.4, true),
                    new SkillExchangePayload(List.of("Cooking"), List.of("Guitar")),
                    "none",
                    null,
                    "2026-03-01T10:00:00Z")));

    mockMvc
        .perform(get("/v1/matches").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].pair_id").value("1-3"))
        .andExpect(jsonPath("$[0].other_user.name").value("Maya Chen"))
        .andExpect(jsonPath("$[0].skills_exchange.i_give[0]").value("Cooking"))
        .andExpect(jsonPath("$[0].skills_exchange.i_get[0]").value("Guitar"))
        .andExpect(jsonPath("$[0].meeting_status").value("none"));
  }

  @Test
  void declineReturnsRemovedFlag() throws Exception {
    when(matchService.declineMatch(1L, 3L)).thenReturn(new DeclineMatchResponse(3L, true));

    mockMvc
        .perform(delete("/v1/matches/3").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.target_user_id").value(3))
        .andExpect(jsonPath("$.removed").value(true));
  }

  @Test
  void missingOrMalformedUserHeaderReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/matches/discover"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    mockMvc
        .perform(get("/v1/matches/discover").header("X-User-Id", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    verifyNoInteractions(matchService);
  }

  @Test
  void unexpectedFailureReturns500() throws Exception {
    when(matchService.findMatches(anyLong())).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(get("/v1/matches/discover").header("X-User-Id", "1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
  }
}
