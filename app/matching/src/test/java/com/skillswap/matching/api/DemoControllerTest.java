package com.skillswap.matching.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.skillswap.matching.model.SeedOutcome;
import com.skillswap.matching.model.SeedResult;
import com.skillswap.matching.service.SeedService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DemoController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DemoControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SeedService seedService;

  @Test
  void seedReturnsLowercaseOutcome() throws Exception {
    when(seedService.seedForOwner(1L, 40.7128, -74.006))
        .thenReturn(new SeedResult(SeedOutcome.SEEDED, 19));

    mockMvc
        .perform(
            post("/v1/demo/seed")
                .header("X-User-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"latitude":40.7128,"longitude":-74.006}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("seeded"))
        .andExpect(jsonPath("$.synthetic_user_count").value(19));
  }

  @Test
  void seedReturns400WhenOwnerIsSynthetic() throws Exception {
    when(seedService.seedForOwner(5L, 40.7128, -74.006))
        .thenThrow(
            new InvalidSkillSwapRequestException(
                "userId", "synthetic users cannot own a demo cohort"));

    mockMvc
        .perform(
            post("/v1/demo/seed")
                .header("X-User-Id", "5")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"latitude":40.7128,"longitude":-74.006}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("userId: synthetic users cannot own a demo cohort"));
  }

  @Test
  void statusReportsCohortSize() throws Exception {
    when(seedService.isDemoEnabled()).thenReturn(true);
    when(seedService.countSyntheticUsers(1L)).thenReturn(17);

    mockMvc
        .perform(get("/v1/demo/status").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.demo_enabled").value(true))
        .andExpect(jsonPath("$.synthetic_user_count").value(17));
  }

  @Test
  void resetReturnsDeletedCount() throws Exception {
    when(seedService.resetForOwner(1L)).thenReturn(17);

    mockMvc
        .perform(delete("/v1/demo").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted_users").value(17));
  }
}
