package incident.commander.controller;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import incident.commander.controller.dto.IncidentRunRequest;
import incident.commander.controller.dto.IncidentRunRequest.BusinessImpactRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Runs the whole application on the in-memory transports.
 *
 * <ul>
 *   <li>POST /api/incidents/response runs the heuristic pipeline end to end
 *   <li>bad requests answer 400 before any stage runs
 *   <li>resilience and message-bus endpoints expose live state
 * </ul>
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Tag("integration")
class IncidentResponseControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  private MvcResult startRun(IncidentRunRequest request) throws Exception {
    return mockMvc
        .perform(
            post("/api/incidents/response")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(request().asyncStarted())
        .andReturn();
  }

  @Nested
  @DisplayName("POST /api/incidents/response")
  class Respond {

    @Test
    @DisplayName("a HIGH checkout latency incident runs every phase and is escalated")
    void fullPipeline() throws Exception {
      // Given
      IncidentRunRequest request =
          new IncidentRunRequest(
              "Checkout latency spike",
              "p99 latency on checkout above 2s",
              "high",
              Map.of("telemetry_sources", List.of("prometheus", "tracing"), "alert_count", 12),
              new BusinessImpactRequest("tier_1", 20_000, null));

      // When
      MvcResult started = startRun(request);

      // Then
      mockMvc
          .perform(asyncDispatch(started))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.data.status").value("escalated"))
          .andExpect(
              jsonPath("$.data.phases")
                  .value(
                      contains(
                          "detection",
                          "diagnosis",
                          "prediction",
                          "consensus",
                          "resolution",
                          "communication")))
          .andExpect(jsonPath("$.data.consensus.finalConfidence").value(greaterThan(0.0)))
          .andExpect(jsonPath("$.data.prediction.recommendations[0].parameters.projected_cost")
              .value(300000.0))
          .andExpect(jsonPath("$.data.failedNode").doesNotExist());
    }

    @Test
    @DisplayName("an unknown severity is rejected as an invalid incident")
    void unknownSeverity() throws Exception {
      IncidentRunRequest request =
          new IncidentRunRequest("Disk full", "", "apocalyptic", Map.of(), null);

      mockMvc
          .perform(
              post("/api/incidents/response")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C002"))
          .andExpect(jsonPath("$.message").value(containsString("apocalyptic")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("a blank title fails validation")
    void blankTitle(String title) throws Exception {
      IncidentRunRequest request = new IncidentRunRequest(title, "", "low", Map.of(), null);

      mockMvc
          .perform(
              post("/api/incidents/response")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C001"))
          .andExpect(jsonPath("$.message").value(containsString("title")));
    }

    @Test
    @DisplayName("a malformed body is a 400")
    void malformedBody() throws Exception {
      mockMvc
          .perform(
              post("/api/incidents/response")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"title\": "))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("a negative revenue impact fails validation")
    void negativeRevenue() throws Exception {
      IncidentRunRequest request =
          new IncidentRunRequest(
              "Disk full",
              "",
              "low",
              Map.of(),
              new BusinessImpactRequest("tier_2", 10, new BigDecimal("-1")));

      mockMvc
          .perform(
              post("/api/incidents/response")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest());
    }
  }

  @Nested
  @DisplayName("Operational endpoints")
  class Operational {

    @Test
    @DisplayName("circuit breaker dashboard lists agent breakers after a run")
    void circuitBreakers() throws Exception {
      // Given
      mockMvc.perform(
          asyncDispatch(
              startRun(new IncidentRunRequest("Cache miss storm", "cpu spike", "low", null, null))));

      // Then
      mockMvc
          .perform(get("/api/resilience/circuit-breakers"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(
              jsonPath("$.data.dependencies[?(@.name == 'agent_detection')].state")
                  .value(contains("CLOSED")));
    }

    @Test
    @DisplayName("reset answers with the dashboard")
    void reset() throws Exception {
      mockMvc
          .perform(post("/api/resilience/circuit-breakers/reset"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("message bus stats and queue depth are readable")
    void messageBus() throws Exception {
      mockMvc
          .perform(get("/api/message-bus/stats"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.sent").isNumber());

      mockMvc
          .perform(get("/api/message-bus/queues/communication"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true));
    }
  }
}
