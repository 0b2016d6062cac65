package incident.commander.controller;

import incident.commander.global.response.ApiResponse;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import incident.commander.infrastructure.resilience.HealthDashboard;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/resilience")
@RequiredArgsConstructor
public class ResilienceController {

  private final CircuitBreakerRegistry circuitBreakerRegistry;

  @GetMapping("/circuit-breakers")
  public ResponseEntity<ApiResponse<HealthDashboard>> circuitBreakers() {
    return ResponseEntity.ok(ApiResponse.success(circuitBreakerRegistry.healthDashboard()));
  }

  @PostMapping("/circuit-breakers/reset")
  public ResponseEntity<ApiResponse<HealthDashboard>> reset() {
    circuitBreakerRegistry.resetAll();
    return ResponseEntity.ok(ApiResponse.success(circuitBreakerRegistry.healthDashboard()));
  }
}
