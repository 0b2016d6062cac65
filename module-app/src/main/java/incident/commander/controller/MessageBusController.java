package incident.commander.controller;

import incident.commander.global.response.ApiResponse;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.infrastructure.messaging.MessageBusStats;
import incident.commander.infrastructure.messaging.QueueStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only bus counters and per-agent queue depths. */
@RestController
@RequestMapping("/api/message-bus")
@RequiredArgsConstructor
public class MessageBusController {

  private final MessageBus messageBus;

  @GetMapping("/stats")
  public ResponseEntity<ApiResponse<MessageBusStats>> stats() {
    return ResponseEntity.ok(ApiResponse.success(messageBus.stats()));
  }

  @GetMapping("/queues/{agent}")
  public ResponseEntity<ApiResponse<QueueStats>> queue(@PathVariable("agent") String agent) {
    return ResponseEntity.ok(ApiResponse.success(messageBus.queueStats(agent)));
  }
}
