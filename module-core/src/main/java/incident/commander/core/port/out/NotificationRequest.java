package incident.commander.core.port.out;

import java.util.List;
import java.util.Map;

/**
 * Rendered summary handed to the notification layer.
 *
 * @param incidentId incident the summary is about
 * @param summary rendered text
 * @param audiences who should receive it
 * @param channels delivery channels
 * @param metadata extra fields for channel adapters
 */
public record NotificationRequest(
    String incidentId,
    String summary,
    List<String> audiences,
    List<String> channels,
    Map<String, Object> metadata) {

  public NotificationRequest {
    if (incidentId == null || incidentId.isBlank()) {
      throw new IllegalArgumentException("incidentId cannot be null or blank");
    }
    summary = summary == null ? "" : summary;
    audiences = audiences == null ? List.of() : List.copyOf(audiences);
    channels = channels == null ? List.of() : List.copyOf(channels);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
