package incident.commander.notification;

import incident.commander.core.port.out.NotificationPort;
import incident.commander.core.port.out.NotificationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default notification hand-off: logs the rendered summary. Channel delivery is not done here. */
@Slf4j
@Component
public class LoggingNotificationAdapter implements NotificationPort {

  @Override
  public void dispatch(NotificationRequest request) {
    log.info(
        "[Notification] summary ready: incidentId={}, audiences={}, channels={}, summary={}",
        request.incidentId(),
        request.audiences(),
        request.channels(),
        request.summary());
  }
}
