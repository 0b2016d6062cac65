package incident.commander.core.port.out;

/**
 * Hand-off point to the notification layer.
 *
 * <p>Template rendering and channel delivery live behind this port.
 */
public interface NotificationPort {

  void dispatch(NotificationRequest request);
}
