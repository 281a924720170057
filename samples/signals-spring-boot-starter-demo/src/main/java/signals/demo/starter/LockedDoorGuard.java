package signals.demo.starter;

import signals.SignalHub;
import signals.spring.boot.SignalListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.function.BiConsumer;

/**
 * Stops a dispatch of {@link DoorOpened} for locked doors, so later listeners never hear it.
 */
@Component
@Order(1)
@SignalListener(DoorOpened.class)
public class LockedDoorGuard implements BiConsumer<String, Boolean> {

  private static final Logger log = LoggerFactory.getLogger(LockedDoorGuard.class);

  private final SignalHub hub;

  public LockedDoorGuard(SignalHub hub) {
    this.hub = hub;
  }

  @Override
  public void accept(String door, Boolean locked) {
    if (locked) {
      log.info("[Guard] {} is locked, consuming the signal", door);
      hub.get(DoorOpened.class).consume();
    }
  }
}
