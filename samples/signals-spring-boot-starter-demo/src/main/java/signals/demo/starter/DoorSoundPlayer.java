package signals.demo.starter;

import signals.spring.boot.SignalListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.function.BiConsumer;

@Component
@Order(2)
@SignalListener(DoorOpened.class)
public class DoorSoundPlayer implements BiConsumer<String, Boolean> {

  private static final Logger log = LoggerFactory.getLogger(DoorSoundPlayer.class);

  @Override
  public void accept(String door, Boolean locked) {
    log.info("[Sound] creak: {}", door);
  }
}
