package signals.demo.starter;

import signals.spring.boot.SignalListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

@Component
@Order(2)
@SignalListener(LevelLoaded.class)
public class LevelAnnouncer implements Consumer<String> {

  private static final Logger log = LoggerFactory.getLogger(LevelAnnouncer.class);

  @Override
  public void accept(String level) {
    log.info("[Announcer] welcome to {}", level);
  }
}
