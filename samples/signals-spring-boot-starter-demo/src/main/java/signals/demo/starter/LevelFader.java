package signals.demo.starter;

import signals.SignalHub;
import signals.spring.boot.SignalListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Pauses {@link LevelLoaded} while a fade-in runs. {@link #finishFade()} resumes it.
 */
@Component
@Order(1)
@SignalListener(LevelLoaded.class)
public class LevelFader implements Consumer<String> {

  private static final Logger log = LoggerFactory.getLogger(LevelFader.class);

  private final SignalHub hub;

  public LevelFader(SignalHub hub) {
    this.hub = hub;
  }

  @Override
  public void accept(String level) {
    log.info("[Fader] fading in {}, pausing dispatch", level);
    hub.get(LevelLoaded.class).pause();
  }

  public void finishFade() {
    log.info("[Fader] fade finished, resuming dispatch");
    hub.get(LevelLoaded.class).resume();
  }
}
