package signals.demo.starter;

import signals.SignalHub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class DemoRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

  private final SignalHub hub;
  private final LevelFader fader;

  public DemoRunner(SignalHub hub, LevelFader fader) {
    this.hub = hub;
    this.fader = fader;
  }

  @Override
  public void run(String... args) {
    DoorOpened doorOpened = hub.get(DoorOpened.class);
    doorOpened.dispatch("kitchen", false);
    doorOpened.dispatch("vault", true);

    LevelLoaded levelLoaded = hub.get(LevelLoaded.class);
    levelLoaded.dispatch("castle");
    log.info("[Demo] {}", levelLoaded);
    fader.finishFade();
    log.info("[Demo] {}", levelLoaded);
  }
}
