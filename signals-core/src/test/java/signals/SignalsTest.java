package signals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import signals.dispatch.DispatchObserver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class SignalsTest {

  static class Tick extends VoidSignal {
  }

  static class Tock extends UnarySignal<Long> {
  }

  @AfterEach
  void tearDown() {
    Signals.clear();
  }

  @Test
  void getUsesDefaultHub() {
    Tick tick = Signals.get(Tick.class);

    assertSame(tick, Signals.get(Tick.class));
    assertSame(tick, Signals.defaultHub().get(Tick.class));
  }

  @Test
  void countAndClear() {
    Signals.clear();
    Signals.get(Tick.class);
    Signals.get(Tock.class);

    assertEquals(2, Signals.count());

    Tick before = Signals.get(Tick.class);
    Signals.clear();

    assertEquals(0, Signals.count());
    assertNotSame(before, Signals.get(Tick.class));
  }

  @Test
  void clearRemovesObserver() {
    Signals.setDispatchObserver(new DispatchObserver() {
    });

    Signals.clear();

    assertNull(Signals.defaultHub().dispatchObserver());
  }
}
