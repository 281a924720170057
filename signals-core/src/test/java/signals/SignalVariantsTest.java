package signals;

import org.junit.jupiter.api.Test;
import signals.dispatch.DispatchState;
import signals.dispatch.IllegalDispatchStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalVariantsTest {

  static class Ping extends VoidSignal {
  }

  static class ScoreChanged extends UnarySignal<Integer> {
  }

  static class Moved extends BinarySignal<Integer, Integer> {
  }

  static class Hit extends TernarySignal<String, Integer, Boolean> {
  }

  private final SignalHub hub = new SignalHub();

  // ── Arguments ───────────────────────────────────────────────────

  @Test
  void voidSignalRunsListeners() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> calls.add("a"));
    ping.addListener(() -> calls.add("b"));

    ping.dispatch();

    assertEquals(List.of("a", "b"), calls);
    assertEquals(Runnable.class, ping.listenerType());
  }

  @Test
  void unarySignalDeliversArgument() {
    List<Integer> received = new ArrayList<>();
    ScoreChanged score = hub.get(ScoreChanged.class);
    score.addListener(received::add);

    score.dispatch(10);
    score.dispatch(20);

    assertEquals(List.of(10, 20), received);
    assertEquals(Consumer.class, score.listenerType());
  }

  @Test
  void binarySignalDeliversArguments() {
    List<String> received = new ArrayList<>();
    Moved moved = hub.get(Moved.class);
    moved.addListener((x, y) -> received.add(x + "," + y));

    moved.dispatch(3, 4);

    assertEquals(List.of("3,4"), received);
    assertEquals(BiConsumer.class, moved.listenerType());
  }

  @Test
  void ternarySignalDeliversArguments() {
    List<String> received = new ArrayList<>();
    Hit hit = hub.get(Hit.class);
    hit.addListener((target, damage, critical) -> received.add(target + ":" + damage + ":" + critical));

    hit.dispatch("orc", 12, true);

    assertEquals(List.of("orc:12:true"), received);
    assertEquals(TriConsumer.class, hit.listenerType());
  }

  @Test
  void resumedDispatchDeliversSameArgument() {
    List<String> received = new ArrayList<>();
    ScoreChanged score = hub.get(ScoreChanged.class);
    score.addListener(value -> {
      received.add("first " + value);
      score.pause();
    });
    score.addListener(value -> received.add("second " + value));

    score.dispatch(7);
    assertEquals(DispatchState.PAUSED, score.state());

    score.resume();

    assertEquals(List.of("first 7", "second 7"), received);
    assertEquals(DispatchState.IDLE, score.state());
  }

  @Test
  void rejectedDispatchKeepsArgumentsOfPausedDispatch() {
    List<Integer> received = new ArrayList<>();
    ScoreChanged score = hub.get(ScoreChanged.class);
    score.addListener(value -> score.pause());
    score.addListener(received::add);

    score.dispatch(1);
    assertThrows(IllegalDispatchStateException.class, () -> score.dispatch(2));
    score.resume();

    assertEquals(List.of(1), received);
  }

  // ── Registration ────────────────────────────────────────────────

  @Test
  void duplicateListenerIsRejected() {
    Runnable listener = () -> { };
    Ping ping = hub.get(Ping.class);

    assertTrue(ping.addListener(listener));
    assertFalse(ping.addListener(listener));
    assertFalse(ping.insertListener(0, listener));
    assertEquals(1, ping.listenerCount());
    assertTrue(ping.hasListener(listener));
  }

  @Test
  void removeListener() {
    Runnable listener = () -> { };
    Ping ping = hub.get(Ping.class);
    ping.addListener(listener);

    assertTrue(ping.removeListener(listener));
    assertFalse(ping.removeListener(listener));
    assertFalse(ping.hasListener(listener));
    assertEquals(0, ping.listenerCount());
  }

  @Test
  void nullListenerIsRejected() {
    Ping ping = hub.get(Ping.class);

    assertThrows(NullPointerException.class, () -> ping.addListener(null));
    assertThrows(NullPointerException.class, () -> ping.insertListener(0, null));
  }

  @Test
  void insertListenerPlacesListenerAtIndex() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> calls.add("a"));
    ping.addListener(() -> calls.add("c"));
    ping.insertListener(1, () -> calls.add("b"));
    ping.insertListener(3, () -> calls.add("d"));

    ping.dispatch();

    assertEquals(List.of("a", "b", "c", "d"), calls);
  }

  @Test
  void insertListenerRejectsBadIndex() {
    Ping ping = hub.get(Ping.class);

    assertThrows(IndexOutOfBoundsException.class, () -> ping.insertListener(1, () -> { }));
    assertThrows(IndexOutOfBoundsException.class, () -> ping.insertListener(-1, () -> { }));
  }

  // ── Dispatch control from listeners ─────────────────────────────

  @Test
  void consumeAtSecondListenerStopsThird() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> calls.add("L0"));
    ping.addListener(() -> {
      calls.add("L1");
      ping.consume();
    });
    ping.addListener(() -> calls.add("L2"));

    ping.dispatch();

    assertEquals(List.of("L0", "L1"), calls);
    assertEquals(DispatchState.CONSUMED, ping.state());
  }

  @Test
  void pauseAtSecondListenerAndResumeExternally() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> calls.add("L0"));
    ping.addListener(() -> {
      calls.add("L1");
      ping.pause();
    });
    ping.addListener(() -> calls.add("L2"));

    ping.dispatch();
    assertEquals(List.of("L0", "L1"), calls);

    ping.resume();
    assertEquals(List.of("L0", "L1", "L2"), calls);
    assertEquals(DispatchState.IDLE, ping.state());
  }

  @Test
  void oneShotListenerRemovesItself() {
    List<String> calls = new ArrayList<>();
    ScoreChanged score = hub.get(ScoreChanged.class);
    AtomicReference<Consumer<Integer>> once = new AtomicReference<>();
    once.set(value -> {
      calls.add("once " + value);
      score.removeListener(once.get());
    });
    score.addListener(once.get());
    score.addListener(value -> calls.add("always " + value));

    score.dispatch(1);
    score.dispatch(2);

    assertEquals(List.of("once 1", "always 1", "always 2"), calls);
    assertEquals(1, score.listenerCount());
  }

  @Test
  void listenerAddedAheadDuringDispatchWaitsForNextDispatch() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    Runnable late = () -> calls.add("late");
    ping.addListener(() -> calls.add("L0"));
    ping.addListener(() -> {
      calls.add("L1");
      ping.insertListener(0, late);
    });

    ping.dispatch();
    assertEquals(List.of("L0", "L1"), calls);

    calls.clear();
    ping.dispatch();
    assertEquals(List.of("late", "L0", "L1"), calls);
  }

  @Test
  void clearDuringDispatchStopsRemainingListeners() {
    List<String> calls = new ArrayList<>();
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> calls.add("L0"));
    ping.addListener(() -> {
      calls.add("L1");
      ping.clear();
    });
    ping.addListener(() -> calls.add("L2"));

    ping.dispatch();

    assertEquals(List.of("L0", "L1"), calls);
    assertEquals(0, ping.listenerCount());
    assertEquals(DispatchState.IDLE, ping.state());
  }

  @Test
  void resetRecoversFromFailingListener() {
    Ping ping = hub.get(Ping.class);
    Runnable failing = () -> {
      throw new IllegalStateException("listener failed");
    };
    ping.addListener(failing);

    assertThrows(IllegalStateException.class, ping::dispatch);
    assertEquals(DispatchState.RUNNING, ping.state());

    ping.removeListener(failing);
    ping.reset();
    ping.dispatch();

    assertEquals(DispatchState.IDLE, ping.state());
  }

  // ── Identity ────────────────────────────────────────────────────

  @Test
  void idIsDerivedFromType() {
    assertEquals(Ping.class.getName(), hub.get(Ping.class).id());
    assertEquals("signals.SignalVariantsTest$ScoreChanged", hub.get(ScoreChanged.class).id());
  }

  @Test
  void toStringReportsStateAndIndex() {
    Ping ping = hub.get(Ping.class);
    ping.addListener(() -> { });

    assertEquals("Signal Ping: 1 listeners, state IDLE, index 0", ping.toString());
  }
}
