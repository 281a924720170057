package signals;

import java.util.function.BiConsumer;

/**
 * Signal carrying two arguments; listeners are {@link BiConsumer}s.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 */
public abstract class BinarySignal<A, B> extends AbstractSignal<BiConsumer<A, B>> {
  private A first;
  private B second;

  protected BinarySignal() {
    super(BiConsumer.class);
  }

  public void dispatch(A first, B second) {
    startDispatch(() -> {
      this.first = first;
      this.second = second;
    });
  }

  @Override
  protected final void invoke(BiConsumer<A, B> listener) {
    listener.accept(first, second);
  }
}
