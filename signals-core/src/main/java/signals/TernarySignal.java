package signals;

/**
 * Signal carrying three arguments; listeners are {@link TriConsumer}s.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 * @param <C> third argument type
 */
public abstract class TernarySignal<A, B, C> extends AbstractSignal<TriConsumer<A, B, C>> {
  private A first;
  private B second;
  private C third;

  protected TernarySignal() {
    super(TriConsumer.class);
  }

  public void dispatch(A first, B second, C third) {
    startDispatch(() -> {
      this.first = first;
      this.second = second;
      this.third = third;
    });
  }

  @Override
  protected final void invoke(TriConsumer<A, B, C> listener) {
    listener.accept(first, second, third);
  }
}
