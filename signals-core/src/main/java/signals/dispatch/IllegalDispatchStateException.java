package signals.dispatch;

/**
 * Thrown when a dispatch is started while another one is still in flight
 * and the policy is {@link RedispatchPolicy#REJECT}.
 */
public class IllegalDispatchStateException extends IllegalStateException {

  private final DispatchState state;
  private final int currentIndex;

  public IllegalDispatchStateException(DispatchState state, int currentIndex) {
    super("Dispatch already in flight: state=" + state + ", currentIndex=" + currentIndex);
    this.state = state;
    this.currentIndex = currentIndex;
  }

  public DispatchState state() {
    return state;
  }

  public int currentIndex() {
    return currentIndex;
  }
}
