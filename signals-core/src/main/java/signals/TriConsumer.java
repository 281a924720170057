package signals;

/**
 * Three-argument counterpart of {@link java.util.function.BiConsumer}.
 */
@FunctionalInterface
public interface TriConsumer<A, B, C> {

  void accept(A first, B second, C third);
}
