package signals.dispatch;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Source location of the code that dispatched a signal.
 *
 * @param className fully qualified name of the calling class
 * @param methodName calling method
 * @param fileName source file, or {@code null} when not available
 * @param lineNumber source line, or a negative number when not available
 */
public record CallerContext(String className, String methodName, String fileName, int lineNumber) {

  public static final CallerContext UNKNOWN = new CallerContext("<unknown>", "<unknown>", null, -1);

  public CallerContext {
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(methodName, "methodName");
  }

  /**
   * Captures the first frame on the current stack whose declaring class is not
   * matched by {@code internal}.
   *
   * @param internal matches the classes that make up the dispatch machinery
   * @return the caller, or {@link #UNKNOWN} if every frame is internal
   */
  public static CallerContext capture(Predicate<Class<?>> internal) {
    return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
        .walk(frames -> frames
            .filter(frame -> frame.getDeclaringClass() != CallerContext.class)
            .filter(frame -> !internal.test(frame.getDeclaringClass()))
            .findFirst()
            .map(frame -> new CallerContext(
                frame.getClassName(),
                frame.getMethodName(),
                frame.getFileName(),
                frame.getLineNumber()))
            .orElse(UNKNOWN));
  }

  @Override
  public String toString() {
    String location = fileName == null ? "Unknown Source" : fileName + ":" + lineNumber;
    return className + "." + methodName + "(" + location + ")";
  }
}
