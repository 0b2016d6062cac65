package incident.commander.infrastructure.executor.function;

/**
 * Supplier that may throw any {@link Throwable}.
 *
 * @param <T> result type
 * @see java.util.function.Supplier
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  T get() throws Throwable;
}
