package incident.commander.infrastructure.executor;

import incident.commander.infrastructure.executor.function.ThrowingRunnable;
import incident.commander.infrastructure.executor.function.ThrowingSupplier;
import incident.commander.infrastructure.executor.policy.ExecutionPipeline;
import incident.commander.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;

/**
 * {@link LogicExecutor} backed by an {@link ExecutionPipeline}.
 *
 * <ul>
 *   <li>every method runs the task through {@code pipeline.executeRaw()}
 *   <li>{@link Error} is rethrown without translation
 *   <li>a translator that itself fails never hides the original failure's kind
 * </ul>
 */
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExecutionPipeline pipeline;
  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw asUnchecked(translateSafe(translator, t, context));
    }
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable translated = translateSafe(translator, t, context);
      if (translated instanceof Error err) {
        throw err;
      }
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw asUnchecked(translateSafe(customTranslator, t, context));
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return fallback.apply(t);
    }
  }

  /**
   * Translator failing with a RuntimeException or Error: that exception becomes the primary.
   * Anything else is a contract violation wrapped in IllegalStateException.
   */
  private static Throwable translateSafe(
      ExceptionTranslator translator, Throwable t, TaskContext context) {
    try {
      return translator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static RuntimeException asUnchecked(Throwable t) {
    if (t instanceof Error err) {
      throw err;
    }
    if (t instanceof RuntimeException re) {
      return re;
    }
    return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, t);
  }
}
