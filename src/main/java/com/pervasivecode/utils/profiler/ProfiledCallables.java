package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import com.google.common.base.Strings;

/**
 * Static utility methods that wrap a task so that every invocation of it is timed as an action.
 * <p>
 * The wrapped task's result or exception is passed through unchanged. The action is stopped after
 * every invocation, including invocations that throw.
 * <p>
 * Each functional type has its own method name, since a zero-argument lambda would otherwise match
 * more than one overload.
 */
public final class ProfiledCallables {
  private ProfiledCallables() {}

  public static <T> Callable<T> wrap(ActionProfiler profiler, String actionName,
      Callable<T> callable) {
    checkNotNull(profiler);
    checkNotNull(actionName);
    checkNotNull(callable);
    return () -> {
      try (ActionScope scope = profiler.profile(actionName)) {
        return callable.call();
      }
    };
  }

  /**
   * Wrap a Callable, naming the action after the callable's class.
   *
   * @param profiler The profiler that will time the callable.
   * @param callable An instance of a named class. Lambdas and anonymous classes have no usable
   *        name, so the action name must be given explicitly for those via
   *        {@link #wrap(ActionProfiler, String, Callable)}.
   * @return A Callable that times each invocation of the given callable.
   * @throws IllegalArgumentException if the callable's class has no usable name.
   */
  public static <T> Callable<T> wrap(ActionProfiler profiler, Callable<T> callable) {
    checkNotNull(callable);
    Class<?> callableClass = callable.getClass();
    String name = callableClass.getSimpleName();
    checkArgument(!callableClass.isAnonymousClass() && !callableClass.isSynthetic()
        && !Strings.isNullOrEmpty(name) && !name.contains("$$Lambda"),
        "Callable of %s has no usable name; pass an action name explicitly.", callableClass);
    return wrap(profiler, name, callable);
  }

  public static <T> Supplier<T> wrapSupplier(ActionProfiler profiler, String actionName,
      Supplier<T> supplier) {
    checkNotNull(profiler);
    checkNotNull(actionName);
    checkNotNull(supplier);
    return () -> {
      try (ActionScope scope = profiler.profile(actionName)) {
        return supplier.get();
      }
    };
  }

  public static Runnable wrapRunnable(ActionProfiler profiler, String actionName,
      Runnable runnable) {
    checkNotNull(profiler);
    checkNotNull(actionName);
    checkNotNull(runnable);
    return () -> {
      try (ActionScope scope = profiler.profile(actionName)) {
        runnable.run();
      }
    };
  }

  public static <A, R> Function<A, R> wrapFunction(ActionProfiler profiler, String actionName,
      Function<A, R> function) {
    checkNotNull(profiler);
    checkNotNull(actionName);
    checkNotNull(function);
    return (input) -> {
      try (ActionScope scope = profiler.profile(actionName)) {
        return function.apply(input);
      }
    };
  }
}
