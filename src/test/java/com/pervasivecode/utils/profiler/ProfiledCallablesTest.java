package com.pervasivecode.utils.profiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.Before;
import org.junit.Test;
import com.google.common.testing.FakeTicker;

public class ProfiledCallablesTest {
  private static final String FAILURE_MESSAGE = "This Callable always fails.";

  private FakeTicker ticker;
  private SimpleActionProfiler profiler;

  @Before
  public void setup() {
    ticker = new FakeTicker();
    profiler = new SimpleActionProfiler(ticker);
  }

  private class LoadData implements Callable<Integer> {
    @Override
    public Integer call() {
      assertThat(profiler.isActive("LoadData")).isTrue();
      ticker.advance(25, TimeUnit.MILLISECONDS);
      return 17;
    }
  }

  private static long cyclesOf(ActionProfiler profiler, String actionName) {
    return profiler.summarize(actionName).get().numStartStopCycles();
  }

  @Test
  public void wrap_shouldTimeEachCallAndReturnItsResult() throws Exception {
    Callable<String> timed = ProfiledCallables.wrap(profiler, "greet", () -> {
      ticker.advance(10, TimeUnit.MILLISECONDS);
      return "hello";
    });

    assertThat(profiler.summarize("greet").isPresent()).isFalse();
    assertThat(timed.call()).isEqualTo("hello");
    assertThat(timed.call()).isEqualTo("hello");

    assertThat(cyclesOf(profiler, "greet")).isEqualTo(2);
    assertThat(profiler.summarize("greet").get().totalElapsedTime())
        .isEqualTo(Duration.ofMillis(20));
  }

  @Test
  public void wrap_whenCallableThrows_shouldRethrowAndStopOnce() {
    Callable<String> timed = ProfiledCallables.wrap(profiler, "fail", () -> {
      throw new Exception(FAILURE_MESSAGE);
    });

    try {
      timed.call();
      assertWithMessage("Expected the callable's exception.").fail();
    } catch (Exception e) {
      assertThat(e).hasMessageThat().isEqualTo(FAILURE_MESSAGE);
      assertThat(e.getSuppressed()).isEmpty();
    }
    assertThat(profiler.isActive("fail")).isFalse();
    assertThat(cyclesOf(profiler, "fail")).isEqualTo(1);
  }

  @Test
  public void wrap_withoutName_shouldUseClassName() throws Exception {
    Callable<Integer> timed = ProfiledCallables.wrap(profiler, new LoadData());
    assertThat(timed.call()).isEqualTo(17);
    assertThat(profiler.summarize("LoadData").get().totalElapsedTime())
        .isEqualTo(Duration.ofMillis(25));
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrap_withoutName_withLambda_shouldThrow() {
    Callable<Integer> lambda = () -> 1;
    ProfiledCallables.wrap(profiler, lambda);
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrap_withoutName_withAnonymousClass_shouldThrow() {
    ProfiledCallables.wrap(profiler, new Callable<Integer>() {
      @Override
      public Integer call() {
        return 1;
      }
    });
  }

  @Test(expected = NullPointerException.class)
  public void wrap_withNullName_shouldThrow() {
    ProfiledCallables.wrap(profiler, null, () -> 1);
  }

  @Test
  public void wrapSupplier_shouldTimeEachCall() {
    Supplier<Integer> timed = ProfiledCallables.wrapSupplier(profiler, "answer", () -> 42);
    assertThat(timed.get()).isEqualTo(42);
    assertThat(cyclesOf(profiler, "answer")).isEqualTo(1);
  }

  @Test
  public void wrapRunnable_whenRunnableThrows_shouldRethrowAndStopOnce() {
    Runnable timed = ProfiledCallables.wrapRunnable(profiler, "crash", () -> {
      throw new IllegalStateException("boom");
    });
    try {
      timed.run();
      assertWithMessage("Expected the runnable's exception.").fail();
    } catch (IllegalStateException e) {
      assertThat(e).hasMessageThat().isEqualTo("boom");
    }
    assertThat(cyclesOf(profiler, "crash")).isEqualTo(1);
  }

  @Test
  public void wrapFunction_shouldPassInputAndResultThrough() {
    Function<String, Integer> timed =
        ProfiledCallables.wrapFunction(profiler, "length", String::length);
    assertThat(timed.apply("four")).isEqualTo(4);
    assertThat(timed.apply("")).isEqualTo(0);
    assertThat(cyclesOf(profiler, "length")).isEqualTo(2);
  }

  @SuppressWarnings("unchecked")
  @Test
  public void wrappedCallable_calledRecursively_shouldThrowDuplicateStart() throws Exception {
    Callable<Integer>[] holder = new Callable[1];
    holder[0] = ProfiledCallables.wrap(profiler, "recurse", () -> holder[0].call());
    try {
      holder[0].call();
      assertWithMessage("Expected DuplicateActionStartException.").fail();
    } catch (DuplicateActionStartException e) {
      assertThat(e.actionName()).isEqualTo("recurse");
    }
    assertThat(cyclesOf(profiler, "recurse")).isEqualTo(1);
  }
}
