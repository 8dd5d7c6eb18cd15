package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Ticker;

/**
 * A timer that is started when it is created and can be stopped once, reading time from a
 * {@link Ticker}. An elapsed time of zero is valid, since a coarse ticker may not advance between
 * the start and the stop.
 * <p>
 * Not safe for use by multiple threads.
 */
final class OneShotTimer {
  /**
   * A listener that will be notified when the timer stops.
   */
  interface StopListener {
    void timerStopped(Duration elapsed);
  }

  private final Ticker ticker;
  private final List<StopListener> stopListeners = new ArrayList<>();
  private final long startNanos;
  private boolean stopped = false;
  private long endNanos = 0L;

  private OneShotTimer(Ticker ticker) {
    this.ticker = ticker;
    this.startNanos = ticker.read();
  }

  /**
   * Create an instance and start it.
   *
   * @param ticker A monotonic source of the current time, in nanoseconds.
   * @return A running timer.
   */
  static OneShotTimer createAndStart(Ticker ticker) {
    return new OneShotTimer(checkNotNull(ticker));
  }

  void addStopListener(StopListener stopListener) {
    checkNotNull(stopListener);
    checkState(!stopped, "Timer has already been stopped.");
    stopListeners.add(stopListener);
  }

  /**
   * What is the elapsed time of this timer?
   *
   * @return The time from the start until now, or until the stop if the timer was stopped.
   */
  Duration elapsed() {
    long nanosElapsed = (stopped ? endNanos : ticker.read()) - startNanos;
    checkState(nanosElapsed >= 0, "Operation took negative time: %s", nanosElapsed);
    return Duration.ofNanos(nanosElapsed);
  }

  /**
   * Stop the timer and notify the stop listeners.
   *
   * @return The elapsed time since the timer was started.
   * @throws IllegalStateException if the timer was already stopped, or the ticker went backwards.
   */
  Duration stopTimer() {
    checkState(!stopped, "Timer can't be stopped because it was not running.");
    long now = ticker.read();
    checkState(now >= startNanos, "Operation took negative time: %s", now - startNanos);
    endNanos = now;
    stopped = true;

    Duration elapsed = elapsed();
    for (StopListener listener : stopListeners) {
      listener.timerStopped(elapsed);
    }
    return elapsed;
  }
}
