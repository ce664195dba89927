package com.onthegomap.tilestash.stats;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * A {@code long} value that can go up and down, updated from HTTP completion threads and read from the download
 * driver thread.
 */
public interface Counter {

  default void inc() {
    incBy(1);
  }

  default void dec() {
    incBy(-1);
  }

  void incBy(long value);

  /** A counter that lets clients get the current value. */
  interface Readable extends Counter, LongSupplier {

    long get();

    @Override
    default long getAsLong() {
      return get();
    }
  }

  /** Returns a counter starting at {@code initial} that is safe for reads and writes from multiple threads. */
  static Readable newCounter(long initial) {
    return new AtomicCounter(initial);
  }

  /** Returns a counter starting at 0. */
  static Readable newCounter() {
    return newCounter(0);
  }

  class AtomicCounter implements Readable {

    private final AtomicLong counter;

    private AtomicCounter(long initial) {
      this.counter = new AtomicLong(initial);
    }

    @Override
    public void incBy(long value) {
      counter.addAndGet(value);
    }

    @Override
    public long get() {
      return counter.get();
    }

    @Override
    public String toString() {
      return Long.toString(get());
    }
  }
}
