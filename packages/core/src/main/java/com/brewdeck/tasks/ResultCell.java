package com.brewdeck.tasks;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-write, single-read slot handing one value from a background worker to the polling
 * coordinator.
 *
 * <p>The worker calls {@link #set(Object)} exactly once. The coordinator calls {@link #tryTake()}
 * once per frame until it yields the value; the call never waits, so a frame that races the writer
 * simply sees the value one frame later. After a successful take the cell is spent.
 */
public final class ResultCell<T> {
  private enum State {
    EMPTY,
    WRITTEN,
    CONSUMED
  }

  private final ReentrantLock lock = new ReentrantLock();

  // guarded by lock
  private State state = State.EMPTY;
  private T value;

  /**
   * Publish the value. Blocks only for the brief time a concurrent {@link #tryTake()} holds the
   * guard.
   *
   * @throws IllegalStateException if the cell was already written
   */
  public void set(T value) {
    Objects.requireNonNull(value, "value");
    lock.lock();
    try {
      if (state != State.EMPTY) {
        throw new IllegalStateException("ResultCell already written");
      }
      this.value = value;
      this.state = State.WRITTEN;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Non-blocking read. Returns empty while the cell is unwritten or while another thread holds the
   * guard.
   *
   * @throws IllegalStateException if the value was already taken
   */
  public Optional<T> tryTake() {
    if (!lock.tryLock()) {
      return Optional.empty();
    }
    try {
      if (state == State.EMPTY) {
        return Optional.empty();
      }
      if (state == State.CONSUMED) {
        throw new IllegalStateException("ResultCell already consumed");
      }
      T taken = value;
      value = null;
      state = State.CONSUMED;
      return Optional.of(taken);
    } finally {
      lock.unlock();
    }
  }

  /** Best-effort probe; {@code false} under contention. */
  public boolean isWritten() {
    if (!lock.tryLock()) {
      return false;
    }
    try {
      return state == State.WRITTEN;
    } finally {
      lock.unlock();
    }
  }

  // Visible for tests that need to simulate a writer holding the guard.
  ReentrantLock guard() {
    return lock;
  }
}
