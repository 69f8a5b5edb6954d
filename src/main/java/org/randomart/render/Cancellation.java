/*
 * Copyright 2025 The Randomart Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.randomart.render;

import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cancellation signal that can be shared between the code that starts a computation and code
 * that may need to stop it (e.g. an interrupt handler). Cancelling is permanent and may happen on
 * any thread.
 *
 * <p>Cancellations form a tree: cancelling a Cancellation also cancels all the children created
 * from it, but cancelling a child has no effect on its parent.
 */
public final class Cancellation {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** The listeners to run when cancelled; set to null once they have been run. */
  @GuardedBy("this")
  private List<Runnable> listeners = new ArrayList<>();

  private Cancellation() {}

  /** Returns a new Cancellation that is cancelled only by calling its {@link #cancel} method. */
  public static Cancellation create() {
    return new Cancellation();
  }

  /**
   * Returns a new Cancellation that will be cancelled when this one is. Once the child is cancelled
   * it no longer holds a reference from its parent.
   */
  public Cancellation child() {
    Cancellation child = new Cancellation();
    Runnable unregister = onCancel(child::cancel);
    child.onCancel(unregister);
    return child;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Cancels this and its children; has no effect if already cancelled. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    List<Runnable> toRun;
    synchronized (this) {
      toRun = listeners;
      listeners = null;
    }
    logger.atFine().log("Cancelling; %d listeners", toRun.size());
    toRun.forEach(Runnable::run);
  }

  /**
   * Arranges for {@code listener} to be run (once) when this is cancelled; if it has already been
   * cancelled, runs {@code listener} immediately. Returns a Runnable that unregisters the listener.
   */
  @CanIgnoreReturnValue
  public Runnable onCancel(Runnable listener) {
    synchronized (this) {
      if (listeners != null) {
        listeners.add(listener);
        return () -> removeListener(listener);
      }
    }
    listener.run();
    return () -> {};
  }

  private synchronized void removeListener(Runnable listener) {
    if (listeners != null) {
      listeners.remove(listener);
    }
  }
}
