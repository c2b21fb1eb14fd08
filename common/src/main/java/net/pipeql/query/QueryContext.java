// This file is part of PipeQL.
// Copyright (C) 2018-2020  The PipeQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pipeql.query;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import io.opentracing.Tracer;
import net.pipeql.exceptions.QueryExecutionCanceled;

/**
 * A cancellation scope for a query or task run. Contexts form a tree:
 * cancelling a parent cancels every child but a child never cancels its
 * parent. A context may carry a deadline scheduled on a Netty timer and
 * an optional tracer.
 * <p>
 * Cancellation fires exactly once. Listeners obtained through 
 * {@link #done()} are called back with null once the cause is 
 * available from {@link #err()}. A cancelled child unregisters from its
 * parent so long lived parents only hold their live children.
 * 
 * @since 1.0
 */
public class QueryContext {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);
  
  /** The root that is never cancelled. */
  private static final QueryContext BACKGROUND = new QueryContext(null, null) {
    @Override
    public void cancel(final Throwable cause) {
      throw new UnsupportedOperationException(
          "The background context cannot be cancelled.");
    }

    @Override
    public Deferred<Object> done() {
      // never called back so don't hold on to it.
      return new Deferred<Object>();
    }
  };
  
  /** The parent, null for the root. */
  protected final QueryContext parent;
  
  /** An optional tracer. */
  protected final Tracer tracer;
  
  /** Listeners waiting on cancellation. Guarded by this. */
  protected final Set<Deferred<Object>> listeners;
  
  /** The cause once cancelled, written under this. */
  protected volatile Throwable error;
  
  /** Our listener on the parent. Guarded by this. */
  private Deferred<Object> parent_listener;
  
  /** An optional deadline. Guarded by this. */
  protected Timeout deadline;
  
  protected QueryContext(final QueryContext parent, final Tracer tracer) {
    this.parent = parent;
    this.tracer = tracer;
    listeners = Sets.newLinkedHashSet();
  }
  
  /** @return The root context that is never cancelled. */
  public static QueryContext background() {
    return BACKGROUND;
  }
  
  /**
   * Creates a cancellable child.
   * @param parent A non-null parent.
   * @return The child context.
   */
  public static QueryContext withCancel(final QueryContext parent) {
    if (parent == null) {
      throw new IllegalArgumentException("Parent cannot be null.");
    }
    final QueryContext child = new QueryContext(parent, parent.tracer);
    child.link();
    return child;
  }
  
  /**
   * Creates a child that carries the given tracer.
   * @param parent A non-null parent.
   * @param tracer A tracer, may be null.
   * @return The child context.
   */
  public static QueryContext withTracer(final QueryContext parent, 
                                        final Tracer tracer) {
    if (parent == null) {
      throw new IllegalArgumentException("Parent cannot be null.");
    }
    final QueryContext child = new QueryContext(parent, tracer);
    child.link();
    return child;
  }
  
  /**
   * Creates a child that cancels itself after the timeout with a 
   * {@link QueryExecutionCanceled#DEADLINE_EXCEEDED} error.
   * @param parent A non-null parent.
   * @param timer A non-null timer to schedule the deadline on.
   * @param timeout_ms The timeout in milliseconds, greater than zero.
   * @return The child context.
   */
  public static QueryContext withTimeout(final QueryContext parent,
                                         final Timer timer,
                                         final long timeout_ms) {
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    if (timeout_ms < 1) {
      throw new IllegalArgumentException("Timeout must be greater than zero.");
    }
    final QueryContext child = withCancel(parent);
    final Timeout timeout = timer.newTimeout(new TimerTask() {
      @Override
      public void run(final Timeout timeout) throws Exception {
        child.cancel(new QueryExecutionCanceled("context deadline exceeded", 
            QueryExecutionCanceled.DEADLINE_EXCEEDED));
      }
    }, timeout_ms, TimeUnit.MILLISECONDS);
    synchronized (child) {
      if (child.error != null) {
        timeout.cancel();
      } else {
        child.deadline = timeout;
      }
    }
    return child;
  }
  
  /** Cancels with a {@link QueryExecutionCanceled#CANCELED} error. */
  public void cancel() {
    cancel(new QueryExecutionCanceled("context canceled", 
        QueryExecutionCanceled.CANCELED));
  }
  
  /**
   * Cancels the context and all children. Only the first call has any
   * effect.
   * @param cause A non-null cause.
   */
  public void cancel(final Throwable cause) {
    if (cause == null) {
      throw new IllegalArgumentException("Cause cannot be null.");
    }
    final List<Deferred<Object>> to_call;
    final Deferred<Object> linked;
    synchronized (this) {
      if (error != null) {
        return;
      }
      error = cause;
      linked = parent_listener;
      parent_listener = null;
      if (deadline != null) {
        deadline.cancel();
        deadline = null;
      }
      to_call = Lists.newArrayList(listeners);
      listeners.clear();
    }
    if (linked != null) {
      parent.removeListener(linked);
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Cancelled context " + this + ": " + cause.getMessage());
    }
    for (final Deferred<Object> listener : to_call) {
      listener.callback(null);
    }
  }
  
  /** @return Whether or not the context was cancelled. */
  public boolean isDone() {
    return error != null;
  }
  
  /** @return The cancellation cause or null if still live. */
  public Throwable err() {
    return error;
  }
  
  /** @return The tracer or null if tracing is disabled. */
  public Tracer tracer() {
    return tracer;
  }
  
  /**
   * Returns a new deferred that is called back with null on 
   * cancellation. If already cancelled, the deferred has the result.
   * The cause is read from {@link #err()}.
   * @return A non-null deferred.
   */
  public Deferred<Object> done() {
    synchronized (this) {
      if (error == null) {
        final Deferred<Object> deferred = new Deferred<Object>();
        listeners.add(deferred);
        return deferred;
      }
    }
    return Deferred.fromResult(null);
  }
  
  /**
   * Throws the cancellation cause if cancelled.
   * @throws QueryExecutionCanceled if cancelled.
   */
  public void throwIfDone() {
    final Throwable e = error;
    if (e == null) {
      return;
    }
    if (e instanceof QueryExecutionCanceled) {
      throw (QueryExecutionCanceled) e;
    }
    throw new QueryExecutionCanceled(e.getMessage(), 
        QueryExecutionCanceled.CANCELED, e);
  }
  
  private void link() {
    if (parent == BACKGROUND) {
      return;
    }
    class ParentCB implements Callback<Object, Object> {
      @Override
      public Object call(final Object ignored) throws Exception {
        cancel(parent.err());
        return null;
      }
    }
    final Deferred<Object> listener = parent.done();
    synchronized (this) {
      if (error == null) {
        parent_listener = listener;
      }
    }
    listener.addCallback(new ParentCB());
  }
  
  /** @param listener A listener to drop once its child is cancelled. */
  private void removeListener(final Deferred<Object> listener) {
    synchronized (this) {
      listeners.remove(listener);
    }
  }
}
