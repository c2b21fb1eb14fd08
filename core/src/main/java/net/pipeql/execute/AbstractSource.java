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
package net.pipeql.execute;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.pipeql.data.Table;
import net.pipeql.query.QueryContext;

/**
 * Base for sources: fans tables out to consumers and guarantees a single
 * finish call, with the context's error if cancelled.
 * 
 * @since 1.0
 */
public abstract class AbstractSource implements Source {
  private static final Logger LOG = LoggerFactory.getLogger(
      AbstractSource.class);
  
  protected final DatasetID id;
  protected final List<Transformation> transformations;
  private final AtomicBoolean finished;
  
  protected AbstractSource(final DatasetID id) {
    this.id = id;
    transformations = Lists.newArrayList();
    finished = new AtomicBoolean();
  }
  
  @Override
  public DatasetID id() {
    return id;
  }
  
  @Override
  public void addTransformation(final Transformation t) {
    transformations.add(t);
  }
  
  @Override
  public void run(final QueryContext context) {
    Throwable error = null;
    try {
      produce(context);
    } catch (RuntimeException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Source " + this + " failed", e);
      }
      error = e;
    }
    if (error == null) {
      error = context.err();
    }
    finish(error);
  }
  
  /**
   * Produces the tables by calling {@link #emit(Table)}. Should call
   * {@link QueryContext#throwIfDone()} between tables.
   * @param context The query context.
   */
  protected abstract void produce(final QueryContext context);
  
  protected void emit(final Table table) {
    for (final Transformation t : transformations) {
      t.process(id, table);
    }
  }
  
  protected void updateWatermark(final long time) {
    for (final Transformation t : transformations) {
      t.updateWatermark(id, time);
    }
  }
  
  /** Finishes the consumers, only the first call has an effect. */
  public void finish(final Throwable error) {
    if (!finished.compareAndSet(false, true)) {
      return;
    }
    for (final Transformation t : transformations) {
      t.finish(id, error);
    }
  }
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + id + ")";
  }
}
