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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;

/**
 * Wraps a transformation so calls from parents on different threads are
 * serialized. The first exception thrown by the transformation finishes 
 * it with that error; later calls are dropped.
 * 
 * @since 1.0
 */
public class ConsecutiveTransport implements Transformation {
  private static final Logger LOG = LoggerFactory.getLogger(
      ConsecutiveTransport.class);
  
  private final Transformation transformation;
  private boolean failed;
  
  public ConsecutiveTransport(final Transformation transformation) {
    this.transformation = transformation;
  }
  
  @Override
  public synchronized void retractTable(final DatasetID id, 
                                        final GroupKey key) {
    if (failed) {
      return;
    }
    try {
      transformation.retractTable(id, key);
    } catch (RuntimeException e) {
      fail(id, e);
    }
  }
  
  @Override
  public synchronized void process(final DatasetID id, final Table table) {
    if (failed) {
      return;
    }
    try {
      transformation.process(id, table);
    } catch (RuntimeException e) {
      fail(id, e);
    }
  }
  
  @Override
  public synchronized void updateWatermark(final DatasetID id, 
                                           final long time) {
    if (failed) {
      return;
    }
    try {
      transformation.updateWatermark(id, time);
    } catch (RuntimeException e) {
      fail(id, e);
    }
  }
  
  @Override
  public synchronized void updateProcessingTime(final DatasetID id, 
                                                final long time) {
    if (failed) {
      return;
    }
    try {
      transformation.updateProcessingTime(id, time);
    } catch (RuntimeException e) {
      fail(id, e);
    }
  }
  
  @Override
  public synchronized void finish(final DatasetID id, final Throwable error) {
    if (failed) {
      return;
    }
    try {
      transformation.finish(id, error);
    } catch (RuntimeException e) {
      // the transformation could not finish, nothing downstream can.
      LOG.error("Transformation " + transformation + " failed to finish", e);
      failed = true;
    }
  }
  
  private void fail(final DatasetID id, final RuntimeException e) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Transformation " + transformation + " failed", e);
    }
    failed = true;
    transformation.finish(id, e);
  }
}
