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
package net.pipeql.functions;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AbstractSource;
import net.pipeql.execute.Aggregates;
import net.pipeql.execute.CreateSource;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.query.QueryContext;
import net.pipeql.storage.ReadSpec;
import net.pipeql.storage.StorageReader;
import net.pipeql.utils.DateTime;

/**
 * Reads the bucket through the {@link StorageReader} dependency and emits
 * one table per series, then advances the watermark to the range stop.
 * 
 * @since 1.0
 */
public class FromSource extends AbstractSource {
  private static final Logger LOG = LoggerFactory.getLogger(FromSource.class);
  
  private final StorageReader reader;
  private final ReadSpec read_spec;
  private final ExecutionAdministration administration;
  
  FromSource(final DatasetID id, 
             final StorageReader reader, 
             final ReadSpec read_spec, 
             final ExecutionAdministration administration) {
    super(id);
    this.reader = reader;
    this.read_spec = read_spec;
    this.administration = administration;
  }
  
  @Override
  protected void produce(final QueryContext context) {
    final long start = DateTime.nanoTime();
    final List<Table> tables = reader.read(read_spec, 
        administration.allocator());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Read " + tables.size() + " tables for " + read_spec + " in " 
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
    for (final Table table : tables) {
      context.throwIfDone();
      emit(table);
    }
    context.throwIfDone();
    updateWatermark(read_spec.stop());
  }
  
  @Override
  public String toString() {
    return "FromSource(" + id + ", " + read_spec.bucket() + ")";
  }
  
  /** Builds the source, requires bounds and a storage reader. */
  public static class Create implements CreateSource {
    @Override
    public FromSource create(final ProcedureSpec spec, 
                             final DatasetID id, 
                             final ExecutionAdministration administration) {
      if (!(spec instanceof FromProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final FromProcedureSpec from = (FromProcedureSpec) spec;
      if (!from.boundsSet()) {
        throw new QueryExecutionException("bounds must be set", 400);
      }
      final Object dependency = administration.dependencies().get(
          StorageReader.DEPENDENCY);
      if (!(dependency instanceof StorageReader)) {
        throw new QueryExecutionException("missing storage reader dependency "
            + "for from", 500);
      }
      Aggregates aggregate = null;
      if (from.aggregateSet()) {
        aggregate = Aggregates.fromMethod(from.aggregateMethod());
        if (aggregate == null) {
          throw new QueryExecutionException("unsupported aggregate method: " 
              + from.aggregateMethod(), 400);
        }
      }
      final long start = from.bounds().start().isZero() ? Long.MIN_VALUE 
          : administration.resolveTime(from.bounds().start());
      final long stop = from.bounds().stop().isZero() 
          ? DateTime.toNanos(administration.now())
          : administration.resolveTime(from.bounds().stop());
      if (stop < start) {
        throw new QueryExecutionException("invalid bounds: stop " 
            + from.bounds().stop() + " is before start " 
            + from.bounds().start(), 400);
      }
      final ReadSpec read_spec = ReadSpec.newBuilder()
          .setOrganizationID(administration.organizationID())
          .setBucket(from.bucket())
          .setStart(start)
          .setStop(stop)
          .setAggregate(aggregate)
          .build();
      return new FromSource(id, (StorageReader) dependency, read_spec, 
          administration);
    }
  }
}
