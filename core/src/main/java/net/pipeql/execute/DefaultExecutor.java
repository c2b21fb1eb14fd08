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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.plan.PlanSpec;
import net.pipeql.plan.Procedure;
import net.pipeql.plan.ProcedureID;
import net.pipeql.query.QueryContext;
import net.pipeql.query.QueryTime;
import net.pipeql.query.Result;
import net.pipeql.utils.DateTime;
import net.pipeql.utils.Exceptions;
import net.pipeql.utils.Pair;

/**
 * Instantiates a plan as a graph of sources and transformations, runs
 * the sources on a worker pool and collects the named results.
 * 
 * @since 1.0
 */
public class DefaultExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultExecutor.class);
  
  private final TransformationRegistry registry;
  private final ExecutorService pool;
  private final Map<String, Object> dependencies;
  
  /**
   * @param registry The non-null transformation registry.
   * @param pool The non-null pool sources are run on.
   * @param dependencies Dependencies handed to sources and 
   * transformations, may be null.
   */
  public DefaultExecutor(final TransformationRegistry registry, 
                         final ExecutorService pool, 
                         final Map<String, Object> dependencies) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    if (pool == null) {
      throw new IllegalArgumentException("Pool cannot be null.");
    }
    this.registry = registry;
    this.pool = pool;
    this.dependencies = dependencies == null 
        ? Collections.<String, Object>emptyMap() 
        : Collections.unmodifiableMap(Maps.newHashMap(dependencies));
  }
  
  /**
   * Builds the execution graph and starts every source.
   * @param context The non-null query context.
   * @param org The organization the query runs for.
   * @param plan The non-null plan.
   * @param allocator The query's allocator.
   * @return A deferred called back with the results by name once all of
   * them are complete, or with the first error.
   * @throws QueryExecutionException if a procedure kind has no 
   * transformation or a transformation could not be created.
   */
  public Deferred<Map<String, Result>> execute(final QueryContext context, 
                                               final String org, 
                                               final PlanSpec plan, 
                                               final Allocator allocator) {
    final ExecutionState state = new ExecutionState(context, org, plan, 
        allocator);
    final Map<String, ExecutionResult> results = Maps.newLinkedHashMap();
    for (final Map.Entry<String, ProcedureID> entry : 
        plan.results().entrySet()) {
      final Node node = state.createNode(plan.procedure(entry.getValue()));
      final ExecutionResult result = new ExecutionResult(entry.getKey());
      node.addTransformation(result);
      results.put(entry.getKey(), result);
    }
    
    for (final Source source : state.sources) {
      startSource(context, source);
    }
    
    final List<Deferred<Result>> deferreds = 
        Lists.newArrayListWithCapacity(results.size());
    for (final ExecutionResult result : results.values()) {
      deferreds.add(result.deferred());
    }
    
    class GroupCB implements Callback<Map<String, Result>, 
        ArrayList<Result>> {
      @Override
      public Map<String, Result> call(final ArrayList<Result> done) 
          throws Exception {
        final Map<String, Result> map = Maps.newLinkedHashMap();
        for (final Result result : done) {
          map.put(result.name(), result);
        }
        return map;
      }
    }
    
    class ErrCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        if (e instanceof DeferredGroupException) {
          final Throwable cause = Exceptions.getCause(
              (DeferredGroupException) e);
          if (cause instanceof Exception) {
            return cause;
          }
          return new QueryExecutionException(cause.getMessage(), 500, cause);
        }
        return e;
      }
    }
    
    return Deferred.group(deferreds)
        .addCallbacks(new GroupCB(), new ErrCB());
  }
  
  private void startSource(final QueryContext context, final Source source) {
    try {
      pool.submit(new Runnable() {
        @Override
        public void run() {
          final long start = DateTime.nanoTime();
          if (LOG.isDebugEnabled()) {
            LOG.debug("Starting source " + source);
          }
          source.run(context);
          if (LOG.isDebugEnabled()) {
            LOG.debug("Finished source " + source + " in " 
                + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
          }
        }
      });
    } catch (RejectedExecutionException e) {
      LOG.warn("Unable to schedule source " + source, e);
      final QueryExecutionException error = new QueryExecutionException(
          "failed to schedule source: " + e.getMessage(), 503, e);
      if (source instanceof AbstractSource) {
        ((AbstractSource) source).finish(error);
      } else {
        throw error;
      }
    }
  }
  
  /** The nodes of one execution. */
  private class ExecutionState {
    private final QueryContext context;
    private final String org;
    private final PlanSpec plan;
    private final Allocator allocator;
    private final Map<ProcedureID, Node> nodes;
    private final List<Source> sources;
    
    ExecutionState(final QueryContext context, 
                   final String org, 
                   final PlanSpec plan, 
                   final Allocator allocator) {
      this.context = context;
      this.org = org;
      this.plan = plan;
      this.allocator = allocator;
      nodes = Maps.newHashMap();
      sources = Lists.newArrayList();
    }
    
    Node createNode(final Procedure procedure) {
      Node node = nodes.get(procedure.id());
      if (node != null) {
        return node;
      }
      final DatasetID id = DatasetID.fromProcedureID(procedure.id());
      final List<DatasetID> parents = Lists.newArrayList();
      for (final ProcedureID parent : procedure.parents()) {
        parents.add(DatasetID.fromProcedureID(parent));
      }
      final Administration administration = new Administration(parents);
      final String kind = procedure.spec().kind();
      
      final CreateSource create_source = registry.source(kind);
      if (create_source != null) {
        final Source source = create_source.create(procedure.spec(), id, 
            administration);
        sources.add(source);
        nodes.put(procedure.id(), source);
        return source;
      }
      
      final CreateTransformation create = registry.transformation(kind);
      if (create == null) {
        throw new QueryExecutionException("unsupported procedure kind \"" 
            + kind + "\"", 400);
      }
      final Pair<Transformation, Dataset> pair = create.create(id, 
          AccumulationMode.DISCARDING, procedure.spec(), administration);
      nodes.put(procedure.id(), pair.getValue());
      
      final Transformation transport = 
          new ConsecutiveTransport(pair.getKey());
      for (final ProcedureID parent : procedure.parents()) {
        createNode(plan.procedure(parent)).addTransformation(transport);
      }
      return pair.getValue();
    }
    
    private class Administration implements ExecutionAdministration {
      private final List<DatasetID> parents;
      
      Administration(final List<DatasetID> parents) {
        this.parents = ImmutableList.copyOf(parents);
      }
      
      @Override
      public String organizationID() {
        return org;
      }
      
      @Override
      public QueryContext context() {
        return context;
      }
      
      @Override
      public Instant now() {
        return plan.now();
      }
      
      @Override
      public long resolveTime(final QueryTime time) {
        return DateTime.toNanos(time.time(plan.now()));
      }
      
      @Override
      public Allocator allocator() {
        return allocator;
      }
      
      @Override
      public List<DatasetID> parents() {
        return parents;
      }
      
      @Override
      public DatasetID convertID(final ProcedureID id) {
        return DatasetID.fromProcedureID(id);
      }
      
      @Override
      public Map<String, Object> dependencies() {
        return dependencies;
      }
    }
  }
}
