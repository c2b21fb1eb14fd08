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
package net.pipeql.plan;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;

import net.pipeql.exceptions.PlanException;
import net.pipeql.query.Edge;
import net.pipeql.query.Operation;
import net.pipeql.query.Spec;

/**
 * Turns a {@link Spec} into a {@link PlanSpec}: one procedure per 
 * operation, push downs applied in plan order, bounds propagated from 
 * parents to children and results named.
 * <p>
 * Thread safe; state lives in the plan being built.
 * 
 * @since 1.0
 */
public class DefaultPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultPlanner.class);
  
  private final ProcedureRegistry registry;
  
  public DefaultPlanner(final ProcedureRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }
  
  /**
   * Plans the spec.
   * @param spec A non-null spec.
   * @return The plan.
   * @throws PlanException if an operation has no procedure, an edge is 
   * dangling, a push down is invalid or yield names collide.
   */
  public PlanSpec plan(final Spec spec) {
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    final PlanSpec plan = new PlanSpec(spec.now());
    final PlanAdministration administration = new PlanAdministration() {
      @Override
      public ProcedureID convertID(final String operation_id) {
        return ProcedureID.fromOperationID(operation_id);
      }
    };
    
    for (final Operation operation : spec.getOperations()) {
      final List<CreateProcedureSpec> creates = 
          registry.forOperation(operation.getKind());
      if (creates.isEmpty()) {
        throw new PlanException("no procedure registered for operation "
            + "kind \"" + operation.getKind() + "\"");
      }
      final ProcedureSpec procedure_spec = 
          creates.get(0).create(operation.getSpec(), administration);
      plan.add(new Procedure(ProcedureID.fromOperationID(operation.getId()), 
          procedure_spec));
    }
    
    for (final Edge edge : spec.getEdges()) {
      final Procedure parent = 
          plan.procedure(ProcedureID.fromOperationID(edge.getParent()));
      final Procedure child = 
          plan.procedure(ProcedureID.fromOperationID(edge.getChild()));
      if (parent == null || child == null) {
        throw new PlanException("edge " + edge 
            + " references an unknown operation");
      }
      parent.children().add(child.id());
      child.parents().add(parent.id());
    }
    plan.setOrder(order(plan));
    
    final Set<ProcedureID> leaves = Sets.newHashSet();
    for (final Procedure procedure : plan.procedures().values()) {
      if (procedure.children().isEmpty()) {
        leaves.add(procedure.id());
      }
    }
    
    pushDowns(plan, leaves);
    prune(plan, leaves);
    plan.setOrder(order(plan));
    computeBounds(plan);
    computeResults(plan);
    
    if (LOG.isDebugEnabled()) {
      LOG.debug("Planned query:\n" + plan);
    }
    return plan;
  }
  
  /** @return A topological order with parents before children. */
  static List<ProcedureID> order(final PlanSpec plan) {
    final List<ProcedureID> roots = Lists.newArrayList();
    for (final Procedure procedure : plan.procedures().values()) {
      if (procedure.parents().isEmpty()) {
        roots.add(procedure.id());
      }
    }
    final Traverser<ProcedureID> traverser = Traverser.forGraph(
        new SuccessorsFunction<ProcedureID>() {
          @Override
          public Iterable<? extends ProcedureID> successors(
              final ProcedureID id) {
            return plan.procedure(id).children();
          }
        });
    final List<ProcedureID> order = 
        Lists.newArrayList(traverser.depthFirstPostOrder(roots));
    Collections.reverse(order);
    if (order.size() != plan.procedures().size()) {
      throw new PlanException("found a cycle in the procedure graph");
    }
    return order;
  }
  
  private void pushDowns(final PlanSpec plan, final Set<ProcedureID> leaves) {
    for (final ProcedureID id : Lists.newArrayList(plan.order())) {
      final Procedure procedure = plan.procedure(id);
      if (procedure == null || 
          !(procedure.spec() instanceof PushDownProcedureSpec)) {
        continue;
      }
      final PushDownProcedureSpec spec = 
          (PushDownProcedureSpec) procedure.spec();
      boolean pushed = false;
      for (final PushDownRule rule : spec.pushDownRules()) {
        if (search(plan, procedure, procedure, rule, spec, 
            Lists.<Procedure>newArrayList())) {
          pushed = true;
          break;
        }
      }
      if (!pushed) {
        continue;
      }
      if (spec instanceof AggregateProcedureSpec) {
        final ProcedureSpec re_aggregate = 
            ((AggregateProcedureSpec) spec).reAggregateSpec();
        if (LOG.isDebugEnabled()) {
          LOG.debug("Pushed down aggregate " + spec.kind() 
              + ", replacing it with " + re_aggregate.kind());
        }
        procedure.setSpec(re_aggregate);
      } else {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Pushed down " + procedure + ", removing it.");
        }
        if (leaves.remove(procedure.id())) {
          leaves.addAll(procedure.parents());
        }
        removeProcedure(plan, procedure);
      }
    }
  }
  
  /**
   * Walks up from {@code current} looking for roots of the rule. The 
   * path holds the through procedures between the origin and the 
   * current procedure, nearest to the origin first.
   * @return True if at least one root absorbed the origin.
   */
  private boolean search(final PlanSpec plan, 
                         final Procedure origin, 
                         final Procedure current, 
                         final PushDownRule rule, 
                         final PushDownProcedureSpec spec, 
                         final List<Procedure> path) {
    boolean matched = false;
    for (final ProcedureID parent_id : 
        Lists.newArrayList(current.parents())) {
      final Procedure parent = plan.procedure(parent_id);
      final String kind = parent.spec().kind();
      if (kind.equals(rule.root())) {
        if (rule.matches(parent.spec())) {
          spec.pushDown(parent, new Duplicator(plan, parent, origin, 
              Lists.newArrayList(path)));
          matched = true;
        }
      } else if (rule.through().contains(kind)) {
        path.add(parent);
        matched |= search(plan, origin, parent, rule, spec, path);
        path.remove(path.size() - 1);
      }
    }
    return matched;
  }
  
  /**
   * Removes a single parent procedure and splices its children onto the
   * parent.
   */
  static void removeProcedure(final PlanSpec plan, final Procedure procedure) {
    if (procedure.parents().size() > 1) {
      throw new PlanException("cannot remove procedure " + procedure 
          + " with more than one parent");
    }
    plan.remove(procedure.id());
    for (final ProcedureID id : procedure.parents()) {
      final Procedure parent = plan.procedure(id);
      parent.children().remove(procedure.id());
      parent.children().addAll(procedure.children());
    }
    for (final ProcedureID id : procedure.children()) {
      final Procedure child = plan.procedure(id);
      final int idx = child.parents().indexOf(procedure.id());
      if (procedure.parents().isEmpty()) {
        child.parents().remove(idx);
        continue;
      }
      final ProcedureID new_parent = procedure.parents().get(0);
      child.parents().set(idx, new_parent);
      if (child.spec() instanceof ParentAwareProcedureSpec) {
        ((ParentAwareProcedureSpec) child.spec()).parentChanged(
            procedure.id(), new_parent);
      }
    }
  }
  
  /** Drops procedures left without children by duplication. */
  private void prune(final PlanSpec plan, final Set<ProcedureID> leaves) {
    boolean removed = true;
    while (removed) {
      removed = false;
      for (final Procedure procedure : 
          Lists.newArrayList(plan.procedures().values())) {
        if (!procedure.children().isEmpty() || 
            leaves.contains(procedure.id())) {
          continue;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Pruning procedure without children: " + procedure);
        }
        plan.remove(procedure.id());
        for (final ProcedureID id : procedure.parents()) {
          plan.procedure(id).children().remove(procedure.id());
        }
        removed = true;
      }
    }
  }
  
  private void computeBounds(final PlanSpec plan) {
    for (final ProcedureID id : plan.order()) {
      final Procedure procedure = plan.procedure(id);
      BoundsSpec parents = null;
      for (final ProcedureID parent_id : procedure.parents()) {
        final BoundsSpec bounds = plan.procedure(parent_id).bounds();
        if (bounds.isZero()) {
          continue;
        }
        parents = parents == null ? bounds : parents.union(bounds, plan.now());
      }
      final BoundsSpec own = procedure.spec() instanceof BoundedProcedureSpec 
          ? ((BoundedProcedureSpec) procedure.spec()).timeBounds() 
          : BoundsSpec.ZERO;
      if (!own.isZero() && parents != null) {
        procedure.setBounds(own.intersect(parents, plan.now()));
      } else if (!own.isZero()) {
        procedure.setBounds(own);
      } else if (parents != null) {
        procedure.setBounds(parents);
      }
    }
  }
  
  private void computeResults(final PlanSpec plan) {
    BoundsSpec bounds = null;
    for (final ProcedureID id : plan.order()) {
      final Procedure procedure = plan.procedure(id);
      final String name;
      if (procedure.spec() instanceof YieldProcedureSpec) {
        name = ((YieldProcedureSpec) procedure.spec()).yieldName();
      } else if (procedure.children().isEmpty()) {
        name = PlanSpec.DEFAULT_YIELD_NAME;
      } else {
        continue;
      }
      if (plan.results().containsKey(name)) {
        throw new PlanException("found duplicate yield name \"" + name + "\"");
      }
      plan.addResult(name, id);
      if (!procedure.bounds().isZero()) {
        bounds = bounds == null ? procedure.bounds() 
            : bounds.union(procedure.bounds(), plan.now());
      }
    }
    if (bounds != null) {
      plan.setBounds(bounds);
    }
  }
  
  /**
   * Copies a root and the through procedures below it so that one branch
   * can be modified without affecting the others. The copy is made at 
   * most once.
   */
  private static class Duplicator implements Supplier<Procedure> {
    private final PlanSpec plan;
    private final Procedure root;
    private final Procedure origin;
    private final List<Procedure> path;
    private Procedure duplicate;
    
    Duplicator(final PlanSpec plan, 
               final Procedure root, 
               final Procedure origin, 
               final List<Procedure> path) {
      this.plan = plan;
      this.root = root;
      this.origin = origin;
      this.path = path;
    }
    
    @Override
    public Procedure get() {
      if (duplicate != null) {
        return duplicate;
      }
      duplicate = copy(root, root.parents());
      for (final ProcedureID id : root.parents()) {
        plan.procedure(id).children().add(duplicate.id());
      }
      
      Procedure previous = duplicate;
      for (int i = path.size() - 1; i >= 0; i--) {
        final Procedure copy = copy(path.get(i), 
            Collections.singletonList(previous.id()));
        previous.children().add(copy.id());
        previous = copy;
      }
      
      final Procedure old_parent = path.isEmpty() ? root : path.get(0);
      old_parent.children().remove(origin.id());
      previous.children().add(origin.id());
      final int idx = origin.parents().indexOf(old_parent.id());
      origin.parents().set(idx, previous.id());
      if (origin.spec() instanceof ParentAwareProcedureSpec) {
        ((ParentAwareProcedureSpec) origin.spec()).parentChanged(
            old_parent.id(), previous.id());
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Duplicated " + root + " as " + duplicate + " for " 
            + origin);
      }
      return duplicate;
    }
    
    private Procedure copy(final Procedure source, 
                           final List<ProcedureID> parents) {
      ProcedureID id = ProcedureID.forDuplicate(source.id());
      while (plan.procedure(id) != null) {
        id = ProcedureID.forDuplicate(id);
      }
      final Procedure copy = source.copy(id);
      copy.parents().clear();
      copy.parents().addAll(parents);
      copy.children().clear();
      plan.add(copy);
      return copy;
    }
  }
}
