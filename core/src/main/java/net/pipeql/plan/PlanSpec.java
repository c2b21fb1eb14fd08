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

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * The procedure graph produced by the planner along with the execution
 * order, the named results and the overall time bounds.
 * 
 * @since 1.0
 */
public class PlanSpec {
  public static final String DEFAULT_YIELD_NAME = "_result";
  
  private final Map<ProcedureID, Procedure> procedures;
  private final List<ProcedureID> order;
  private final Map<String, ProcedureID> results;
  private final Instant now;
  private BoundsSpec bounds;
  
  public PlanSpec(final Instant now) {
    this.now = now;
    procedures = Maps.newLinkedHashMap();
    order = Lists.newArrayList();
    results = Maps.newLinkedHashMap();
    bounds = BoundsSpec.ZERO;
  }
  
  /** Adds the procedure and points it at this plan. */
  void add(final Procedure procedure) {
    procedure.plan = this;
    procedures.put(procedure.id(), procedure);
  }
  
  void remove(final ProcedureID id) {
    procedures.remove(id);
    order.remove(id);
  }
  
  void setOrder(final List<ProcedureID> order) {
    this.order.clear();
    this.order.addAll(order);
  }
  
  void setBounds(final BoundsSpec bounds) {
    this.bounds = bounds;
  }
  
  void addResult(final String name, final ProcedureID id) {
    results.put(name, id);
  }
  
  /**
   * @param id A procedure ID.
   * @return The procedure or null if not in the plan.
   */
  public Procedure procedure(final ProcedureID id) {
    return procedures.get(id);
  }
  
  public Map<ProcedureID, Procedure> procedures() {
    return Collections.unmodifiableMap(procedures);
  }
  
  /** @return Procedure IDs with parents always before children. */
  public List<ProcedureID> order() {
    return Collections.unmodifiableList(order);
  }
  
  /** @return The procedure producing each named result. */
  public Map<String, ProcedureID> results() {
    return Collections.unmodifiableMap(results);
  }
  
  public Instant now() {
    return now;
  }
  
  /** @return The union of the bounds of the result procedures. */
  public BoundsSpec bounds() {
    return bounds;
  }
  
  /** @return Procedures without parents, in plan order. */
  public List<Procedure> roots() {
    final List<Procedure> roots = Lists.newArrayList();
    for (final ProcedureID id : order) {
      final Procedure procedure = procedures.get(id);
      if (procedure.parents().isEmpty()) {
        roots.add(procedure);
      }
    }
    return roots;
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (final ProcedureID id : order) {
      final Procedure procedure = procedures.get(id);
      buf.append(procedure.spec().kind())
         .append(" ")
         .append(procedure.bounds())
         .append(" -> [");
      for (int i = 0; i < procedure.children().size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(procedures.get(procedure.children().get(i)).spec().kind());
      }
      buf.append("]\n");
    }
    return buf.toString();
  }
}
