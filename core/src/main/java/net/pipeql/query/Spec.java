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

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

import net.pipeql.exceptions.PlanException;

/**
 * The portable result of compiling a script: operations in dependency 
 * order, the edges between them and the evaluation instant. Serializes
 * to {@code {"operations":[{"kind","id","spec"}],"edges":[{"parent",
 * "child"}],"now"}}.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "operations", "edges", "now" })
public class Spec {
  private final List<Operation> operations;
  private final List<Edge> edges;
  private final Instant now;
  
  /** Lazily built lookup, guarded by this. */
  private Map<String, Operation> by_id;
  
  /**
   * @param operations The non-null operations, parents before children.
   * @param edges The non-null edges.
   * @param now The non-null evaluation instant.
   */
  public Spec(final List<Operation> operations, 
              final List<Edge> edges, 
              final Instant now) {
    if (operations == null || edges == null) {
      throw new IllegalArgumentException("Operations and edges cannot be null.");
    }
    if (now == null) {
      throw new IllegalArgumentException("Now cannot be null.");
    }
    this.operations = ImmutableList.copyOf(operations);
    this.edges = ImmutableList.copyOf(edges);
    this.now = now;
  }
  
  @JsonProperty("operations")
  public List<Operation> getOperations() {
    return operations;
  }
  
  @JsonProperty("edges")
  public List<Edge> getEdges() {
    return edges;
  }
  
  @JsonProperty("now")
  public String getNowString() {
    return now.toString();
  }
  
  @JsonIgnore
  public Instant now() {
    return now;
  }
  
  /**
   * @param id An operation ID.
   * @return The operation or null if not present.
   */
  public synchronized Operation lookup(final String id) {
    if (by_id == null) {
      by_id = Maps.newHashMap();
      for (final Operation op : operations) {
        by_id.put(op.getId(), op);
      }
    }
    return by_id.get(id);
  }
  
  /**
   * @param id An operation ID.
   * @return The parent IDs in edge order.
   */
  public List<String> parents(final String id) {
    final List<String> parents = Lists.newArrayList();
    for (final Edge edge : edges) {
      if (edge.getChild().equals(id)) {
        parents.add(edge.getParent());
      }
    }
    return Collections.unmodifiableList(parents);
  }
  
  /**
   * @param id An operation ID.
   * @return The child IDs in edge order.
   */
  public List<String> children(final String id) {
    final List<String> children = Lists.newArrayList();
    for (final Edge edge : edges) {
      if (edge.getParent().equals(id)) {
        children.add(edge.getChild());
      }
    }
    return Collections.unmodifiableList(children);
  }
  
  /**
   * Checks that IDs are unique, every edge references an operation and
   * the graph is acyclic. Specs built by the compiler always pass; this
   * is for specs decoded from JSON.
   * @throws PlanException if the spec is invalid.
   */
  public void validate() {
    final MutableGraph<String> graph = GraphBuilder.directed()
        .allowsSelfLoops(true)
        .build();
    for (final Operation op : operations) {
      if (!graph.addNode(op.getId())) {
        throw new PlanException("found duplicate operation ID \"" 
            + op.getId() + "\"");
      }
    }
    for (final Edge edge : edges) {
      if (!graph.nodes().contains(edge.getParent()) 
          || !graph.nodes().contains(edge.getChild())) {
        throw new PlanException("edge " + edge 
            + " references an unknown operation");
      }
      graph.putEdge(edge.getParent(), edge.getChild());
    }
    if (Graphs.hasCycle(graph)) {
      throw new PlanException("found a cycle in the operation graph");
    }
  }
  
  @Override
  public String toString() {
    return "operations=" + operations + ", edges=" + edges + ", now=" + now;
  }
}
