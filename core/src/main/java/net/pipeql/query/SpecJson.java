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
import java.time.format.DateTimeParseException;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.pipeql.exceptions.CompileException;
import net.pipeql.utils.JSON;

/**
 * Encodes specs to JSON and decodes them using the operation spec 
 * classes registered with a {@link BuiltinRegistry}.
 * 
 * @since 1.0
 */
public final class SpecJson {
  
  private SpecJson() { }
  
  /**
   * @param spec A non-null spec.
   * @return The JSON encoding.
   */
  public static String encode(final Spec spec) {
    return JSON.serializeToString(spec);
  }
  
  /**
   * @param json A non-null and non-empty JSON spec.
   * @param registry The registry to resolve operation kinds with.
   * @return The decoded spec.
   * @throws IllegalArgumentException if the JSON did not parse.
   * @throws CompileException if an operation kind is unknown or a field 
   * is invalid.
   */
  public static Spec decode(final String json, final BuiltinRegistry registry) {
    final JsonNode root = JSON.parseToTree(json);
    
    final List<Operation> operations = Lists.newArrayList();
    final JsonNode ops = root.get("operations");
    if (ops != null) {
      for (final JsonNode node : ops) {
        final String kind = text(node, "kind");
        final String id = text(node, "id");
        final Class<? extends OperationSpec> clazz = 
            registry.operationSpec(kind);
        if (clazz == null) {
          throw new CompileException("unknown operation kind \"" + kind 
              + "\" for operation " + id);
        }
        final JsonNode spec = node.get("spec");
        try {
          operations.add(new Operation(id, JSON.getMapper().treeToValue(
              spec == null ? JSON.getMapper().createObjectNode() : spec, 
                  clazz)));
        } catch (JsonProcessingException e) {
          throw new CompileException("failed to decode spec of operation " 
              + id, e);
        }
      }
    }
    
    final List<Edge> edges = Lists.newArrayList();
    final JsonNode edge_nodes = root.get("edges");
    if (edge_nodes != null) {
      for (final JsonNode node : edge_nodes) {
        edges.add(new Edge(text(node, "parent"), text(node, "child")));
      }
    }
    
    final String now = text(root, "now");
    try {
      return new Spec(operations, edges, Instant.parse(now));
    } catch (DateTimeParseException e) {
      throw new CompileException("invalid now time: " + now, e);
    }
  }
  
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || Strings.isNullOrEmpty(value.asText())) {
      throw new CompileException("missing field \"" + field + "\" in spec");
    }
    return value.asText();
  }
}
