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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.exceptions.RegistryException;

/**
 * Maps procedure kinds to their constructors and operation kinds to the
 * candidate constructors the planner may use for them.
 * 
 * @since 1.0
 */
public class ProcedureRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      ProcedureRegistry.class);
  
  private final Map<String, CreateProcedureSpec> kinds;
  private final Map<String, List<CreateProcedureSpec>> operations;
  private volatile boolean frozen;
  
  public ProcedureRegistry() {
    kinds = Maps.newHashMap();
    operations = Maps.newHashMap();
  }
  
  /**
   * Registers a procedure kind.
   * @param kind The non-null and non-empty procedure kind.
   * @param create The non-null constructor.
   * @param operation_kinds The operation kinds the procedure implements.
   * @throws RegistryException on a duplicate kind or if frozen.
   */
  public void registerProcedureSpec(final String kind, 
                                    final CreateProcedureSpec create, 
                                    final String... operation_kinds) {
    if (Strings.isNullOrEmpty(kind)) {
      throw new RegistryException("Procedure kind cannot be null or empty.");
    }
    if (create == null) {
      throw new RegistryException("Constructor cannot be null for procedure "
          + "kind: " + kind);
    }
    if (frozen) {
      throw new RegistryException("Registry is frozen, cannot register "
          + "procedure kind: " + kind);
    }
    if (kinds.containsKey(kind)) {
      throw new RegistryException("Duplicate registration for procedure "
          + "kind: " + kind);
    }
    kinds.put(kind, create);
    for (final String operation_kind : operation_kinds) {
      List<CreateProcedureSpec> creates = operations.get(operation_kind);
      if (creates == null) {
        creates = Lists.newArrayList();
        operations.put(operation_kind, creates);
      }
      creates.add(create);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered procedure kind " + kind + " for operations " 
          + Lists.newArrayList(operation_kinds));
    }
  }
  
  public void freeze() {
    frozen = true;
    LOG.info("Froze procedure registry with " + kinds.size() + " kinds.");
  }
  
  /**
   * @param operation_kind An operation kind.
   * @return The candidate constructors, empty if none.
   */
  public List<CreateProcedureSpec> forOperation(final String operation_kind) {
    final List<CreateProcedureSpec> creates = operations.get(operation_kind);
    return creates == null ? Collections.<CreateProcedureSpec>emptyList() 
        : ImmutableList.copyOf(creates);
  }
  
  /**
   * @param kind A procedure kind.
   * @return The constructor or null if not registered.
   */
  public CreateProcedureSpec forKind(final String kind) {
    return kinds.get(kind);
  }
}
