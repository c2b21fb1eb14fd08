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
package net.pipeql.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pipeql.execute.TransformationRegistry;
import net.pipeql.functions.BuiltinFunctions;
import net.pipeql.plan.ProcedureRegistry;
import net.pipeql.query.BuiltinRegistry;
import net.pipeql.query.ScriptCompiler;

/**
 * The builtin, procedure and transformation registries of a process.
 * The constructor registers every builtin operator and freezes the
 * registries so a failure to register is fatal at startup.
 * 
 * @since 1.0
 */
public class DefaultRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultRegistry.class);
  
  private final BuiltinRegistry builtins;
  private final ProcedureRegistry procedures;
  private final TransformationRegistry transformations;
  private final ScriptCompiler compiler;
  
  /**
   * Builds and freezes the registries.
   * @throws net.pipeql.exceptions.RegistryException if a registration
   * or a builtin script failed.
   */
  public DefaultRegistry() {
    builtins = new BuiltinRegistry();
    procedures = new ProcedureRegistry();
    transformations = new TransformationRegistry();
    
    builtins.registerBuiltInOption(ScriptCompiler.NOW_OPTION, 
        new ScriptCompiler.NowFunction(null));
    BuiltinFunctions.register(builtins, procedures, transformations);
    
    builtins.freeze();
    procedures.freeze();
    transformations.freeze();
    compiler = new ScriptCompiler(builtins);
    LOG.info("Initialized the builtin, procedure and transformation "
        + "registries.");
  }
  
  public BuiltinRegistry builtins() {
    return builtins;
  }
  
  public ProcedureRegistry procedures() {
    return procedures;
  }
  
  public TransformationRegistry transformations() {
    return transformations;
  }
  
  /** @return A compiler over the frozen builtins. */
  public ScriptCompiler compiler() {
    return compiler;
  }
}
