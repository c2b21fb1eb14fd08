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

import java.util.Collections;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.exceptions.RegistryException;
import net.pipeql.interpreter.Interpreter;
import net.pipeql.interpreter.Scope;
import net.pipeql.parser.Parser;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.values.Value;

/**
 * The table of builtin functions, values, options and operation specs 
 * that scripts compile against. Registration happens during startup;
 * {@link #freeze()} evaluates the builtin scripts and closes the 
 * registry. Any registration error is fatal and throws a 
 * {@link RegistryException}.
 * <p>
 * Registration is not thread safe. Lookups after the freeze are.
 * 
 * @since 1.0
 */
public class BuiltinRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      BuiltinRegistry.class);
  
  /** Builtin values by name, functions included. */
  private final Map<String, Value> builtins;
  
  /** Default option values by name. */
  private final Map<String, Value> options;
  
  /** Builtin scripts by name, evaluated in order on freeze. */
  private final Map<String, String> scripts;
  
  /** Operation spec classes by kind for decoding. */
  private final Map<String, Class<? extends OperationSpec>> op_specs;
  
  private volatile boolean frozen;
  
  public BuiltinRegistry() {
    builtins = Maps.newLinkedHashMap();
    options = Maps.newLinkedHashMap();
    scripts = Maps.newLinkedHashMap();
    op_specs = Maps.newHashMap();
  }
  
  /**
   * Registers a function that returns a table object.
   * @param name The non-null and non-empty function name.
   * @param create The spec factory.
   * @param signature The declared signature.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerFunction(final String name, 
                               final CreateOperationSpec create, 
                               final FunctionSignature signature) {
    register(name, create, signature, false);
  }
  
  /**
   * Registers a function whose results are always side effects, e.g. 
   * {@code yield}.
   * @param name The non-null and non-empty function name.
   * @param create The spec factory.
   * @param signature The declared signature.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerFunctionWithSideEffect(final String name, 
      final CreateOperationSpec create, 
      final FunctionSignature signature) {
    register(name, create, signature, true);
  }
  
  /**
   * Registers a named value in the builtin scope.
   * @param name The non-null and non-empty name.
   * @param value The non-null value.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerBuiltInValue(final String name, final Value value) {
    checkOpen(name);
    if (value == null) {
      throw new RegistryException("Value cannot be null for builtin: " + name);
    }
    if (builtins.containsKey(name)) {
      throw new RegistryException("Duplicate registration for builtin: " 
          + name);
    }
    builtins.put(name, value);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered builtin value: " + name);
    }
  }
  
  /**
   * Registers the default value of an option.
   * @param name The non-null and non-empty name.
   * @param value The non-null default.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerBuiltInOption(final String name, final Value value) {
    checkOpen(name);
    if (value == null) {
      throw new RegistryException("Value cannot be null for option: " + name);
    }
    if (options.containsKey(name)) {
      throw new RegistryException("Duplicate registration for option: " 
          + name);
    }
    options.put(name, value);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered builtin option: " + name);
    }
  }
  
  /**
   * Registers a script evaluated on {@link #freeze()}. Every variable it
   * declares becomes a builtin.
   * @param name The non-null and non-empty script name.
   * @param script The non-null script.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerBuiltIn(final String name, final String script) {
    checkOpen(name);
    if (Strings.isNullOrEmpty(script)) {
      throw new RegistryException("Script cannot be null or empty for "
          + "builtin script: " + name);
    }
    if (scripts.containsKey(name)) {
      throw new RegistryException("Duplicate registration for builtin script: " 
          + name);
    }
    scripts.put(name, script);
  }
  
  /**
   * Registers the class used to decode an operation spec from JSON.
   * @param kind The non-null and non-empty operation kind.
   * @param clazz The non-null class.
   * @throws RegistryException if already registered or frozen.
   */
  public void registerOperationSpec(final String kind, 
                                    final Class<? extends OperationSpec> clazz) {
    checkOpen(kind);
    if (clazz == null) {
      throw new RegistryException("Class cannot be null for kind: " + kind);
    }
    if (op_specs.containsKey(kind)) {
      throw new RegistryException("Duplicate registration for operation "
          + "spec: " + kind);
    }
    op_specs.put(kind, clazz);
  }
  
  /**
   * Evaluates the builtin scripts and closes the registry.
   * @throws RegistryException if a script fails to parse or evaluate, or
   * if already frozen.
   */
  public synchronized void freeze() {
    if (frozen) {
      throw new RegistryException("Registry has already been frozen.");
    }
    for (final Map.Entry<String, String> entry : scripts.entrySet()) {
      final Scope scope = newScope();
      final Interpreter interpreter = new Interpreter(options, scope);
      try {
        interpreter.eval(Parser.parse(entry.getValue()));
      } catch (QueryExecutionException e) {
        throw new RegistryException("Failed to evaluate builtin script: " 
            + entry.getKey(), e);
      }
      for (final Map.Entry<String, Value> local : 
          scope.locals().entrySet()) {
        if (builtins.containsKey(local.getKey())) {
          throw new RegistryException("Builtin script " + entry.getKey() 
              + " redefines builtin: " + local.getKey());
        }
        builtins.put(local.getKey(), local.getValue());
      }
    }
    frozen = true;
    LOG.info("Froze builtin registry with " + builtins.size() 
        + " builtins, " + options.size() + " options and " 
        + op_specs.size() + " operation specs.");
  }
  
  public boolean isFrozen() {
    return frozen;
  }
  
  /** @return A new scope containing every builtin. */
  public Scope newScope() {
    final Scope scope = new Scope(null);
    for (final Map.Entry<String, Value> entry : builtins.entrySet()) {
      scope.set(entry.getKey(), entry.getValue());
    }
    return scope.nest();
  }
  
  /** @return The default options, unmodifiable. */
  public Map<String, Value> options() {
    return Collections.unmodifiableMap(options);
  }
  
  /**
   * @param name A name.
   * @return The builtin or null if not registered.
   */
  public Value builtin(final String name) {
    return builtins.get(name);
  }
  
  /**
   * @param kind An operation kind.
   * @return The spec class or null if not registered.
   */
  public Class<? extends OperationSpec> operationSpec(final String kind) {
    return op_specs.get(kind);
  }
  
  private void register(final String name, 
                        final CreateOperationSpec create, 
                        final FunctionSignature signature, 
                        final boolean side_effect) {
    checkOpen(name);
    if (create == null || signature == null) {
      throw new RegistryException("Create function and signature cannot be "
          + "null for function: " + name);
    }
    if (builtins.containsKey(name)) {
      throw new RegistryException("Duplicate registration for function: " 
          + name);
    }
    builtins.put(name, new BuiltinFunction(name, signature, create, 
        side_effect));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered builtin function: " + name 
          + (side_effect ? " with side effects" : ""));
    }
  }
  
  private void checkOpen(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new RegistryException("Name cannot be null or empty.");
    }
    if (frozen) {
      throw new RegistryException("Registry is frozen, cannot register: " 
          + name);
    }
  }
}
