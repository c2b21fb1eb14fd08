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
package net.pipeql.semantic;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * The declared parameters of a builtin or script function. A signature
 * with a pipe argument accepts the value to the left of {@code |>} 
 * under that parameter name.
 * 
 * @since 1.0
 */
public class FunctionSignature {
  /** The default name of the piped table parameter. */
  public static final String TABLES_PARAM = "table";
  
  private final Map<String, Type> params;
  private final Type return_type;
  private final String pipe_argument;
  
  protected FunctionSignature(final Builder builder) {
    params = builder.params.build();
    return_type = builder.return_type == null ? Types.ANY : builder.return_type;
    pipe_argument = builder.pipe_argument;
  }
  
  /** @return The declared parameters, may be empty. */
  public Map<String, Type> params() {
    return params;
  }
  
  public Type returnType() {
    return return_type;
  }
  
  /** @return The pipe parameter name or null if piping is not accepted. */
  public String pipeArgument() {
    return pipe_argument;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("params", params)
        .add("return", return_type)
        .add("pipe", pipe_argument)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * A signature for an operation taking a piped table and returning one.
   * @return A builder pre-populated with the pipe argument.
   */
  public static Builder newTransformationBuilder() {
    return new Builder()
        .setPipeArgument(TABLES_PARAM)
        .addParam(TABLES_PARAM, Types.TABLE)
        .setReturnType(Types.TABLE);
  }
  
  public static class Builder {
    private final ImmutableMap.Builder<String, Type> params = 
        ImmutableMap.builder();
    private Type return_type;
    private String pipe_argument;
    
    public Builder addParam(final String name, final Type type) {
      params.put(name, type);
      return this;
    }
    
    public Builder setReturnType(final Type return_type) {
      this.return_type = return_type;
      return this;
    }
    
    public Builder setPipeArgument(final String pipe_argument) {
      this.pipe_argument = pipe_argument;
      return this;
    }
    
    public FunctionSignature build() {
      return new FunctionSignature(this);
    }
  }
}
