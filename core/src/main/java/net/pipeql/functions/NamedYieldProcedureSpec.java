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

import net.pipeql.plan.ProcedureSpec;
import net.pipeql.plan.YieldProcedureSpec;

public class NamedYieldProcedureSpec implements YieldProcedureSpec {
  private final String name;
  
  public NamedYieldProcedureSpec(final String name) {
    this.name = name;
  }
  
  @Override
  public String kind() {
    return YieldOpSpec.KIND;
  }
  
  @Override
  public String yieldName() {
    return name;
  }
  
  @Override
  public ProcedureSpec copy() {
    return new NamedYieldProcedureSpec(name);
  }
}
