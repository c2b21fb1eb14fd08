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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * A query request for an organization.
 * 
 * @since 1.0
 */
public class Request {
  private final String organization_id;
  private final QueryCompiler compiler;
  
  /**
   * @param organization_id The non-null and non-empty organization.
   * @param compiler The non-null compiler.
   */
  public Request(final String organization_id, final QueryCompiler compiler) {
    if (Strings.isNullOrEmpty(organization_id)) {
      throw new IllegalArgumentException("Organization ID cannot be null "
          + "or empty.");
    }
    if (compiler == null) {
      throw new IllegalArgumentException("Compiler cannot be null.");
    }
    this.organization_id = organization_id;
    this.compiler = compiler;
  }
  
  public String organizationID() {
    return organization_id;
  }
  
  public QueryCompiler compiler() {
    return compiler;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("organizationID", organization_id)
        .add("compiler", compiler)
        .toString();
  }
}
