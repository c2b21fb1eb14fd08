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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import net.pipeql.exceptions.CompileException;
import net.pipeql.query.OperationSpec;

/**
 * Reads a bucket, the root of every query.
 * 
 * @since 1.0
 */
public class FromOpSpec implements OperationSpec {
  public static final String KIND = "from";
  
  private final String bucket;
  
  @JsonCreator
  public FromOpSpec(@JsonProperty("bucket") final String bucket) {
    if (Strings.isNullOrEmpty(bucket)) {
      throw new CompileException("from requires a bucket");
    }
    this.bucket = bucket;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("bucket")
  public String bucket() {
    return bucket;
  }
}
