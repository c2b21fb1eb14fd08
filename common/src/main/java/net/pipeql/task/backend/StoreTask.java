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
package net.pipeql.task.backend;

import com.google.common.base.MoreObjects;

/**
 * A task as persisted in a {@link Store}.
 * 
 * @since 1.0
 */
public class StoreTask {
  private final String id;
  private final String org;
  private final String user;
  private final String name;
  private final String script;
  
  public StoreTask(final String id, 
                   final String org, 
                   final String user, 
                   final String name,
                   final String script) {
    this.id = id;
    this.org = org;
    this.user = user;
    this.name = name;
    this.script = script;
  }
  
  public String id() {
    return id;
  }
  
  public String org() {
    return org;
  }
  
  public String user() {
    return user;
  }
  
  public String name() {
    return name;
  }
  
  public String script() {
    return script;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("org", org)
        .add("user", user)
        .add("name", name)
        .toString();
  }
}
