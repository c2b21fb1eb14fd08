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
 * Filters for {@link Store#listTasks(net.pipeql.query.QueryContext, TaskSearchParams)}.
 * At most one of org or user may be set. A page size of zero means the
 * store's default.
 * 
 * @since 1.0
 */
public class TaskSearchParams {
  private final String org;
  private final String user;
  private final String after;
  private final int page_size;
  
  protected TaskSearchParams(final Builder builder) {
    org = builder.org;
    user = builder.user;
    after = builder.after;
    page_size = builder.page_size;
  }
  
  /** @return The org to filter on, may be null. */
  public String org() {
    return org;
  }
  
  /** @return The user to filter on, may be null. */
  public String user() {
    return user;
  }
  
  /** @return Only tasks with an ID greater than this, may be null. */
  public String after() {
    return after;
  }
  
  public int pageSize() {
    return page_size;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("org", org)
        .add("user", user)
        .add("after", after)
        .add("pageSize", page_size)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String org;
    private String user;
    private String after;
    private int page_size;
    
    public Builder setOrg(final String org) {
      this.org = org;
      return this;
    }
    
    public Builder setUser(final String user) {
      this.user = user;
      return this;
    }
    
    public Builder setAfter(final String after) {
      this.after = after;
      return this;
    }
    
    public Builder setPageSize(final int page_size) {
      this.page_size = page_size;
      return this;
    }
    
    public TaskSearchParams build() {
      return new TaskSearchParams(this);
    }
  }
}
