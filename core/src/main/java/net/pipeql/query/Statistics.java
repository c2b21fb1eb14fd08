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

/**
 * Timings and memory use of one query. Durations are in nanoseconds and
 * zero for stages that did not run.
 * 
 * @since 1.0
 */
public class Statistics {
  private final long compile_duration;
  private final long plan_duration;
  private final long execute_duration;
  private final long total_duration;
  private final long max_allocated;
  
  protected Statistics(final Builder builder) {
    compile_duration = builder.compile_duration;
    plan_duration = builder.plan_duration;
    execute_duration = builder.execute_duration;
    total_duration = builder.total_duration;
    max_allocated = builder.max_allocated;
  }
  
  public long compileDuration() {
    return compile_duration;
  }
  
  public long planDuration() {
    return plan_duration;
  }
  
  public long executeDuration() {
    return execute_duration;
  }
  
  /** @return From submission until the query was marked done. */
  public long totalDuration() {
    return total_duration;
  }
  
  /** @return The peak bytes held by the query's allocator. */
  public long maxAllocated() {
    return max_allocated;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("compileDuration", compile_duration)
        .add("planDuration", plan_duration)
        .add("executeDuration", execute_duration)
        .add("totalDuration", total_duration)
        .add("maxAllocated", max_allocated)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long compile_duration;
    private long plan_duration;
    private long execute_duration;
    private long total_duration;
    private long max_allocated;
    
    public Builder setCompileDuration(final long compile_duration) {
      this.compile_duration = compile_duration;
      return this;
    }
    
    public Builder setPlanDuration(final long plan_duration) {
      this.plan_duration = plan_duration;
      return this;
    }
    
    public Builder setExecuteDuration(final long execute_duration) {
      this.execute_duration = execute_duration;
      return this;
    }
    
    public Builder setTotalDuration(final long total_duration) {
      this.total_duration = total_duration;
      return this;
    }
    
    public Builder setMaxAllocated(final long max_allocated) {
      this.max_allocated = max_allocated;
      return this;
    }
    
    public Statistics build() {
      return new Statistics(this);
    }
  }
}
