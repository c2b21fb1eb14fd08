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
package net.pipeql.storage;

import com.google.common.base.MoreObjects;

import net.pipeql.execute.Aggregates;

/**
 * A request to a {@link StorageReader}: one bucket over a half-open time 
 * range, optionally aggregating each series on read.
 * 
 * @since 1.0
 */
public class ReadSpec {
  private final String organization_id;
  private final String bucket;
  private final long start;
  private final long stop;
  private final Aggregates aggregate;
  
  protected ReadSpec(final Builder builder) {
    if (builder.bucket == null) {
      throw new IllegalArgumentException("Bucket cannot be null.");
    }
    if (builder.stop < builder.start) {
      throw new IllegalArgumentException("Stop cannot be before start.");
    }
    organization_id = builder.organization_id;
    bucket = builder.bucket;
    start = builder.start;
    stop = builder.stop;
    aggregate = builder.aggregate;
  }
  
  public String organizationID() {
    return organization_id;
  }
  
  public String bucket() {
    return bucket;
  }
  
  /** @return The inclusive start in epoch nanoseconds. */
  public long start() {
    return start;
  }
  
  /** @return The exclusive stop in epoch nanoseconds. */
  public long stop() {
    return stop;
  }
  
  /** @return The aggregate to apply per series or null for raw data. */
  public Aggregates aggregate() {
    return aggregate;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("org", organization_id)
        .add("bucket", bucket)
        .add("start", start)
        .add("stop", stop)
        .add("aggregate", aggregate)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String organization_id;
    private String bucket;
    private long start;
    private long stop;
    private Aggregates aggregate;
    
    public Builder setOrganizationID(final String organization_id) {
      this.organization_id = organization_id;
      return this;
    }
    
    public Builder setBucket(final String bucket) {
      this.bucket = bucket;
      return this;
    }
    
    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }
    
    public Builder setStop(final long stop) {
      this.stop = stop;
      return this;
    }
    
    public Builder setAggregate(final Aggregates aggregate) {
      this.aggregate = aggregate;
      return this;
    }
    
    public ReadSpec build() {
      return new ReadSpec(this);
    }
  }
}
