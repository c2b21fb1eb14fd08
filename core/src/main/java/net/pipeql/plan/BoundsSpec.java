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
package net.pipeql.plan;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import net.pipeql.query.QueryTime;

/**
 * A time range whose ends are each zero, relative to now or absolute.
 * Immutable.
 * 
 * @since 1.0
 */
public class BoundsSpec {
  /** Unbounded. */
  public static final BoundsSpec ZERO = 
      new BoundsSpec(QueryTime.ZERO, QueryTime.ZERO);
  
  private final QueryTime start;
  private final QueryTime stop;
  
  @JsonCreator
  public BoundsSpec(@JsonProperty("start") final QueryTime start, 
                    @JsonProperty("stop") final QueryTime stop) {
    this.start = start == null ? QueryTime.ZERO : start;
    this.stop = stop == null ? QueryTime.ZERO : stop;
  }
  
  @JsonProperty("start")
  public QueryTime start() {
    return start;
  }
  
  @JsonProperty("stop")
  public QueryTime stop() {
    return stop;
  }
  
  /** @return True if both ends are zero. */
  @JsonIgnore
  public boolean isZero() {
    return start.isZero() && stop.isZero();
  }
  
  /**
   * Computes the covering range. Note that the stop is only taken from 
   * {@code o} when {@code o} also has a start.
   * @param o The other bounds.
   * @param now The evaluation instant.
   * @return The union.
   */
  public BoundsSpec union(final BoundsSpec o, final Instant now) {
    QueryTime u_start = start;
    if (u_start.isZero() || 
        (!o.start.isZero() && o.start.time(now).isBefore(start.time(now)))) {
      u_start = o.start;
    }
    QueryTime u_stop = stop;
    if (u_stop.isZero() || 
        (!o.start.isZero() && o.stop.time(now).isAfter(stop.time(now)))) {
      u_stop = o.stop;
    }
    return new BoundsSpec(u_start, u_stop);
  }
  
  /**
   * Computes the overlap. A zero stop with a set start is compared as 
   * now. When the ranges do not overlap the ends of this range are 
   * returned, so the operation is not symmetric.
   * @param o The other bounds.
   * @param now The evaluation instant.
   * @return The intersection.
   */
  public BoundsSpec intersect(final BoundsSpec o, final Instant now) {
    final QueryTime b_stop = !start.isZero() && stop.isZero() 
        ? QueryTime.NOW : stop;
    final QueryTime o_stop = !o.start.isZero() && o.stop.isZero() 
        ? QueryTime.NOW : o.stop;
    
    final QueryTime i_start;
    if ((start.isZero() || o.start.time(now).isAfter(start.time(now))) 
        && o.start.time(now).isBefore(b_stop.time(now))) {
      i_start = o.start;
    } else {
      i_start = start;
    }
    
    final QueryTime i_stop;
    if (o_stop.time(now).isBefore(b_stop.time(now)) 
        && o.stop.time(now).isAfter(start.time(now))) {
      i_stop = o.stop;
    } else {
      i_stop = stop;
    }
    return new BoundsSpec(i_start, i_stop);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BoundsSpec)) {
      return false;
    }
    final BoundsSpec other = (BoundsSpec) o;
    return start.equals(other.start) && stop.equals(other.stop);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(start, stop);
  }
  
  @Override
  public String toString() {
    return "[" + start + ", " + stop + "]";
  }
}
