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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;

import org.junit.Test;

import net.pipeql.query.QueryTime;

public class TestBoundsSpec {
  private static final Instant NOW = Instant.parse("2018-05-22T19:53:26Z");

  @Test
  public void ctor() throws Exception {
    BoundsSpec bounds = new BoundsSpec(null, null);
    assertTrue(bounds.isZero());
    assertEquals(BoundsSpec.ZERO, bounds);

    bounds = new BoundsSpec(QueryTime.parse("-1h"), null);
    assertFalse(bounds.isZero());
    assertEquals(QueryTime.ZERO, bounds.stop());
  }

  @Test
  public void intersectContained() throws Exception {
    final BoundsSpec a = bounds("-1h", null);
    final BoundsSpec b = bounds("-30m", null);
    assertEquals(bounds("-30m", null), a.intersect(b, NOW));
    assertEquals(bounds("-30m", null), b.intersect(a, NOW));
  }

  @Test
  public void intersectNoOverlap() throws Exception {
    final BoundsSpec a = bounds("-1h", null);
    final BoundsSpec b = bounds("-3h", "-2h");
    // not symmetric, the receiver's ends win
    assertEquals(a, a.intersect(b, NOW));
    assertEquals(b, b.intersect(a, NOW));
  }

  @Test
  public void intersectOverlap() throws Exception {
    final BoundsSpec a = bounds("-1h", null);
    final BoundsSpec b = bounds("-2h", "-30m");
    assertEquals(bounds("-1h", "-30m"), a.intersect(b, NOW));
    assertEquals(bounds("-1h", "-30m"), b.intersect(a, NOW));
  }

  @Test
  public void intersectZeroStarts() throws Exception {
    final BoundsSpec a = bounds(null, "-1h");
    final BoundsSpec b = bounds(null, "-20m");
    assertEquals(bounds(null, "-1h"), a.intersect(b, NOW));
    assertEquals(bounds(null, "-1h"), b.intersect(a, NOW));
  }

  @Test
  public void intersectAbsolute() throws Exception {
    final BoundsSpec a = bounds("2018-05-22T18:00:00Z", "2018-05-22T19:00:00Z");
    final BoundsSpec b = bounds("2018-05-22T18:30:00Z", "2018-05-22T20:00:00Z");
    assertEquals(bounds("2018-05-22T18:30:00Z", "2018-05-22T19:00:00Z"),
        a.intersect(b, NOW));
  }

  @Test
  public void union() throws Exception {
    final BoundsSpec a = bounds("-1h", "-30m");
    final BoundsSpec b = bounds("-2h", "-45m");
    assertEquals(bounds("-2h", "-30m"), a.union(b, NOW));

    assertEquals(b, BoundsSpec.ZERO.union(b, NOW));
  }

  @Test
  public void unionStopNeedsStart() throws Exception {
    final BoundsSpec a = bounds("-1h", "-30m");
    // the other's stop is later but it has no start
    final BoundsSpec b = bounds(null, "-10m");
    assertEquals(a, a.union(b, NOW));
  }

  private static BoundsSpec bounds(final String start, final String stop) {
    return new BoundsSpec(QueryTime.parse(start), QueryTime.parse(stop));
  }
}
