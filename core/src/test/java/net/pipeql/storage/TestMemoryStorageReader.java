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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.pipeql.data.DataType;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.Aggregates;
import net.pipeql.execute.Allocator;

public class TestMemoryStorageReader {
  private MemoryStorageReader reader;
  private Allocator allocator;

  @Before
  public void before() throws Exception {
    reader = new MemoryStorageReader();
    allocator = new Allocator(0);
    reader.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        1000, 1L);
    reader.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        2000, 2L);
    reader.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        3000, 3L);
    reader.write("b", "cpu", "idle", null, 1500, 0.5);
  }

  @Test
  public void read() throws Exception {
    final List<Table> tables = reader.read(spec("b", 0, 10000, null),
        allocator);
    assertEquals(2, tables.size());

    final Table usage = tables.get(0);
    assertEquals(3, usage.len());
    assertEquals("web01", usage.key().labelValue("host").str());
    assertEquals("usage", usage.key().labelValue("_field").str());
    assertEquals("cpu", usage.key().labelValue("_measurement").str());
    assertEquals(0, usage.key().labelValue("_start").time());
    assertEquals(10000, usage.key().labelValue("_stop").time());
    assertEquals(DataType.INT,
        usage.cols().get(usage.colIdx("_value")).type());
    assertEquals(1000, usage.getTime(usage.colIdx("_time"), 0));
    assertEquals(3, usage.getInt(usage.colIdx("_value"), 2));
    assertEquals("web01", usage.getString(usage.colIdx("host"), 1));

    final Table idle = tables.get(1);
    assertEquals(DataType.FLOAT,
        idle.cols().get(idle.colIdx("_value")).type());
    assertTrue(idle.colIdx("host") < 0);
    assertTrue(allocator.maxAllocated() > 0);
  }

  @Test
  public void readRangeIsHalfOpen() throws Exception {
    final List<Table> tables = reader.read(spec("b", 1000, 3000, null),
        allocator);
    assertEquals(2, tables.size());
    assertEquals(2, tables.get(0).len());
    assertEquals(1000, tables.get(0).getTime(tables.get(0).colIdx("_time"), 0));

    // series without points in range are skipped
    assertEquals(1, reader.read(spec("b", 2000, 2500, null), allocator)
        .size());
  }

  @Test
  public void readAggregate() throws Exception {
    List<Table> tables = reader.read(spec("b", 0, 10000, Aggregates.SUM),
        allocator);
    Table usage = tables.get(0);
    assertEquals(1, usage.len());
    assertTrue(usage.colIdx("_time") < 0);
    assertEquals(6, usage.getInt(usage.colIdx("_value"), 0));

    tables = reader.read(spec("b", 0, 10000, Aggregates.MEAN), allocator);
    usage = tables.get(0);
    assertEquals(DataType.FLOAT,
        usage.cols().get(usage.colIdx("_value")).type());
    assertEquals(2.0, usage.getFloat(usage.colIdx("_value"), 0), 0.0001);

    tables = reader.read(spec("b", 0, 10000, Aggregates.COUNT), allocator);
    assertEquals(1, tables.get(1).getInt(tables.get(1).colIdx("_value"), 0));
  }

  @Test
  public void readMissingBucket() throws Exception {
    assertTrue(reader.read(spec("nope", 0, 10000, null), allocator)
        .isEmpty());
  }

  @Test
  public void readMemoryLimit() throws Exception {
    try {
      reader.read(spec("b", 0, 10000, null), new Allocator(16));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(Allocator.LIMIT_EXCEEDED, e.getStatusCode());
    }
  }

  @Test
  public void writeErrors() throws Exception {
    try {
      reader.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
          4000, 4.0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.write(null, "cpu", "usage", null, 4000, 4L);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.write("b", "", "usage", null, 4000, 4L);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.write("b", "cpu", null, null, 4000, 4L);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void readSpec() throws Exception {
    try {
      ReadSpec.newBuilder().setStart(0).setStop(1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ReadSpec.newBuilder().setBucket("b").setStart(10).setStop(1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private static ReadSpec spec(final String bucket,
                               final long start,
                               final long stop,
                               final Aggregates aggregate) {
    return ReadSpec.newBuilder()
        .setOrganizationID("org")
        .setBucket(bucket)
        .setStart(start)
        .setStop(stop)
        .setAggregate(aggregate)
        .build();
  }
}
