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
package net.pipeql.utils;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.netty.util.HashedWheelTimer;

/**
 * Utilities dealing with threads, timers and the like.
 */
public class Threads {
  
  /**
   * Returns a new HashedWheelTimer with a name and default ticks
   * @param name The name to add to the thread name
   * @return A timer
   */
  public static HashedWheelTimer newTimer(final String name) {
    return newTimer(100, name);
  }
  
  /**
   * Returns a new HashedWheelTimer with a name
   * @param ticks How long to sleep between ticks, in ms
   * @param name The name to add to the thread name
   * @return A timer
   */
  public static HashedWheelTimer newTimer(final int ticks, final String name) {
    return newTimer(ticks, 512, name);
  }
  
  /**
   * Returns a new HashedWheelTimer with a name
   * @param ticks How long to sleep between ticks, in ms
   * @param ticks_per_wheel The size of the wheel
   * @param name The name to add to the thread name
   * @return A timer
   */
  public static HashedWheelTimer newTimer(final int ticks, 
      final int ticks_per_wheel, final String name) {
    return new HashedWheelTimer(new ThreadFactoryBuilder()
          .setNameFormat("PipeQL Timer " + name + " #%d")
          .setDaemon(true)
          .build(), 
        ticks, TimeUnit.MILLISECONDS, ticks_per_wheel);
  }
  
  /**
   * Returns a fixed size pool of daemon threads.
   * @param threads The number of threads, at least 1.
   * @param name The name to add to the thread names.
   * @return A pool.
   */
  public static ExecutorService newPool(final int threads, final String name) {
    if (threads < 1) {
      throw new IllegalArgumentException("Threads must be at least 1 for "
          + "pool: " + name);
    }
    return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
        .setNameFormat("PipeQL " + name + " #%d")
        .setDaemon(true)
        .build());
  }
}
