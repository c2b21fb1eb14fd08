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
package net.pipeql.execute;

/**
 * Well known column labels.
 * 
 * @since 1.0
 */
public final class ExecuteConstants {
  public static final String DEFAULT_TIME_LABEL = "_time";
  public static final String DEFAULT_START_LABEL = "_start";
  public static final String DEFAULT_STOP_LABEL = "_stop";
  public static final String DEFAULT_VALUE_LABEL = "_value";
  public static final String DEFAULT_MEASUREMENT_LABEL = "_measurement";
  public static final String DEFAULT_FIELD_LABEL = "_field";
  
  private ExecuteConstants() { }
}
