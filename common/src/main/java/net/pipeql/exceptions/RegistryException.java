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
package net.pipeql.exceptions;

/**
 * A fatal error raised while populating one of the registries: a 
 * duplicate name, a registration after the registry was frozen or a
 * builtin script that fails to evaluate. These indicate a broken build
 * and are not meant to be caught.
 * 
 * @since 1.0
 */
public class RegistryException extends IllegalStateException {
  private static final long serialVersionUID = -3419270546417015883L;

  public RegistryException(final String msg) {
    super(msg);
  }
  
  public RegistryException(final String msg, final Throwable t) {
    super(msg, t);
  }
}
