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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.pipeql.exceptions.RegistryException;

/**
 * Maps procedure kinds to transformation and source constructors.
 * 
 * @since 1.0
 */
public class TransformationRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      TransformationRegistry.class);
  
  private final Map<String, CreateTransformation> transformations;
  private final Map<String, CreateSource> sources;
  private volatile boolean frozen;
  
  public TransformationRegistry() {
    transformations = Maps.newHashMap();
    sources = Maps.newHashMap();
  }
  
  /**
   * @param kind The non-null and non-empty procedure kind.
   * @param create The non-null constructor.
   * @throws RegistryException on a duplicate kind or if frozen.
   */
  public void registerTransformation(final String kind, 
                                     final CreateTransformation create) {
    check(kind, create);
    transformations.put(kind, create);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered transformation for procedure kind: " + kind);
    }
  }
  
  /**
   * @param kind The non-null and non-empty procedure kind.
   * @param create The non-null constructor.
   * @throws RegistryException on a duplicate kind or if frozen.
   */
  public void registerSource(final String kind, final CreateSource create) {
    check(kind, create);
    sources.put(kind, create);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered source for procedure kind: " + kind);
    }
  }
  
  public void freeze() {
    frozen = true;
    LOG.info("Froze transformation registry with " + transformations.size() 
        + " transformations and " + sources.size() + " sources.");
  }
  
  /** @return The constructor or null if the kind is not a transformation. */
  public CreateTransformation transformation(final String kind) {
    return transformations.get(kind);
  }
  
  /** @return The constructor or null if the kind is not a source. */
  public CreateSource source(final String kind) {
    return sources.get(kind);
  }
  
  private void check(final String kind, final Object create) {
    if (Strings.isNullOrEmpty(kind)) {
      throw new RegistryException("Procedure kind cannot be null or empty.");
    }
    if (create == null) {
      throw new RegistryException("Constructor cannot be null for kind: " 
          + kind);
    }
    if (frozen) {
      throw new RegistryException("Registry is frozen, cannot register kind: " 
          + kind);
    }
    if (transformations.containsKey(kind) || sources.containsKey(kind)) {
      throw new RegistryException("Duplicate registration for transformation "
          + "with procedure kind: " + kind);
    }
  }
}
