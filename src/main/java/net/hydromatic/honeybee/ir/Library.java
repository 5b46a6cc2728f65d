/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.honeybee.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Repository of fact signatures and computation signatures, each keyed by
 * name.
 *
 * <p>Immutable; use {@link #builder()} to create one.
 */
public final class Library {
  public final ImmutableMap<String, FactSignature> factSignatures;
  public final ImmutableMap<String, ComputationSignature>
      computationSignatures;

  private Library(ImmutableMap<String, FactSignature> factSignatures,
      ImmutableMap<String, ComputationSignature> computationSignatures) {
    this.factSignatures = factSignatures;
    this.computationSignatures = computationSignatures;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Looks up a fact signature; returns empty if not found. */
  public Optional<FactSignature> findFactSignature(String name) {
    return Optional.ofNullable(factSignatures.get(name));
  }

  /** Looks up a fact signature. Throws if not found; never returns null. */
  public FactSignature factSignature(String name) {
    final FactSignature signature = factSignatures.get(name);
    checkArgument(signature != null, "unknown fact %s", name);
    return signature;
  }

  /** Looks up a computation signature; returns empty if not found. */
  public Optional<ComputationSignature> findComputationSignature(String name) {
    return Optional.ofNullable(computationSignatures.get(name));
  }

  /**
   * Looks up a computation signature. Throws if not found; never returns
   * null.
   */
  public ComputationSignature computationSignature(String name) {
    final ComputationSignature signature = computationSignatures.get(name);
    checkArgument(signature != null, "unknown computation %s", name);
    return signature;
  }

  @Override
  public String toString() {
    return "Library{facts=" + factSignatures.keySet()
        + ", computations=" + computationSignatures.keySet() + "}";
  }

  /** Builder for {@link Library}. */
  public static class Builder {
    private final Map<String, FactSignature> factSignatures =
        new LinkedHashMap<>();
    private final Map<String, ComputationSignature> computationSignatures =
        new LinkedHashMap<>();

    /** Adds a fact signature. */
    public Builder add(FactSignature signature) {
      checkArgument(
          factSignatures.putIfAbsent(signature.name, signature) == null,
          "duplicate fact %s", signature.name);
      return this;
    }

    /**
     * Adds a computation signature. Its parameters and return must refer to
     * facts already added.
     */
    public Builder add(ComputationSignature signature) {
      checkArgument(factSignatures.containsKey(signature.ret),
          "computation %s returns unknown fact %s", signature.name,
          signature.ret);
      signature.params.forEach(p ->
          checkArgument(factSignatures.containsKey(p.factName),
              "parameter %s of computation %s has unknown fact %s", p.name,
              signature.name, p.factName));
      checkArgument(
          computationSignatures.putIfAbsent(signature.name, signature) == null,
          "duplicate computation %s", signature.name);
      return this;
    }

    public Library build() {
      return new Library(ImmutableMap.copyOf(factSignatures),
          ImmutableMap.copyOf(computationSignatures));
    }
  }
}

// End Library.java
