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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.honeybee.util.Static;

/** Declaration of a family of facts: its name and its typed parameters. */
public final class FactSignature {
  public final String name;
  public final ImmutableMap<String, ValueType> params;
  public final Kind kind;

  public FactSignature(String name, Map<String, ValueType> params,
      Kind kind) {
    this.name = requireNonNull(name, "name");
    this.params = ImmutableMap.copyOf(params);
    this.kind = requireNonNull(kind, "kind");
    checkArgument(!name.isEmpty(), "empty fact name");
  }

  /**
   * Returns whether a fact is an instance of this signature: same name, the
   * same parameters, and each argument a literal of the declared type.
   */
  public boolean accepts(Fact fact) {
    if (!fact.name.equals(name)
        || !fact.args.keySet().equals(params.keySet())) {
      return false;
    }
    for (Map.Entry<String, ValueType> e : params.entrySet()) {
      if (!e.getValue().accepts(fact.args.get(e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, params, kind);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FactSignature
            && ((FactSignature) o).name.equals(name)
            && ((FactSignature) o).params.equals(params)
            && ((FactSignature) o).kind == kind;
  }

  @Override
  public String toString() {
    return Static.describe(new StringBuilder(), name, params).toString();
  }

  /** Whether facts of a family are supplied by the user or computed. */
  public enum Kind {
    /** Facts asserted by the user, for example the description of an input. */
    ANNOTATION,
    /** Facts established by running a computation. */
    ANALYSIS
  }
}

// End FactSignature.java
