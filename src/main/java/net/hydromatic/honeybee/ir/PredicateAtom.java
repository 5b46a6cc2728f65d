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

/**
 * Atomic constraint within a {@link Predicate}: a relation name applied to
 * named values.
 *
 * <p>For example, {@code eq(left: ret.sample, right: "s1")}.
 */
public final class PredicateAtom {
  /** Name of the built-in equality relation. */
  public static final String EQ = "eq";

  public final String name;
  public final ImmutableMap<String, Value> args;

  public PredicateAtom(String name, Map<String, ? extends Value> args) {
    this.name = requireNonNull(name, "name");
    this.args = ImmutableMap.copyOf(args);
    checkArgument(!name.isEmpty(), "empty relation name");
  }

  /** Creates an equality constraint. */
  public static PredicateAtom eq(Value left, Value right) {
    return new PredicateAtom(EQ, ImmutableMap.of("left", left, "right", right));
  }

  /**
   * Returns this atom with every occurrence of a field of {@code var} whose
   * selector appears in {@code bindings} replaced by the bound value.
   */
  public PredicateAtom substitute(String var, Map<String, Value> bindings) {
    final ImmutableMap.Builder<String, Value> b = ImmutableMap.builder();
    boolean changed = false;
    for (Map.Entry<String, Value> e : args.entrySet()) {
      final Value value = e.getValue().substitute(var, bindings);
      changed |= value != e.getValue();
      b.put(e.getKey(), value);
    }
    return changed ? new PredicateAtom(name, b.build()) : this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PredicateAtom
            && ((PredicateAtom) o).name.equals(name)
            && ((PredicateAtom) o).args.equals(args);
  }

  @Override
  public String toString() {
    return Static.describe(new StringBuilder(), name, args).toString();
  }
}

// End PredicateAtom.java
