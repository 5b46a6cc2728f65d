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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.honeybee.util.Static;

/**
 * Conjunction of constraints.
 *
 * <p>Atoms keep the order in which they were added. The conjunction is
 * commutative, but no attempt is made to remove duplicates.
 */
public final class Predicate {
  /** The empty conjunction, which always holds. */
  public static final Predicate TRUE = new Predicate(ImmutableList.of());

  public final ImmutableList<PredicateAtom> atoms;

  private Predicate(ImmutableList<PredicateAtom> atoms) {
    this.atoms = requireNonNull(atoms, "atoms");
  }

  /** Creates a predicate. */
  public static Predicate of(List<PredicateAtom> atoms) {
    return atoms.isEmpty() ? TRUE : new Predicate(ImmutableList.copyOf(atoms));
  }

  /** Creates a predicate. */
  public static Predicate of(PredicateAtom... atoms) {
    return of(ImmutableList.copyOf(atoms));
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  public int size() {
    return atoms.size();
  }

  /**
   * Substitutes, in every atom, each field of variable {@code var} that has a
   * binding.
   *
   * <p>For example, substituting {@code ret} with {sample: "s1"} converts
   * {@code eq(left: reads.sample, right: ret.sample)} into {@code eq(left:
   * reads.sample, right: "s1")}.
   */
  public Predicate substituteAll(String var, Map<String, Value> bindings) {
    if (bindings.isEmpty()) {
      return this;
    }
    final ImmutableList.Builder<PredicateAtom> b = ImmutableList.builder();
    atoms.forEach(atom -> b.add(atom.substitute(var, bindings)));
    return new Predicate(b.build());
  }

  /** Returns a predicate with the atoms of another predicate appended. */
  public Predicate concat(Predicate predicate) {
    if (predicate.isEmpty()) {
      return this;
    }
    return new Predicate(
        ImmutableList.copyOf(Static.concat(atoms, predicate.atoms)));
  }

  @Override
  public int hashCode() {
    return atoms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Predicate && ((Predicate) o).atoms.equals(atoms);
  }

  @Override
  public String toString() {
    if (atoms.isEmpty()) {
      return "true";
    }
    final StringBuilder b = new StringBuilder();
    for (PredicateAtom atom : atoms) {
      if (b.length() > 0) {
        b.append(" & ");
      }
      b.append(atom);
    }
    return b.toString();
  }
}

// End Predicate.java
