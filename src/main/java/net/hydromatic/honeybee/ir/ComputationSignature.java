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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named inference rule.
 *
 * <p>A computation consumes one antecedent fact per parameter and produces a
 * fact of family {@link #ret}, provided that {@link #precondition} holds. The
 * precondition refers to the antecedents by parameter name, and to the fact
 * produced by the variable {@code ret}.
 */
public final class ComputationSignature {
  public final String name;
  public final ImmutableList<Param> params;
  public final String ret;
  public final Predicate precondition;

  public ComputationSignature(String name, List<Param> params, String ret,
      Predicate precondition) {
    this.name = requireNonNull(name, "name");
    this.params = ImmutableList.copyOf(params);
    this.ret = requireNonNull(ret, "ret");
    this.precondition = requireNonNull(precondition, "precondition");
    checkArgument(!name.isEmpty(), "empty computation name");
    final Set<String> names = new HashSet<>();
    for (Param param : this.params) {
      checkArgument(names.add(param.name),
          "duplicate parameter %s in computation %s", param.name, name);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, params, ret, precondition);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ComputationSignature
            && ((ComputationSignature) o).name.equals(name)
            && ((ComputationSignature) o).params.equals(params)
            && ((ComputationSignature) o).ret.equals(ret)
            && ((ComputationSignature) o).precondition.equals(precondition);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(name).append('(');
    params.forEach(p ->
        b.append(b.charAt(b.length() - 1) == '(' ? "" : ", ").append(p));
    return b.append(") -> ").append(ret).toString();
  }

  /** Parameter of a computation: a name, a fact family, and a mode. */
  public static final class Param {
    public final String name;
    public final String factName;
    public final Mode mode;

    public Param(String name, String factName, Mode mode) {
      this.name = requireNonNull(name, "name");
      this.factName = requireNonNull(factName, "factName");
      this.mode = requireNonNull(mode, "mode");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, factName, mode);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
              && ((Param) o).name.equals(name)
              && ((Param) o).factName.equals(factName)
              && ((Param) o).mode == mode;
    }

    @Override
    public String toString() {
      return name + ": " + factName
          + (mode == Mode.FOR_ALL_POSITIVE ? "*" : "");
    }
  }
}

// End ComputationSignature.java
