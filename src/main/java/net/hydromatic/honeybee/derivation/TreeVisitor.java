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
package net.hydromatic.honeybee.derivation;

/**
 * Visits a derivation tree, returning a value of type {@code R}.
 *
 * <p>Visiting does not recurse by itself; {@link #visit(Tree.Step)} decides
 * whether and in which order to visit antecedents.
 *
 * @param <R> Return type
 */
public interface TreeVisitor<R> {
  R visit(Tree.Axiom axiom);

  R visit(Tree.Goal goal);

  R visit(Tree.Step step);
}

// End TreeVisitor.java
