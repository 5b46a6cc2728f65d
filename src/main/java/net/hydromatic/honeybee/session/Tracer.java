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
package net.hydromatic.honeybee.session;

import java.util.List;
import net.hydromatic.honeybee.derivation.DerivationException;
import net.hydromatic.honeybee.derivation.Obligation;
import net.hydromatic.honeybee.derivation.Tree;

/** Called on various events during a session. */
public interface Tracer {
  /** Called when the session has a new tree. */
  void onTree(Tree tree);

  /** Called with the obligations extracted from the current tree. */
  void onObligations(List<Obligation> obligations);

  /** Called before a solution is grafted into the tree. */
  void onSolution(Obligation obligation, Solution solution);

  /**
   * Called with an exception thrown while rewriting the tree. Returns whether
   * a handler was found; if not, the session rethrows the exception.
   */
  boolean onException(DerivationException e);
}

// End Tracer.java
