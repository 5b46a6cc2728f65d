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

import static java.util.Objects.requireNonNull;

/**
 * Failure to navigate or construct a derivation tree.
 *
 * <p>A path is usually obtained from an earlier call to {@link
 * Tree#queries}; if the tree has changed since, the path may be stale. The
 * caller can recover by extracting obligations again.
 */
public class DerivationException extends RuntimeException {
  public final Kind kind;
  public final Path path;

  public DerivationException(Kind kind, Path path, String message) {
    super(message);
    this.kind = requireNonNull(kind, "kind");
    this.path = requireNonNull(path, "path");
  }

  /** Creates an exception for a path that continues through a leaf. */
  static DerivationException notAStep(Path path, Tree tree) {
    return new DerivationException(Kind.PATH_NOT_A_STEP, path,
        "expected step at '" + path + "', found " + tree.kind);
  }

  /** Creates an exception for a tag that matches no antecedent. */
  static DerivationException unknownTag(Path path, String tag) {
    return new DerivationException(Kind.UNKNOWN_TAG, path,
        "no antecedent '" + tag + "' at '" + path + "'");
  }

  /** Creates an exception for a path that no longer addresses an open goal
   * of the expected fact family. */
  public static DerivationException notAGoal(Path path, Tree tree,
      String factName) {
    return new DerivationException(Kind.NOT_A_GOAL, path,
        "expected goal " + factName + " at '" + path + "', found " + tree);
  }

  @Override
  public String toString() {
    return super.toString() + " [" + kind + "]";
  }

  /** Kind of failure. */
  public enum Kind {
    /** A path continues, or ends, at a node that is not a step. */
    PATH_NOT_A_STEP,
    /** A path segment names no antecedent of the current step. */
    UNKNOWN_TAG,
    /** A path addresses a node that is not an open goal of the expected
     * fact family. */
    NOT_A_GOAL,
    /** A tree was requested from a query that is not closed. */
    GOAL_NOT_CLOSED
  }
}

// End DerivationException.java
