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

/** Type of a parameter of a {@link FactSignature}. */
public enum ValueType {
  INT,
  STR,
  BOOL;

  /** Returns whether a value is a literal of this type. */
  public boolean accepts(Value value) {
    switch (this) {
    case INT:
      return value instanceof Value.Int;
    case STR:
      return value instanceof Value.Str;
    case BOOL:
      return value instanceof Value.Bool;
    default:
      throw new AssertionError(this);
    }
  }
}

// End ValueType.java
