/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package org.apache.rowguard.predicate;

/** The predicates that accept every row or none. */
public final class ConstantPredicate extends PredicateNode {
  public static final ConstantPredicate TRUE = new ConstantPredicate(true);
  public static final ConstantPredicate FALSE = new ConstantPredicate(false);

  private final boolean value;

  private ConstantPredicate(boolean value) {
    this.value = value;
  }

  public static ConstantPredicate of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) {
    return visitor.visitConstant(this);
  }

  @Override
  public boolean isAlwaysTrue() {
    return value;
  }

  @Override
  public boolean isAlwaysFalse() {
    return !value;
  }

  @Override
  public String toString() {
    return value ? "TRUE" : "FALSE";
  }
}
