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
package net.hydromatic.recpat.refactor;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of a compile-time constant.
 *
 * <p>The value may be null, for the {@code null} literal; a null
 * {@code ConstantValue} reference means "not a constant".
 */
public class ConstantValue {
  /** The constant {@code null}. */
  public static final ConstantValue NULL = new ConstantValue(null);

  public final @Nullable Object value;

  private ConstantValue(@Nullable Object value) {
    this.value = value;
  }

  /** Creates a ConstantValue. */
  public static ConstantValue of(@Nullable Object value) {
    return value == null ? NULL : new ConstantValue(value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ConstantValue
        && Objects.equals(value, ((ConstantValue) o).value);
  }

  @Override public String toString() {
    return "constant(" + value + ")";
  }
}

// End ConstantValue.java
