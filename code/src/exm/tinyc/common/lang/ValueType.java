/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.tinyc.common.lang;

/**
 * Integer types of the source language and their machine representation
 */
public enum ValueType {
  /** 32-bit signed integer, the default type */
  LONG("i32", 4),
  /** 64-bit signed integer */
  QUAD("i64", 8);

  private final String machineType;
  private final int size;

  private ValueType(String machineType, int size) {
    this.machineType = machineType;
    this.size = size;
  }

  /**
   * @return name of the WebAssembly value type
   */
  public String machineType() {
    return machineType;
  }

  /**
   * @return size in bytes when stored in linear memory
   */
  public int size() {
    return size;
  }

  public String sourceName() {
    return name();
  }

  /**
   * @return the type both operands are converted to in a binary operation
   */
  public static ValueType widen(ValueType a, ValueType b) {
    return (a == QUAD || b == QUAD) ? QUAD : LONG;
  }

  public static boolean fits(ValueType type, long value) {
    if (type == QUAD) {
      return true;
    }
    return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
  }

  /**
   * @return the narrowest type that can hold the value
   */
  public static ValueType forLiteral(long value) {
    return fits(LONG, value) ? LONG : QUAD;
  }

  /**
   * @return type for a source keyword, or null if not a type name
   */
  public static ValueType fromSourceName(String name) {
    for (ValueType t: values()) {
      if (t.name().equals(name)) {
        return t;
      }
    }
    return null;
  }
}
