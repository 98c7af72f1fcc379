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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.tinyc.frontend.FilePosition;

/**
 * A declared name: global variable, local variable or parameter,
 * or procedure.
 */
public class Symbol {

  public static enum Kind {
    GLOBAL,
    LOCAL,
    PROCEDURE,
  }

  public static enum PassingMode {
    BY_VALUE,
    /** Storage holds the address of the caller's value */
    BY_REF,
  }

  private final String name;
  private final FilePosition position;
  private final Kind kind;
  private final PassingMode mode;
  private final int slot;
  private final ValueType type;
  private final long initialValue;
  private final ImmutableList<Parameter> params;
  private final ValueType resultType;
  private final boolean scratch;

  private Symbol(String name, FilePosition position, Kind kind,
      PassingMode mode, int slot, ValueType type, long initialValue,
      List<Parameter> params, ValueType resultType, boolean scratch) {
    this.name = name;
    this.position = position;
    this.kind = kind;
    this.mode = mode;
    this.slot = slot;
    this.type = type;
    this.initialValue = initialValue;
    this.params = params == null ? null : ImmutableList.copyOf(params);
    this.resultType = resultType;
    this.scratch = scratch;
  }

  public static Symbol global(String name, FilePosition position, int slot,
                              ValueType type, long initialValue) {
    return new Symbol(name, position, Kind.GLOBAL, PassingMode.BY_VALUE,
                      slot, type, initialValue, null, null, false);
  }

  public static Symbol local(String name, FilePosition position, int slot,
                             PassingMode mode, ValueType type) {
    return new Symbol(name, position, Kind.LOCAL, mode, slot, type, 0,
                      null, null, false);
  }

  /**
   * Compiler temporary.  Global or local depending on scope.
   */
  public static Symbol scratch(String name, Kind kind, int slot,
                               ValueType type) {
    assert(kind != Kind.PROCEDURE);
    return new Symbol(name, null, kind, PassingMode.BY_VALUE, slot, type, 0,
                      null, null, true);
  }

  /**
   * @param resultType null for a procedure without result
   */
  public static Symbol procedure(String name, FilePosition position,
      int slot, List<Parameter> params, ValueType resultType) {
    return new Symbol(name, position, Kind.PROCEDURE, PassingMode.BY_VALUE,
                      slot, null, 0, params, resultType, false);
  }

  public String getName() {
    return name;
  }

  /**
   * @return declaration position, or null for compiler temporaries
   */
  public FilePosition getPosition() {
    return position;
  }

  public Kind getKind() {
    return kind;
  }

  public PassingMode getMode() {
    return mode;
  }

  public int getSlot() {
    return slot;
  }

  /**
   * @return value type of a variable; null for procedures
   */
  public ValueType getType() {
    return type;
  }

  public long getInitialValue() {
    return initialValue;
  }

  public ImmutableList<Parameter> getParams() {
    return params;
  }

  public ValueType getResultType() {
    return resultType;
  }

  public boolean isVariable() {
    return kind != Kind.PROCEDURE;
  }

  public boolean isProcedure() {
    return kind == Kind.PROCEDURE;
  }

  public boolean isFunction() {
    return kind == Kind.PROCEDURE && resultType != null;
  }

  public boolean isByRef() {
    return mode == PassingMode.BY_REF;
  }

  public boolean isScratch() {
    return scratch;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.toString().toLowerCase()).append(' ').append(name);
    if (isProcedure()) {
      sb.append(params);
      if (resultType != null) {
        sb.append(':').append(resultType.sourceName());
      }
    } else {
      if (isByRef()) {
        sb.append(" (ref)");
      }
      sb.append(':').append(type.sourceName());
    }
    return sb.toString();
  }
}
