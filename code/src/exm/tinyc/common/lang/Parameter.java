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

import exm.tinyc.common.lang.Symbol.PassingMode;
import exm.tinyc.frontend.FilePosition;

/**
 * Formal parameter of a procedure
 */
public class Parameter {
  private final String name;
  private final FilePosition position;
  private final PassingMode mode;
  private final ValueType type;

  public Parameter(String name, FilePosition position, PassingMode mode,
                   ValueType type) {
    this.name = name;
    this.position = position;
    this.mode = mode;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public FilePosition getPosition() {
    return position;
  }

  public PassingMode getMode() {
    return mode;
  }

  public ValueType getType() {
    return type;
  }

  public boolean isByRef() {
    return mode == PassingMode.BY_REF;
  }

  @Override
  public String toString() {
    return (isByRef() ? "REF " : "") + name + ":" + type.sourceName();
  }
}
