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

public class Operators {

  /**
   * Binary operators.  Comparison operators produce a LONG truth
   * value whatever their operand type.
   */
  public static enum BinaryOp {
    ADD("add", false),
    SUB("sub", false),
    MUL("mul", false),
    DIV("div_s", false),
    AND("and", false),
    OR("or", false),
    XOR("xor", false),
    EQ("eq", true),
    NE("ne", true),
    LT("lt_s", true),
    LE("le_s", true),
    GT("gt_s", true),
    GE("ge_s", true);

    private final String mnemonic;
    private final boolean comparison;

    private BinaryOp(String mnemonic, boolean comparison) {
      this.mnemonic = mnemonic;
      this.comparison = comparison;
    }

    /**
     * @return instruction name without the type prefix, e.g. "div_s"
     */
    public String mnemonic() {
      return mnemonic;
    }

    /**
     * @param operandType type of both operands after widening
     * @return type of the result
     */
    public ValueType resultType(ValueType operandType) {
      return comparison ? ValueType.LONG : operandType;
    }
  }
}
