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

package exm.tinyc.frontend;

/**
 * Token categories.  Keywords are scanned as NAME.
 */
public enum TokenKind {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  OR("|"),
  XOR("~"),
  AND("&"),
  NOT("!"),
  EQUAL("="),
  NOT_EQUAL("<>"),
  GREATER_THAN(">"),
  GREATER_EQUAL(">="),
  LESS_THAN("<"),
  LESS_EQUAL("<="),
  LPAREN("("),
  RPAREN(")"),
  DOT("."),
  COMMA(","),
  SEMICOLON(";"),
  COLON(":"),
  NUMBER(null),
  NAME(null),
  EOF(null);

  private final String symbol;

  private TokenKind(String symbol) {
    this.symbol = symbol;
  }

  /**
   * @return fixed spelling of an operator or punctuation token,
   *         null for NUMBER, NAME and EOF
   */
  public String symbol() {
    return symbol;
  }

  public String describe() {
    if (symbol != null) {
      return "'" + symbol + "'";
    }
    switch (this) {
      case NUMBER:
        return "number";
      case NAME:
        return "name";
      default:
        return "end of input";
    }
  }
}
