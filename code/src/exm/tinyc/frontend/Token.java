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

public class Token {
  private final TokenKind kind;
  private final String text;
  private final FilePosition position;

  public Token(TokenKind kind, String text, FilePosition position) {
    this.kind = kind;
    this.text = text;
    this.position = position;
  }

  public TokenKind getKind() {
    return kind;
  }

  /**
   * @return source text; upper case for names, empty for EOF
   */
  public String getText() {
    return text;
  }

  public FilePosition getPosition() {
    return position;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  /**
   * @param keyword upper-case keyword
   */
  public boolean isKeyword(String keyword) {
    return kind == TokenKind.NAME && text.equals(keyword);
  }

  /**
   * @return description for error messages
   */
  public String describe() {
    switch (kind) {
      case NAME:
      case NUMBER:
        return "'" + text + "'";
      default:
        return kind.describe();
    }
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + position;
  }
}
