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

import java.util.Locale;

import exm.tinyc.common.exceptions.LexError;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.exceptions.UnterminatedCommentError;

/**
 * Converts source text to tokens on demand.  Holds one token of
 * lookahead for the parser.
 *
 * Whitespace and comments are skipped.  Comments are enclosed in
 * braces and nest.  Names are case-insensitive and reported in upper
 * case.
 */
public class Scanner {
  private static final char EOF_CHAR = '\0';

  private final String file;
  private final String source;

  /** Offset of next unread character */
  private int pos = 0;
  private int line = 1;
  private int column = 1;

  private Token current = null;

  public Scanner(String file, String source) {
    this.file = file;
    this.source = source;
  }

  public String getFile() {
    return file;
  }

  /**
   * @return the token most recently returned by advance()
   */
  public Token current() {
    if (current == null) {
      throw new TinyRuntimeError("Scanner has not been advanced");
    }
    return current;
  }

  /**
   * Scan the next token and make it current.  Once input is exhausted,
   * the same EOF token is returned on every call.
   */
  public Token advance() throws LexError {
    if (current != null && current.is(TokenKind.EOF)) {
      return current;
    }
    current = scan();
    return current;
  }

  private Token scan() throws LexError {
    skipWhitespaceAndComments();
    FilePosition start = position();
    char c = peekChar();

    if (atEnd()) {
      return new Token(TokenKind.EOF, "", start);
    } else if (isLetter(c)) {
      int begin = pos;
      while (!atEnd() && (isLetter(peekChar()) || isDigit(peekChar()))) {
        nextChar();
      }
      String text = source.substring(begin, pos).toUpperCase(Locale.ROOT);
      return new Token(TokenKind.NAME, text, start);
    } else if (isDigit(c)) {
      int begin = pos;
      while (!atEnd() && isDigit(peekChar())) {
        nextChar();
      }
      return new Token(TokenKind.NUMBER, source.substring(begin, pos), start);
    }

    TokenKind kind = scanOperator();
    if (kind == null) {
      throw new LexError(start, "unexpected character '" + c + "'");
    }
    return new Token(kind, kind.symbol(), start);
  }

  /**
   * Maximal munch: two-character operators are tried first.
   * @return kind of operator consumed, or null if none matched
   */
  private TokenKind scanOperator() {
    char c = peekChar();
    char next = peekChar(1);
    if (c == '<' && next == '>') {
      nextChar(); nextChar();
      return TokenKind.NOT_EQUAL;
    } else if (c == '<' && next == '=') {
      nextChar(); nextChar();
      return TokenKind.LESS_EQUAL;
    } else if (c == '>' && next == '=') {
      nextChar(); nextChar();
      return TokenKind.GREATER_EQUAL;
    }

    TokenKind kind;
    switch (c) {
      case '+': kind = TokenKind.ADD; break;
      case '-': kind = TokenKind.SUB; break;
      case '*': kind = TokenKind.MUL; break;
      case '/': kind = TokenKind.DIV; break;
      case '|': kind = TokenKind.OR; break;
      case '~': kind = TokenKind.XOR; break;
      case '&': kind = TokenKind.AND; break;
      case '!': kind = TokenKind.NOT; break;
      case '=': kind = TokenKind.EQUAL; break;
      case '<': kind = TokenKind.LESS_THAN; break;
      case '>': kind = TokenKind.GREATER_THAN; break;
      case '(': kind = TokenKind.LPAREN; break;
      case ')': kind = TokenKind.RPAREN; break;
      case '.': kind = TokenKind.DOT; break;
      case ',': kind = TokenKind.COMMA; break;
      case ';': kind = TokenKind.SEMICOLON; break;
      case ':': kind = TokenKind.COLON; break;
      default:
        return null;
    }
    nextChar();
    return kind;
  }

  private void skipWhitespaceAndComments() throws UnterminatedCommentError {
    while (!atEnd()) {
      char c = peekChar();
      if (Character.isWhitespace(c)) {
        nextChar();
      } else if (c == '{') {
        skipComment();
      } else {
        return;
      }
    }
  }

  /**
   * Skip a comment, including nested comments.
   */
  private void skipComment() throws UnterminatedCommentError {
    FilePosition opener = position();
    nextChar();
    int depth = 1;
    while (depth > 0) {
      if (atEnd()) {
        throw new UnterminatedCommentError(opener);
      }
      char c = nextChar();
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      }
    }
  }

  private FilePosition position() {
    return new FilePosition(file, line, column);
  }

  private boolean atEnd() {
    return pos >= source.length();
  }

  private char peekChar() {
    return peekChar(0);
  }

  private char peekChar(int offset) {
    int i = pos + offset;
    return i < source.length() ? source.charAt(i) : EOF_CHAR;
  }

  private char nextChar() {
    char c = source.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
