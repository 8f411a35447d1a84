// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.cmakeformat.java.syntax;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A scanner for listfiles. Every character of the input belongs to exactly one token, so the
 * concatenated spellings of the tokens reproduce the input.
 */
public final class Lexer {

  // "# cmake-format: off" and "# cmake-format: on", also with the short "cmf" prefix.
  private static final Pattern FORMAT_OFF = Pattern.compile("#\\s*(cmake-format|cmf):\\s*off\\b.*");
  private static final Pattern FORMAT_ON = Pattern.compile("#\\s*(cmake-format|cmf):\\s*on\\b.*");

  private final String file;
  private final char[] buffer;
  private final int[] lineStarts;
  private final List<SyntaxError> errors = new ArrayList<>();
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  private int pos;

  private Lexer(ParserInput input) {
    this.file = input.getFile();
    this.buffer = input.getContent();
    this.lineStarts = computeLineStarts(buffer);
    this.pos = 0;
  }

  /**
   * Scans the whole input.
   *
   * @throws SyntaxError.Exception if the input contains an unterminated quoted literal, bracket
   *     argument or bracket comment
   */
  public static ImmutableList<Token> tokenize(ParserInput input) throws SyntaxError.Exception {
    Lexer lexer = new Lexer(input);
    lexer.tokenizeAll();
    if (!lexer.errors.isEmpty()) {
      throw new SyntaxError.Exception(lexer.errors);
    }
    return lexer.tokens.build();
  }

  private static int[] computeLineStarts(char[] buffer) {
    int[] starts = new int[16];
    int n = 0;
    starts[n++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n == starts.length) {
          starts = Arrays.copyOf(starts, n * 2);
        }
        starts[n++] = i + 1;
      }
    }
    return Arrays.copyOf(starts, n);
  }

  // Maps a char offset to a Location.
  Location locationOf(int offset) {
    int index = Arrays.binarySearch(lineStarts, offset);
    if (index < 0) {
      index = -index - 2; // the line that starts before offset
    }
    return Location.create(file, index + 1, offset - lineStarts[index] + 1, offset);
  }

  private void error(String message, int offset) {
    errors.add(new SyntaxError(locationOf(offset), message));
  }

  private void addToken(TokenKind kind, int start, int end) {
    tokens.add(Token.create(kind, new String(buffer, start, end - start), locationOf(start)));
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < buffer.length ? buffer[i] : 0;
  }

  private void tokenizeAll() {
    if (buffer.length > 0 && buffer[0] == '\uFEFF') {
      pos = 1;
      addToken(TokenKind.BYTEORDER_MARK, 0, 1);
    }
    while (pos < buffer.length) {
      int start = pos;
      char c = buffer[pos];
      switch (c) {
        case '\n':
          pos++;
          addToken(TokenKind.NEWLINE, start, pos);
          break;
        case '\r':
          if (peek(1) == '\n') {
            pos += 2;
            addToken(TokenKind.NEWLINE, start, pos);
          } else {
            whitespace();
          }
          break;
        case ' ':
        case '\t':
        case '\f':
        case '\013':
          whitespace();
          break;
        case '(':
          pos++;
          addToken(TokenKind.LEFT_PAREN, start, pos);
          break;
        case ')':
          pos++;
          addToken(TokenKind.RIGHT_PAREN, start, pos);
          break;
        case '#':
          comment();
          break;
        case '"':
          quotedLiteral();
          break;
        case '[':
          if (bracketOpenLength(pos) > 0) {
            bracket(TokenKind.BRACKET_ARGUMENT, start);
          } else {
            unquotedLiteral(start);
          }
          break;
        default:
          if (isIdentifierStart(c)) {
            wordOrLiteral();
          } else if (isDigit(c)) {
            numberOrLiteral();
          } else if (c == '$' && peek(1) == '{') {
            derefOrLiteral();
          } else {
            unquotedLiteral(start);
          }
          break;
      }
    }
  }

  private void whitespace() {
    int start = pos;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == ' ' || c == '\t' || c == '\f' || c == '\013' || (c == '\r' && peek(1) != '\n')) {
        pos++;
      } else {
        break;
      }
    }
    addToken(TokenKind.WHITESPACE, start, pos);
  }

  /**
   * Scans a line comment, a bracket comment or a format-off/format-on marker.
   *
   * <p>ON ENTRY: 'pos' is the index of the '#'. ON EXIT: 'pos' is the index of the end-of-line
   * sequence (line comments) or 1 + the index of the closing bracket.
   */
  private void comment() {
    int start = pos;
    if (peek(1) == '[' && bracketOpenLength(pos + 1) > 0) {
      pos++;
      bracket(TokenKind.BRACKET_COMMENT, start);
      return;
    }
    while (pos < buffer.length
        && buffer[pos] != '\n'
        && !(buffer[pos] == '\r' && peek(1) == '\n')) {
      pos++;
    }
    String text = new String(buffer, start, pos - start);
    if (FORMAT_OFF.matcher(text).matches()) {
      addToken(TokenKind.FORMAT_OFF, start, pos);
    } else if (FORMAT_ON.matcher(text).matches()) {
      addToken(TokenKind.FORMAT_ON, start, pos);
    } else {
      addToken(TokenKind.COMMENT, start, pos);
    }
  }

  // Returns the length of a "[=*[" bracket opener at offset i, or zero if there is none.
  private int bracketOpenLength(int i) {
    if (i >= buffer.length || buffer[i] != '[') {
      return 0;
    }
    int j = i + 1;
    while (j < buffer.length && buffer[j] == '=') {
      j++;
    }
    return j < buffer.length && buffer[j] == '[' ? j + 1 - i : 0;
  }

  /**
   * Scans a bracket argument or the bracket part of a bracket comment.
   *
   * <p>ON ENTRY: 'pos' is the index of the opening "[". ON EXIT: 'pos' is 1 + the index of the
   * last character of the matching "]=*]".
   */
  private void bracket(TokenKind kind, int tokenStart) {
    int openLength = bracketOpenLength(pos);
    int equals = openLength - 2;
    pos += openLength;
    while (pos < buffer.length) {
      if (buffer[pos] == ']') {
        int j = pos + 1;
        while (j < buffer.length && buffer[j] == '=') {
          j++;
        }
        if (j - pos - 1 == equals && j < buffer.length && buffer[j] == ']') {
          pos = j + 1;
          addToken(kind, tokenStart, pos);
          return;
        }
      }
      pos++;
    }
    error("unclosed " + kind, tokenStart);
    addToken(kind, tokenStart, pos);
  }

  /**
   * Scans a quoted literal, which may span lines and contain backslash escapes.
   *
   * <p>ON ENTRY: 'pos' is the index of the opening quote. ON EXIT: 'pos' is 1 + the index of the
   * closing quote.
   */
  private void quotedLiteral() {
    int start = pos;
    pos++;
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == '\\') {
        if (pos < buffer.length) {
          pos++;
        }
      } else if (c == '"') {
        addToken(TokenKind.QUOTED_LITERAL, start, pos);
        return;
      }
    }
    error("unclosed quoted literal", start);
    addToken(TokenKind.QUOTED_LITERAL, start, pos);
  }

  // An identifier is a WORD unless literal characters follow it directly, as in "foo.cc".
  private void wordOrLiteral() {
    int start = pos;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    if (pos < buffer.length && isUnquotedPart(buffer[pos])) {
      unquotedLiteral(start);
    } else {
      addToken(TokenKind.WORD, start, pos);
    }
  }

  private void numberOrLiteral() {
    int start = pos;
    while (pos < buffer.length && (isDigit(buffer[pos]) || buffer[pos] == '.')) {
      pos++;
    }
    if (pos < buffer.length && isUnquotedPart(buffer[pos])) {
      unquotedLiteral(start);
    } else {
      addToken(TokenKind.NUMBER, start, pos);
    }
  }

  private void derefOrLiteral() {
    int start = pos;
    pos = skipDeref(pos);
    if (pos < buffer.length && isUnquotedPart(buffer[pos])) {
      unquotedLiteral(start);
    } else {
      addToken(TokenKind.DEREF, start, pos);
    }
  }

  // Returns the offset just past the "}" matching the "${" at offset i. Nested references are
  // skipped; an unterminated reference ends at the end of the line.
  private int skipDeref(int i) {
    int depth = 0;
    while (i < buffer.length && buffer[i] != '\n') {
      if (buffer[i] == '$' && i + 1 < buffer.length && buffer[i + 1] == '{') {
        depth++;
        i += 2;
        continue;
      }
      if (buffer[i] == '}') {
        depth--;
        i++;
        if (depth == 0) {
          return i;
        }
        continue;
      }
      i++;
    }
    return i;
  }

  /**
   * Scans the remainder of an unquoted literal that began at {@code start}.
   *
   * <p>ON EXIT: 'pos' is the index of the first character that cannot continue the literal.
   */
  private void unquotedLiteral(int start) {
    if (pos == start) {
      pos++; // the first character is always part of the literal
    }
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\\' && pos + 1 < buffer.length && buffer[pos + 1] != '\n') {
        pos += 2;
      } else if (c == '$' && peek(1) == '{') {
        pos = skipDeref(pos);
      } else if (isUnquotedPart(c)) {
        pos++;
      } else {
        break;
      }
    }
    addToken(TokenKind.UNQUOTED_LITERAL, start, pos);
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isUnquotedPart(char c) {
    switch (c) {
      case ' ':
      case '\t':
      case '\f':
      case '\013':
      case '\r':
      case '\n':
      case '(':
      case ')':
      case '"':
        return false;
      default:
        return true;
    }
  }
}
