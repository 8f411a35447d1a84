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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private static ImmutableList<Token> tokens(String input) throws SyntaxError.Exception {
    return Lexer.tokenize(ParserInput.fromString(input, ""));
  }

  /**
   * Returns the names of the tokens and their spellings. Punctuation and whitespace are printed
   * without their spelling.
   */
  private static String values(String input) throws SyntaxError.Exception {
    StringBuilder buffer = new StringBuilder();
    for (Token token : tokens(input)) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(token.getKind().name());
      switch (token.getKind()) {
        case LEFT_PAREN:
        case RIGHT_PAREN:
        case WHITESPACE:
        case NEWLINE:
        case BYTEORDER_MARK:
          break;
        default:
          buffer.append('(').append(token.getSpelling()).append(')');
      }
    }
    return buffer.toString();
  }

  // Scans src and returns the first error, which must exist.
  private static String error(String src) {
    SyntaxError.Exception ex = assertThrows(SyntaxError.Exception.class, () -> tokens(src));
    return ex.errors().get(0).toString();
  }

  private static String reconstruct(ImmutableList<Token> tokens) {
    StringBuilder buf = new StringBuilder();
    for (Token token : tokens) {
      buf.append(token.getSpelling());
    }
    return buf.toString();
  }

  @Test
  public void testBasics() throws Exception {
    assertThat(values("add_library(foo STATIC a.cc)\n"))
        .isEqualTo(
            "WORD(add_library) LEFT_PAREN WORD(foo) WHITESPACE WORD(STATIC) WHITESPACE"
                + " UNQUOTED_LITERAL(a.cc) RIGHT_PAREN NEWLINE");
    assertThat(values("")).isEmpty();
    assertThat(values("foo (\t)"))
        .isEqualTo("WORD(foo) WHITESPACE LEFT_PAREN WHITESPACE RIGHT_PAREN");
  }

  @Test
  public void testNumbersAndVariableReferences() throws Exception {
    assertThat(values("1.2.3 ${FOO} ${A}_${B} 12abc ${a${b}}"))
        .isEqualTo(
            "NUMBER(1.2.3) WHITESPACE DEREF(${FOO}) WHITESPACE UNQUOTED_LITERAL(${A}_${B})"
                + " WHITESPACE UNQUOTED_LITERAL(12abc) WHITESPACE DEREF(${a${b}})");
  }

  @Test
  public void testUnquotedLiterals() throws Exception {
    assertThat(values("a\\ b")).isEqualTo("UNQUOTED_LITERAL(a\\ b)");
    assertThat(values("a#b")).isEqualTo("UNQUOTED_LITERAL(a#b)");
    assertThat(values("-DFOO=1")).isEqualTo("UNQUOTED_LITERAL(-DFOO=1)");
    assertThat(values("[foo]")).isEqualTo("UNQUOTED_LITERAL([foo])");
  }

  @Test
  public void testQuotedLiterals() throws Exception {
    assertThat(values("\"a b\" \"x\\\"y\""))
        .isEqualTo("QUOTED_LITERAL(\"a b\") WHITESPACE QUOTED_LITERAL(\"x\\\"y\")");

    ImmutableList<Token> tokens = tokens("(\"one\ntwo\" x)");
    assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.QUOTED_LITERAL);
    assertThat(tokens.get(1).getSpelling()).isEqualTo("\"one\ntwo\"");
    assertThat(tokens.get(3).getLocation().line()).isEqualTo(2);
    assertThat(tokens.get(3).getLocation().column()).isEqualTo(6);
  }

  @Test
  public void testComments() throws Exception {
    assertThat(values("# hello\nfoo() # trailing\n"))
        .isEqualTo(
            "COMMENT(# hello) NEWLINE WORD(foo) LEFT_PAREN RIGHT_PAREN WHITESPACE"
                + " COMMENT(# trailing) NEWLINE");
    assertThat(values("#[==[ a ]] b ]==] x"))
        .isEqualTo("BRACKET_COMMENT(#[==[ a ]] b ]==]) WHITESPACE WORD(x)");

    ImmutableList<Token> tokens = tokens("#[[multi\nline]]\nfoo");
    assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.BRACKET_COMMENT);
    assertThat(tokens.get(0).getSpelling()).isEqualTo("#[[multi\nline]]");
    assertThat(tokens.get(2).getLocation().line()).isEqualTo(3);
  }

  @Test
  public void testBracketArguments() throws Exception {
    assertThat(values("[=[a]]b]=] [[x]]"))
        .isEqualTo("BRACKET_ARGUMENT([=[a]]b]=]) WHITESPACE BRACKET_ARGUMENT([[x]])");
  }

  @Test
  public void testFormatMarkers() throws Exception {
    assertThat(values("# cmake-format: off\n#cmf:on\n# cmake-format: offset\n"))
        .isEqualTo(
            "FORMAT_OFF(# cmake-format: off) NEWLINE FORMAT_ON(#cmf:on) NEWLINE"
                + " COMMENT(# cmake-format: offset) NEWLINE");
  }

  @Test
  public void testByteOrderMark() throws Exception {
    assertThat(values("\uFEFFproject(x)"))
        .isEqualTo("BYTEORDER_MARK WORD(project) LEFT_PAREN WORD(x) RIGHT_PAREN");
  }

  @Test
  public void testLineEndings() throws Exception {
    ImmutableList<Token> tokens = tokens("a()\r\nb()\rc");
    assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.NEWLINE);
    assertThat(tokens.get(3).getSpelling()).isEqualTo("\r\n");
    assertThat(tokens.get(4).getLocation().line()).isEqualTo(2);
    // A lone carriage return is whitespace.
    assertThat(tokens.get(7).getKind()).isEqualTo(TokenKind.WHITESPACE);
  }

  @Test
  public void testLocations() throws Exception {
    ImmutableList<Token> tokens = tokens("foo(\n  bar)");
    Token bar = tokens.get(4);
    assertThat(bar.getSpelling()).isEqualTo("bar");
    assertThat(bar.getLocation().line()).isEqualTo(2);
    assertThat(bar.getLocation().column()).isEqualTo(3);
    assertThat(bar.getLocation().offset()).isEqualTo(7);
    assertThat(bar.getLocation().toString()).isEqualTo("2:3");
  }

  @Test
  public void testSpellingsReconstructInput() throws Exception {
    String input =
        "\uFEFF# leading\r\n"
            + "cmake_minimum_required(VERSION 3.5)\n"
            + "#[[ bracket\n comment ]]\n"
            + "set(x \"quoted \\\" ;\" [==[raw]==] ${y}/z a\\;b) # trailing\n"
            + "if(NOT (A AND B))\n"
            + "\tmessage(STATUS -- ${x})\n"
            + "endif()\n";
    assertThat(reconstruct(tokens(input))).isEqualTo(input);
  }

  @Test
  public void testErrors() throws Exception {
    assertThat(error("message(\"abc")).isEqualTo("1:9: unclosed quoted literal");
    assertThat(error("set(x [[abc)")).isEqualTo("1:7: unclosed bracket argument");
    assertThat(error("foo()\n#[[abc")).isEqualTo("2:1: unclosed bracket comment");
  }
}
