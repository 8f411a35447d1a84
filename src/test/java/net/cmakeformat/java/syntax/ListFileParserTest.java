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

import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of listfile parsing through {@link ListFile#parse}. */
@RunWith(TestParameterInjector.class)
public final class ListFileParserTest {

  private static final ImmutableMap<String, ArgGrammar> GRAMMARS =
      ImmutableMap.of(
          "if", ArgGrammar.conditional(),
          "endif", ArgGrammar.conditional(),
          "add_library",
              ArgGrammar.standard()
                  .keyword("SOURCES", Arity.ZERO_OR_MORE)
                  .flags("STATIC", "SHARED")
                  .build());

  private static final CommandGrammars GRAMMAR_LOOKUP =
      name -> GRAMMARS.getOrDefault(name.toLowerCase(Locale.ROOT), ArgGrammar.anyArguments());

  private static ListFile parse(String src) throws SyntaxError.Exception {
    return ListFile.parse(ParserInput.fromString(src, ""), GRAMMAR_LOOKUP);
  }

  private static String error(String src) {
    SyntaxError.Exception ex = assertThrows(SyntaxError.Exception.class, () -> parse(src));
    return ex.errors().get(0).toString();
  }

  private static List<NodeKind> kinds(TreeNode node) {
    List<NodeKind> result = new ArrayList<>();
    for (TreeNode child : node.getChildNodes()) {
      result.add(child.getKind());
    }
    return result;
  }

  @Test
  public void testReconstructsSource(
      @TestParameter({
            "",
            "\n\n  \n",
            "foo()",
            "foo()\n",
            "\uFEFFproject(demo)\n",
            "set(x 1)\r\nset(y 2)\r\n",
            "# leading\n# block\nfoo(a b) # trailing\n",
            "add_library(lib STATIC\n  a.cc # first\n  b.cc\n  SOURCES c.cc)\n",
            "if(NOT (A AND B) OR C)\nendif()\n",
            "message(\"a ${b} c\" [==[raw ]] text]==])\n",
            "#[[ bracket\ncomment ]] foo(x)\n",
            "# cmake-format: off\nfoo( bar\n# cmake-format: on\nbaz()\n",
            "# cmake-format: off\nnever(closed\n",
            "cmd (a\n\n  b\t)\n"
          })
          String src)
      throws Exception {
    ListFile file = parse(src);

    assertThat(file.reconstruct()).isEqualTo(src);
    assertThat(file.getBody().getTokens()).isEqualTo(file.getTokens());
  }

  @Test
  public void testStatementStructure() throws Exception {
    ListFile file = parse("add_library(foo STATIC a.cc) # trailing\n");

    assertThat(file.getStatements()).hasSize(1);
    TreeNode statement = file.getStatements().get(0);
    assertThat(kinds(statement))
        .containsExactly(
            NodeKind.FUNNAME,
            NodeKind.LPAREN,
            NodeKind.ARGGROUP,
            NodeKind.RPAREN,
            NodeKind.COMMENT)
        .inOrder();
    assertThat(statement.getCommandName().getSpelling()).isEqualTo("add_library");
    TreeNode args = statement.getArgTree();
    assertThat(args.getPositionalGroups()).hasSize(1);
    assertThat(args.getPositionalGroups().get(0).reconstruct()).isEqualTo("foo STATIC a.cc");
    assertThat(args.getKeywordGroups()).isEmpty();
  }

  @Test
  public void testCommandNameLookupIsCaseInsensitive() throws Exception {
    TreeNode args = parse("ADD_LIBRARY(foo SOURCES a.cc)").getStatements().get(0).getArgTree();

    assertThat(args.getKeywordGroups()).hasSize(1);
    assertThat(args.getKeywordGroups().get(0).getKeywordToken().getSpelling())
        .isEqualTo("SOURCES");
  }

  @Test
  public void testWhitespaceBeforeParen() throws Exception {
    TreeNode statement = parse("foo  (a)").getStatements().get(0);

    assertThat(statement.getChildren().get(1)).isInstanceOf(Token.class);
    assertThat(((Token) statement.getChildren().get(1)).getSpelling()).isEqualTo("  ");
    assertThat(statement.getArgTree().reconstruct()).isEqualTo("a");
  }

  @Test
  public void testConditionalCommands() throws Exception {
    ListFile file = parse("if(NOT A)\nendif()\n");

    assertThat(file.getStatements()).hasSize(2);
    TreeNode ifArgs = file.getStatements().get(0).getArgTree();
    assertThat(ifArgs.getKind()).isEqualTo(NodeKind.ARGGROUP);
    assertThat(ifArgs.reconstruct()).isEqualTo("NOT A");
    assertThat(file.getStatements().get(1).getArgTree().getChildren()).isEmpty();
  }

  @Test
  public void testCommentsAtTopLevel() throws Exception {
    ListFile file = parse("# one\n# two\n\n# three\nfoo()\n");

    List<NodeKind> kinds = kinds(file.getBody());
    assertThat(kinds)
        .containsExactly(NodeKind.COMMENT, NodeKind.COMMENT, NodeKind.STATEMENT)
        .inOrder();
    assertThat(file.getBody().getChildNodes().get(0).reconstruct()).isEqualTo("# one\n# two");
  }

  @Test
  public void testFormatOffRegionIsNotParsed() throws Exception {
    ListFile file = parse("# cmake-format: off\nfoo( bar\n# cmake-format: on\nbaz()\n");

    assertThat(kinds(file.getBody()))
        .containsExactly(NodeKind.ONOFFSWITCH, NodeKind.STATEMENT)
        .inOrder();
    assertThat(file.getBody().getChildNodes().get(0).reconstruct())
        .isEqualTo("# cmake-format: off\nfoo( bar\n# cmake-format: on");
    assertThat(file.getStatements()).hasSize(1);
    assertThat(file.getStatements().get(0).getCommandName().getSpelling()).isEqualTo("baz");
  }

  @Test
  public void testFormatOffRunsToEndOfInput() throws Exception {
    ListFile file = parse("foo()\n# cmake-format: off\nbar(\n");

    assertThat(kinds(file.getBody()))
        .containsExactly(NodeKind.STATEMENT, NodeKind.ONOFFSWITCH)
        .inOrder();
    assertThat(file.getStatements()).hasSize(1);
  }

  @Test
  public void testStrayFormatOnIsAComment() throws Exception {
    ListFile file = parse("# cmake-format: on\nfoo()\n");

    assertThat(kinds(file.getBody()))
        .containsExactly(NodeKind.COMMENT, NodeKind.STATEMENT)
        .inOrder();
  }

  @Test
  public void testLocationsCarryFileName() throws Exception {
    ListFile file = ListFile.parse(ParserInput.fromString("\nfoo(a)", "x.cmake"), GRAMMAR_LOOKUP);

    assertThat(file.getFile()).isEqualTo("x.cmake");
    assertThat(file.getStatements().get(0).getStartLocation().toString()).isEqualTo("x.cmake:2:1");
  }

  @Test
  public void testKeywordGroupParts() throws Exception {
    ListFile file =
        ListFile.parse(
            ParserInput.fromLines("add_library(foo", "  SOURCES a.cc b.cc)"), GRAMMAR_LOOKUP);

    TreeNode sources = file.getStatements().get(0).getArgTree().getKeywordGroups().get(0);
    assertThat(sources.getKeyword().getKind()).isEqualTo(NodeKind.KEYWORD);
    assertThat(sources.getKeyword().getStartLocation().toString()).isEqualTo("2:3");
    assertThat(sources.getBody().reconstruct()).isEqualTo("a.cc b.cc");
  }

  @Test
  public void testErrors() {
    assertThat(error("foo bar()")).isEqualTo("1:5: unexpected 'bar', expected '('");
    assertThat(error("foo")).isEqualTo("1:4: unexpected end of input, expected '('");
    assertThat(error("cmd(a (b c)")).isEqualTo("1:12: unexpected end of input, expected ')'");
    assertThat(error("\"x\"()")).isEqualTo("1:1: expected a command name, got '\"x\"'");
    assertThat(error("foo()\n)")).isEqualTo("2:1: expected a command name, got ')'");
    assertThat(error("foo(\"abc)")).isEqualTo("1:5: unclosed quoted literal");
  }
}
