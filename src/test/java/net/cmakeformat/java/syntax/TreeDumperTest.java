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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link TreeDumper}. */
@RunWith(JUnit4.class)
public final class TreeDumperTest {

  private static ListFile parse(String src, CommandGrammars grammars) throws Exception {
    return ListFile.parse(ParserInput.fromString(src, ""), grammars);
  }

  @Test
  public void testDumpOmitsWhitespace() throws Exception {
    ListFile file = parse("set(x 1) # c\n", name -> ArgGrammar.anyArguments());

    assertThat(TreeDumper.dump(file.getBody()))
        .isEqualTo(
            String.join(
                "\n",
                "BODY 1:1",
                "  STATEMENT 1:1",
                "    FUNNAME 1:1",
                "      WORD \"set\" 1:1",
                "    LPAREN 1:4",
                "      LEFT_PAREN \"(\" 1:4",
                "    ARGGROUP 1:5",
                "      PARGGROUP 1:5 [*]",
                "        ARGUMENT 1:5",
                "          WORD \"x\" 1:5",
                "        ARGUMENT 1:7",
                "          NUMBER \"1\" 1:7",
                "    RPAREN 1:8",
                "      RIGHT_PAREN \")\" 1:8",
                "    COMMENT 1:10",
                "      COMMENT \"# c\" 1:10",
                ""));
  }

  @Test
  public void testDumpWithWhitespace() throws Exception {
    ListFile file = parse("f(a)\n", name -> ArgGrammar.anyArguments());

    assertThat(TreeDumper.dump(file.getBody(), true))
        .isEqualTo(
            String.join(
                "\n",
                "BODY 1:1",
                "  STATEMENT 1:1",
                "    FUNNAME 1:1",
                "      WORD \"f\" 1:1",
                "    LPAREN 1:2",
                "      LEFT_PAREN \"(\" 1:2",
                "    ARGGROUP 1:3",
                "      PARGGROUP 1:3 [*]",
                "        ARGUMENT 1:3",
                "          WORD \"a\" 1:3",
                "    RPAREN 1:4",
                "      RIGHT_PAREN \")\" 1:4",
                "  NEWLINE \"\\n\" 1:5",
                ""));
  }

  @Test
  public void testDumpMarksSortableGroups() throws Exception {
    ArgGrammar grammar = ArgGrammar.standard().arity(Arity.exactly(2)).sortable(true).build();
    ListFile file = parse("f(b a)", name -> grammar);

    assertThat(TreeDumper.dump(file.getBody())).contains("PARGGROUP 1:3 [2, sortable]\n");
  }

  @Test
  public void testDumpTokensEscapesSpelling() throws Exception {
    ListFile file = parse("m(\"a\\\\b\"\t)\r\n", name -> ArgGrammar.anyArguments());

    assertThat(TreeDumper.dumpTokens(file.getTokens()))
        .isEqualTo(
            String.join(
                "\n",
                "WORD \"m\" 1:1",
                "LEFT_PAREN \"(\" 1:2",
                "QUOTED_LITERAL \"\\\"a\\\\\\\\b\\\"\" 1:3",
                "WHITESPACE \"\\t\" 1:9",
                "RIGHT_PAREN \")\" 1:10",
                "NEWLINE \"\\r\\n\" 1:11",
                ""));
  }
}
