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

package net.cmakeformat.java.cmd;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the {@link Main} command-line tool. */
@RunWith(JUnit4.class)
public final class MainTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private String stdin = "";

  private int run(String... args) {
    return Main.run(
        args,
        new ByteArrayInputStream(stdin.getBytes(UTF_8)),
        new PrintStream(out, true),
        new PrintStream(err, true));
  }

  private String out() {
    return new String(out.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), UTF_8);
  }

  private String writeFile(String name, String content) throws IOException {
    File file = tmp.newFile(name);
    Files.write(file.toPath(), content.getBytes(UTF_8));
    return file.getPath();
  }

  @Test
  public void testDumpsParseTreeByDefault() throws Exception {
    String file = writeFile("CMakeLists.txt", "set(x 1)\n");

    assertThat(run(file)).isEqualTo(Main.EXIT_OK);
    assertThat(out()).startsWith("BODY 1:1\n  STATEMENT 1:1\n");
    assertThat(out()).contains("NUMBER \"1\" 1:7");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testDumpsTokensFromStdin() {
    stdin = "a()\n";

    assertThat(run("--dump", "tokens", "-")).isEqualTo(Main.EXIT_OK);
    assertThat(out())
        .isEqualTo(
            "WORD \"a\" 1:1\n"
                + "LEFT_PAREN \"(\" 1:2\n"
                + "RIGHT_PAREN \")\" 1:3\n"
                + "NEWLINE \"\\n\" 1:4\n");
  }

  @Test
  public void testLint() throws Exception {
    String file =
        writeFile("CMakeLists.txt", "cmake_minimum_required(3.10)\nset_property(TARGET t)\n");

    assertThat(run("--lint", file)).isEqualTo(Main.EXIT_OK);
    assertThat(out())
        .isEqualTo(
            file
                + ":1:24: [E1125] Missing required keyword argument VERSION\n"
                + file
                + ":2:14: [E1125] Missing required keyword argument PROPERTY\n");
  }

  @Test
  public void testLintCleanFilePrintsNothing() throws Exception {
    String file = writeFile("CMakeLists.txt", "cmake_minimum_required(VERSION 3.10)\n");

    assertThat(run("--dump", "lint", file)).isEqualTo(Main.EXIT_OK);
    assertThat(out()).isEmpty();
  }

  @Test
  public void testSyntaxError() throws Exception {
    String good = writeFile("good.cmake", "foo()\n");
    String bad = writeFile("bad.cmake", "foo(\n");

    assertThat(run(good, bad)).isEqualTo(Main.EXIT_SYNTAX_ERROR);
    assertThat(out()).contains("# " + good + "\n");
    assertThat(out()).contains("# " + bad + "\n");
    assertThat(err()).isEqualTo(bad + ":2:1: unexpected end of input, expected ')'\n");
  }

  @Test
  public void testMissingFile() {
    String missing = tmp.getRoot().getPath() + "/missing.cmake";

    assertThat(run(missing)).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).startsWith("Error reading " + missing);
  }

  @Test
  public void testUsageErrors() {
    assertThat(run()).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("no input files");

    assertThat(run("--dump", "ast", "-")).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("--dump must be one of [tokens, parse, lint], got 'ast'");

    assertThat(run("--no-such-flag")).isEqualTo(Main.EXIT_USAGE);
  }

  @Test
  public void testHelp() {
    assertThat(run("--help")).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("--config-file");
  }

  @Test
  public void testConfigFileDeclaresCommands() throws Exception {
    String config =
        writeFile(
            "config.json",
            "{\"additional_commands\": {\"my_cmd\": {\"kwargs\": {\"SOURCES\": \"*\"}}}}");
    String file = writeFile("CMakeLists.txt", "my_cmd(lib SOURCES a.cc)\n");

    assertThat(run("--config-file", config, file)).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("KWARGGROUP 1:12");
  }

  @Test
  public void testInvalidConfigFile() throws Exception {
    String config = writeFile("config.json", "{\"line_width\": \"wide\"}");

    assertThat(run("--config-file", config, "-")).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("line_width must be an integer");
  }

  @Test
  public void testCommandWithoutPositionalsIsAConfigError() throws Exception {
    String config =
        writeFile(
            "config.json",
            "{\"additional_commands\": {\"foo\": {\"pargs\": 0, \"kwargs\": {\"BAR\": 1}}}}");
    stdin = "foo(x BAR y)\n";

    assertThat(run("--config-file", config, "-")).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("additional_commands.foo.pargs: must admit positional arguments");
  }

  @Test
  public void testUnsupportedInputEncoding() throws Exception {
    String config = writeFile("config.json", "{\"input_encoding\": \"no-such-charset\"}");

    assertThat(run("--config-file", config, "-")).isEqualTo(Main.EXIT_USAGE);
    assertThat(err()).contains("unsupported input_encoding 'no-such-charset'");
  }

  @Test
  public void testDumpConfig() throws Exception {
    String config = writeFile("config.json", "{\"line_width\": 120}");

    assertThat(run("--config-file", config, "--dump-config")).isEqualTo(Main.EXIT_OK);
    assertThat(out()).contains("\"line_width\": 120");
    assertThat(out()).contains("\"additional_commands\"");
  }
}
