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

package net.cmakeformat.java.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.regex.Pattern;
import net.cmakeformat.java.commands.CommandRegistry;
import net.cmakeformat.java.config.Configuration.CommandCase;
import net.cmakeformat.java.config.Configuration.LineEnding;
import net.cmakeformat.java.syntax.ArgGrammar;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Configuration}. */
@RunWith(JUnit4.class)
public final class ConfigurationTest {

  @Test
  public void testDefaults() {
    Configuration config = Configuration.DEFAULT;

    assertThat(config.lineWidth()).isEqualTo(80);
    assertThat(config.tabSize()).isEqualTo(2);
    assertThat(config.maxSubargsPerLine()).isEqualTo(3);
    assertThat(config.commandCase()).isEqualTo(CommandCase.CANONICAL);
    assertThat(config.lineEnding()).isEqualTo(LineEnding.UNIX);
    assertThat(config.algorithmOrder()).containsExactly(0, 1, 2, 3, 4).inOrder();
    assertThat(config.literalCommentPattern()).isNull();
    assertThat(config.inputEncoding()).isEqualTo("utf-8");
    assertThat(config.additionalCommands().keySet()).containsExactly("foo");
    assertThat(config.perCommand()).isEmpty();
  }

  @Test
  public void testDefaultPatterns() {
    Pattern fence = Pattern.compile(Configuration.DEFAULT_FENCE_PATTERN);
    Pattern ruler = Pattern.compile(Configuration.DEFAULT_RULER_PATTERN);

    assertThat(fence.matcher("  ```cmake").matches()).isTrue();
    assertThat(fence.matcher("~~~~").matches()).isTrue();
    assertThat(fence.matcher("``").matches()).isFalse();
    assertThat(ruler.matcher("#######").matches()).isTrue();
    assertThat(ruler.matcher("--- title ---").matches()).isTrue();
    assertThat(ruler.matcher("plain words").matches()).isFalse();
  }

  @Test
  public void testEndl() {
    assertThat(Configuration.DEFAULT.endl()).isEqualTo("\n");
    Configuration windows = Configuration.builder().lineEnding(LineEnding.WINDOWS).build();
    assertThat(windows.endl()).isEqualTo("\r\n");
  }

  @Test
  public void testDetectedLineEndingAppliesOnlyToAuto() {
    Configuration auto = Configuration.builder().lineEnding(LineEnding.AUTO).build();
    assertThat(auto.endl()).isEqualTo("\n");
    assertThat(auto.withDetectedLineEnding(LineEnding.WINDOWS).endl()).isEqualTo("\r\n");
    assertThat(auto.withDetectedLineEnding(LineEnding.WINDOWS).lineEnding())
        .isEqualTo(LineEnding.AUTO);

    Configuration unix = Configuration.DEFAULT;
    assertThat(unix.withDetectedLineEnding(LineEnding.WINDOWS)).isSameInstanceAs(unix);
    assertThrows(
        IllegalArgumentException.class, () -> auto.withDetectedLineEnding(LineEnding.AUTO));
  }

  @Test
  public void testDetectLineEnding() {
    assertThat(LineEnding.detect("")).isEqualTo(LineEnding.UNIX);
    assertThat(LineEnding.detect("a\nb\n")).isEqualTo(LineEnding.UNIX);
    assertThat(LineEnding.detect("a\r\nb\r\nc\n")).isEqualTo(LineEnding.WINDOWS);
    assertThat(LineEnding.detect("a\r\nb\n")).isEqualTo(LineEnding.UNIX);
  }

  @Test
  public void testResolveForCommand() {
    Configuration config =
        Configuration.builder()
            .lineWidth(100)
            .perCommand(
                ImmutableMap.of(
                    "foo",
                    ImmutableMap.<String, Object>of(
                        "line_width", 40, "command_case", CommandCase.UPPER)))
            .build();

    assertThat(config.resolveForCommand("FOO", "line_width")).isEqualTo(40);
    assertThat(config.resolveForCommand("bar", "line_width")).isEqualTo(100);
    assertThat(config.resolveForCommand("foo", "tab_size")).isEqualTo(2);
    assertThat(config.resolveForCommand("foo", "no_such_option")).isNull();
    assertThat(config.commandCaseFor("foo")).isEqualTo(CommandCase.UPPER);
    assertThat(config.commandCaseFor("bar")).isEqualTo(CommandCase.CANONICAL);
  }

  @Test
  public void testAsMapUsesConfigurationKeys() {
    ImmutableMap<String, Object> map = Configuration.DEFAULT.asMap();

    assertThat(map).containsEntry("line_width", 80);
    assertThat(map).containsEntry("bullet_char", "*");
    assertThat(map).containsEntry("keyword_case", Configuration.KeywordCase.UNCHANGED);
    assertThat(map).doesNotContainKey("literal_comment_pattern");
    assertThat(map).doesNotContainKey("additional_commands");
  }

  @Test
  public void testCommandRegistryAddsAdditionalCommands() {
    ArgGrammar custom = ArgGrammar.standard().flags("QUIET").build();
    Configuration config =
        Configuration.builder().additionalCommands(ImmutableMap.of("add_library", custom)).build();

    CommandRegistry registry = config.commandRegistry();
    assertThat(registry.lookup("add_library")).isSameInstanceAs(custom);
    assertThat(registry.contains("add_executable")).isTrue();
    assertThat(Configuration.DEFAULT.commandRegistry().lookup("FOO").getKeywords())
        .containsKey("SOURCES");
  }
}
