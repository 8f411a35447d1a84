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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import net.cmakeformat.java.commands.CommandRegistry;
import net.cmakeformat.java.syntax.ArgGrammar;
import net.cmakeformat.java.syntax.Arity;

/**
 * Configuration is the set of options that control how listfiles are read and formatted: layout
 * widths, casing, comment handling, encodings, and the grammars of commands the user declares.
 *
 * <p>The {@link #DEFAULT} options are those of a configuration file that sets nothing. Options are
 * named after the snake_case keys of configuration files; see {@link ConfigLoader}.
 */
@AutoValue
public abstract class Configuration {

  /** Regular expression matching the fence that opens or closes a preformatted comment section. */
  public static final String DEFAULT_FENCE_PATTERN = "^\\s*([`~]{3}[`~]*)(.*)$";

  /** Regular expression matching a comment line that is a horizontal ruler. */
  public static final String DEFAULT_RULER_PATTERN = "^\\s*[^\\w\\s]{3}.*[^\\w\\s]{3}$";

  public static final Configuration DEFAULT = builder().build();

  /** Line endings of the output. AUTO follows the input, and is UNIX until it has been seen. */
  public enum LineEnding {
    UNIX("\n"),
    WINDOWS("\r\n"),
    AUTO("\n");

    private final String endl;

    LineEnding(String endl) {
      this.endl = endl;
    }

    public String endl() {
      return endl;
    }

    /** Returns WINDOWS if most lines of {@code content} end in CRLF, otherwise UNIX. */
    public static LineEnding detect(String content) {
      int windows = 0;
      int unix = 0;
      for (int i = 0; i < content.length(); i++) {
        if (content.charAt(i) == '\n') {
          if (i > 0 && content.charAt(i - 1) == '\r') {
            windows++;
          } else {
            unix++;
          }
        }
      }
      return windows > unix ? WINDOWS : UNIX;
    }
  }

  /** How command names are cased in the output. */
  public enum CommandCase {
    LOWER,
    UPPER,
    CANONICAL,
    UNCHANGED
  }

  /** How keywords and flags are cased in the output. */
  public enum KeywordCase {
    LOWER,
    UPPER,
    UNCHANGED
  }

  /** How wide to allow formatted listfiles. */
  public abstract int lineWidth();

  /** How many spaces to tab for indent. */
  public abstract int tabSize();

  /** If argument lists are longer than this, break them always. */
  public abstract int maxSubargsPerLine();

  public abstract boolean separateCtrlNameWithSpace();

  public abstract boolean separateFnNameWithSpace();

  /** Whether the closing parenthesis of a wrapped statement goes on its own line. */
  public abstract boolean dangleParens();

  public abstract char bulletChar();

  public abstract char enumChar();

  public abstract LineEnding lineEnding();

  public abstract CommandCase commandCase();

  public abstract KeywordCase keywordCase();

  /** Names of commands that are always wrapped. */
  public abstract ImmutableList<String> alwaysWrap();

  /** The order in which wrapping algorithms are tried during successive reflow attempts. */
  public abstract ImmutableList<Integer> algorithmOrder();

  /** Whether argument lists known to be sortable are sorted. */
  public abstract boolean autosort();

  public abstract boolean enableMarkup();

  public abstract boolean firstCommentIsLiteral();

  /** Comment blocks matching this pattern are not reflowed; null disables the check. */
  @Nullable
  public abstract String literalCommentPattern();

  public abstract String fencePattern();

  public abstract String rulerPattern();

  public abstract boolean emitByteorderMark();

  public abstract int hashrulerMinLength();

  public abstract boolean canonicalizeHashrulers();

  public abstract String inputEncoding();

  public abstract String outputEncoding();

  /** Grammars of commands declared by the user, keyed by lower-case command name. */
  public abstract ImmutableMap<String, ArgGrammar> additionalCommands();

  /** Option overrides keyed by lower-case command name, then by option key. */
  public abstract ImmutableMap<String, ImmutableMap<String, Object>> perCommand();

  // The line ending seen in the input when lineEnding() is AUTO.
  @Nullable
  abstract LineEnding detectedLineEnding();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_Configuration.Builder()
        .lineWidth(80)
        .tabSize(2)
        .maxSubargsPerLine(3)
        .separateCtrlNameWithSpace(false)
        .separateFnNameWithSpace(false)
        .dangleParens(false)
        .bulletChar('*')
        .enumChar('.')
        .lineEnding(LineEnding.UNIX)
        .commandCase(CommandCase.CANONICAL)
        .keywordCase(KeywordCase.UNCHANGED)
        .alwaysWrap(ImmutableList.of())
        .algorithmOrder(ImmutableList.of(0, 1, 2, 3, 4))
        .autosort(true)
        .enableMarkup(true)
        .firstCommentIsLiteral(false)
        .literalCommentPattern(null)
        .fencePattern(DEFAULT_FENCE_PATTERN)
        .rulerPattern(DEFAULT_RULER_PATTERN)
        .emitByteorderMark(false)
        .hashrulerMinLength(10)
        .canonicalizeHashrulers(true)
        .inputEncoding("utf-8")
        .outputEncoding("utf-8")
        .additionalCommands(
            ImmutableMap.of(
                "foo",
                ArgGrammar.standard()
                    .flags("BAR", "BAZ")
                    .keyword("HEADERS", Arity.ZERO_OR_MORE)
                    .keyword("SOURCES", Arity.ZERO_OR_MORE)
                    .keyword("DEPENDS", Arity.ZERO_OR_MORE)
                    .build()))
        .perCommand(ImmutableMap.of());
  }

  public abstract Builder toBuilder();

  /** Returns the end-of-line sequence of the output. */
  public String endl() {
    LineEnding detected = detectedLineEnding();
    return detected != null ? detected.endl() : lineEnding().endl();
  }

  /**
   * Returns a copy whose {@link #endl} follows the line ending detected in the input, if the
   * configured line ending is AUTO. Otherwise returns this configuration.
   */
  public Configuration withDetectedLineEnding(LineEnding detected) {
    checkArgument(detected != LineEnding.AUTO, "AUTO cannot be detected");
    if (lineEnding() != LineEnding.AUTO) {
      return this;
    }
    return toBuilder().detectedLineEnding(detected).build();
  }

  /**
   * Returns the value of option {@code key} for {@code command}: the per-command override if there
   * is one, otherwise the global value. Returns null for a key that is neither.
   */
  @Nullable
  public Object resolveForCommand(String command, String key) {
    ImmutableMap<String, Object> overrides = perCommand().get(command.toLowerCase(Locale.ROOT));
    if (overrides != null && overrides.containsKey(key)) {
      return overrides.get(key);
    }
    return asMap().get(key);
  }

  /** Returns the command casing for {@code command}, honoring a per-command override. */
  public CommandCase commandCaseFor(String command) {
    Object value = resolveForCommand(command, "command_case");
    if (value instanceof CommandCase) {
      return (CommandCase) value;
    }
    return ConfigLoader.parseChoice(CommandCase.class, "command_case", String.valueOf(value));
  }

  /** Returns the built-in commands together with the additional commands of this configuration. */
  public CommandRegistry commandRegistry() {
    return CommandRegistry.builtin().toBuilder().addAll(additionalCommands()).build();
  }

  /**
   * Returns the global options keyed as in configuration files, in declaration order. Enumerated
   * options map to their enum constants. The command tables are not included.
   */
  public ImmutableMap<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("line_width", lineWidth());
    map.put("tab_size", tabSize());
    map.put("max_subargs_per_line", maxSubargsPerLine());
    map.put("separate_ctrl_name_with_space", separateCtrlNameWithSpace());
    map.put("separate_fn_name_with_space", separateFnNameWithSpace());
    map.put("dangle_parens", dangleParens());
    map.put("bullet_char", String.valueOf(bulletChar()));
    map.put("enum_char", String.valueOf(enumChar()));
    map.put("line_ending", lineEnding());
    map.put("command_case", commandCase());
    map.put("keyword_case", keywordCase());
    map.put("always_wrap", alwaysWrap());
    map.put("algorithm_order", algorithmOrder());
    map.put("autosort", autosort());
    map.put("enable_markup", enableMarkup());
    map.put("first_comment_is_literal", firstCommentIsLiteral());
    if (literalCommentPattern() != null) {
      map.put("literal_comment_pattern", literalCommentPattern());
    }
    map.put("fence_pattern", fencePattern());
    map.put("ruler_pattern", rulerPattern());
    map.put("emit_byteorder_mark", emitByteorderMark());
    map.put("hashruler_min_length", hashrulerMinLength());
    map.put("canonicalize_hashrulers", canonicalizeHashrulers());
    map.put("input_encoding", inputEncoding());
    map.put("output_encoding", outputEncoding());
    return ImmutableMap.copyOf(map);
  }

  /** Builder of {@link Configuration}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder lineWidth(int value);

    public abstract Builder tabSize(int value);

    public abstract Builder maxSubargsPerLine(int value);

    public abstract Builder separateCtrlNameWithSpace(boolean value);

    public abstract Builder separateFnNameWithSpace(boolean value);

    public abstract Builder dangleParens(boolean value);

    public abstract Builder bulletChar(char value);

    public abstract Builder enumChar(char value);

    public abstract Builder lineEnding(LineEnding value);

    public abstract Builder commandCase(CommandCase value);

    public abstract Builder keywordCase(KeywordCase value);

    public abstract Builder alwaysWrap(ImmutableList<String> value);

    public abstract Builder algorithmOrder(ImmutableList<Integer> value);

    public abstract Builder autosort(boolean value);

    public abstract Builder enableMarkup(boolean value);

    public abstract Builder firstCommentIsLiteral(boolean value);

    public abstract Builder literalCommentPattern(@Nullable String value);

    public abstract Builder fencePattern(String value);

    public abstract Builder rulerPattern(String value);

    public abstract Builder emitByteorderMark(boolean value);

    public abstract Builder hashrulerMinLength(int value);

    public abstract Builder canonicalizeHashrulers(boolean value);

    public abstract Builder inputEncoding(String value);

    public abstract Builder outputEncoding(String value);

    public abstract Builder additionalCommands(ImmutableMap<String, ArgGrammar> value);

    public abstract Builder perCommand(ImmutableMap<String, ImmutableMap<String, Object>> value);

    abstract Builder detectedLineEnding(@Nullable LineEnding value);

    public abstract Configuration build();
  }
}
