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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import net.cmakeformat.java.syntax.ArgGrammar;

/**
 * Reads a {@link Configuration} from JSON. Keys are the snake_case option names, as in
 *
 * <pre>
 * {
 *   "line_width": 100,
 *   "command_case": "lower",
 *   "additional_commands": {"foo": {"flags": ["BAR"], "kwargs": {"SOURCES": "*"}}},
 *   "per_command": {"foo": {"command_case": "upper"}}
 * }
 * </pre>
 *
 * Options that are absent or null keep their defaults. Malformed JSON, values of the wrong type
 * and values outside an option's choices are errors; unknown keys, ambiguous booleans and
 * per-command entries that are not objects are reported to the {@link WarningSink} and ignored.
 */
public final class ConfigLoader {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private final WarningSink warnings;

  private ConfigLoader(WarningSink warnings) {
    this.warnings = warnings;
  }

  /**
   * Parses configuration text.
   *
   * @throws ConfigException if the text is not a JSON object or an option value is invalid
   */
  public static Configuration load(String json, WarningSink warnings) {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new ConfigException("malformed configuration: " + ex.getMessage(), ex);
    }
    if (root.isJsonNull()) {
      return Configuration.DEFAULT;
    }
    if (!root.isJsonObject()) {
      throw new ConfigException("configuration must be a JSON object, got " + root);
    }
    return new ConfigLoader(warnings).read(root.getAsJsonObject());
  }

  /** Reads a UTF-8 configuration file. */
  public static Configuration loadFile(Path path, WarningSink warnings) throws IOException {
    logger.atFine().log("loading configuration from %s", path);
    String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    try {
      return load(json, warnings);
    } catch (ConfigException ex) {
      throw new ConfigException(path + ": " + ex.getMessage(), ex);
    }
  }

  /** Returns the configuration as pretty-printed JSON that {@link #load} accepts. */
  public static String toJson(Configuration config) {
    JsonObject root = new JsonObject();
    for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
      root.add(entry.getKey(), valueToJson(entry.getValue()));
    }
    JsonObject commands = new JsonObject();
    for (Map.Entry<String, ArgGrammar> entry : config.additionalCommands().entrySet()) {
      commands.add(entry.getKey(), CommandSpecs.toJson(entry.getValue()));
    }
    root.add("additional_commands", commands);
    JsonObject perCommand = new JsonObject();
    for (Map.Entry<String, ImmutableMap<String, Object>> entry : config.perCommand().entrySet()) {
      JsonObject overrides = new JsonObject();
      for (Map.Entry<String, Object> option : entry.getValue().entrySet()) {
        overrides.add(option.getKey(), valueToJson(option.getValue()));
      }
      perCommand.add(entry.getKey(), overrides);
    }
    root.add("per_command", perCommand);
    return GSON.toJson(root);
  }

  private static JsonElement valueToJson(Object value) {
    if (value instanceof Enum) {
      return new JsonPrimitive(((Enum<?>) value).name().toLowerCase(Locale.ROOT));
    }
    return GSON.toJsonTree(value);
  }

  /**
   * Returns the constant of {@code type} whose name matches {@code value} case-insensitively.
   *
   * @throws ConfigException naming the option and its choices if none does
   */
  static <E extends Enum<E>> E parseChoice(Class<E> type, String key, String value) {
    for (E constant : type.getEnumConstants()) {
      if (constant.name().equalsIgnoreCase(value)) {
        return constant;
      }
    }
    List<String> choices = new ArrayList<>();
    for (E constant : type.getEnumConstants()) {
      choices.add(constant.name().toLowerCase(Locale.ROOT));
    }
    throw new ConfigException(
        String.format(
            "%s must be one of %s, got '%s'", key, Joiner.on(", ").join(choices), value));
  }

  private Configuration read(JsonObject root) {
    Configuration.Builder builder = Configuration.DEFAULT.toBuilder();
    for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
      String key = entry.getKey();
      JsonElement value = entry.getValue();
      if (value.isJsonNull()) {
        continue;
      }
      switch (key) {
        case "line_width":
          builder.lineWidth(readInt(key, value));
          break;
        case "tab_size":
          builder.tabSize(readInt(key, value));
          break;
        case "max_subargs_per_line":
          builder.maxSubargsPerLine(readInt(key, value));
          break;
        case "separate_ctrl_name_with_space":
          builder.separateCtrlNameWithSpace(readBoolean(key, value));
          break;
        case "separate_fn_name_with_space":
          builder.separateFnNameWithSpace(readBoolean(key, value));
          break;
        case "dangle_parens":
          builder.dangleParens(readBoolean(key, value));
          break;
        case "bullet_char":
          builder.bulletChar(readChar(key, value));
          break;
        case "enum_char":
          builder.enumChar(readChar(key, value));
          break;
        case "line_ending":
          builder.lineEnding(
              parseChoice(Configuration.LineEnding.class, key, readString(key, value)));
          break;
        case "command_case":
          builder.commandCase(
              parseChoice(Configuration.CommandCase.class, key, readString(key, value)));
          break;
        case "keyword_case":
          builder.keywordCase(
              parseChoice(Configuration.KeywordCase.class, key, readString(key, value)));
          break;
        case "always_wrap":
          builder.alwaysWrap(readStringList(key, value));
          break;
        case "algorithm_order":
          builder.algorithmOrder(readIntList(key, value));
          break;
        case "autosort":
          builder.autosort(readBoolean(key, value));
          break;
        case "enable_markup":
          builder.enableMarkup(readBoolean(key, value));
          break;
        case "first_comment_is_literal":
          builder.firstCommentIsLiteral(readBoolean(key, value));
          break;
        case "literal_comment_pattern":
          builder.literalCommentPattern(readString(key, value));
          break;
        case "fence_pattern":
          builder.fencePattern(readString(key, value));
          break;
        case "ruler_pattern":
          builder.rulerPattern(readString(key, value));
          break;
        case "emit_byteorder_mark":
          builder.emitByteorderMark(readBoolean(key, value));
          break;
        case "hashruler_min_length":
          builder.hashrulerMinLength(readInt(key, value));
          break;
        case "canonicalize_hashrulers":
          builder.canonicalizeHashrulers(readBoolean(key, value));
          break;
        case "input_encoding":
          builder.inputEncoding(readString(key, value));
          break;
        case "output_encoding":
          builder.outputEncoding(readString(key, value));
          break;
        case "additional_commands":
          builder.additionalCommands(readAdditionalCommands(value));
          break;
        case "per_command":
          builder.perCommand(readPerCommand(value));
          break;
        default:
          warnings.warn(String.format("Ignoring unknown configuration key '%s'", key));
      }
    }
    return builder.build();
  }

  private ImmutableMap<String, ArgGrammar> readAdditionalCommands(JsonElement value) {
    if (!value.isJsonObject()) {
      throw new ConfigException("additional_commands must be an object, got " + value);
    }
    Map<String, ArgGrammar> commands = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
      String name = entry.getKey().toLowerCase(Locale.ROOT);
      commands.put(name, CommandSpecs.fromJson("additional_commands." + name, entry.getValue()));
    }
    logger.atFine().log("read %d additional commands", commands.size());
    return ImmutableMap.copyOf(commands);
  }

  private ImmutableMap<String, ImmutableMap<String, Object>> readPerCommand(JsonElement value) {
    if (!value.isJsonObject()) {
      throw new ConfigException("per_command must be an object, got " + value);
    }
    Map<String, Map<String, Object>> perCommand = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
      if (!entry.getValue().isJsonObject()) {
        warnings.warn(
            String.format(
                "Invalid override of type %s for %s",
                jsonTypeName(entry.getValue()), entry.getKey()));
        continue;
      }
      Map<String, Object> overrides =
          perCommand.computeIfAbsent(
              entry.getKey().toLowerCase(Locale.ROOT), k -> new LinkedHashMap<>());
      for (Map.Entry<String, JsonElement> option : entry.getValue().getAsJsonObject().entrySet()) {
        overrides.put(option.getKey(), readOverride(option.getKey(), option.getValue()));
      }
    }
    ImmutableMap.Builder<String, ImmutableMap<String, Object>> result = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, Object>> entry : perCommand.entrySet()) {
      result.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return result.buildOrThrow();
  }

  // Enumerated options are checked like their global counterparts; other values are kept as plain
  // Java values.
  private Object readOverride(String key, JsonElement value) {
    switch (key) {
      case "line_ending":
        return parseChoice(Configuration.LineEnding.class, key, readString(key, value));
      case "command_case":
        return parseChoice(Configuration.CommandCase.class, key, readString(key, value));
      case "keyword_case":
        return parseChoice(Configuration.KeywordCase.class, key, readString(key, value));
      default:
        return toJava(value);
    }
  }

  private static Object toJava(JsonElement value) {
    if (value.isJsonArray()) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (JsonElement element : value.getAsJsonArray()) {
        list.add(toJava(element));
      }
      return list.build();
    }
    if (value.isJsonPrimitive()) {
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return primitive.getAsBoolean();
      }
      if (primitive.isNumber()) {
        BigInteger integral = integralValue(primitive);
        if (integral != null && integral.bitLength() < Integer.SIZE) {
          return integral.intValue();
        }
        if (integral != null && integral.bitLength() < Long.SIZE) {
          return integral.longValue();
        }
        return primitive.getAsDouble();
      }
      return primitive.getAsString();
    }
    return value.toString();
  }

  private static String jsonTypeName(JsonElement value) {
    if (value.isJsonArray()) {
      return "list";
    }
    if (value.isJsonPrimitive()) {
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      return primitive.isBoolean() ? "bool" : primitive.isNumber() ? "number" : "string";
    }
    return "null";
  }

  // Returns the value of a number without a fractional part, or null for any other primitive.
  @Nullable
  private static BigInteger integralValue(JsonPrimitive primitive) {
    if (!primitive.isNumber()) {
      return null;
    }
    BigDecimal number;
    try {
      number = primitive.getAsBigDecimal();
    } catch (NumberFormatException ex) {
      return null; // not a plain decimal, e.g. NaN
    }
    return number.signum() == 0 || number.stripTrailingZeros().scale() <= 0
        ? number.toBigInteger()
        : null;
  }

  private static int readInt(String key, JsonElement value) {
    BigInteger integral =
        value.isJsonPrimitive() ? integralValue(value.getAsJsonPrimitive()) : null;
    if (integral == null || integral.bitLength() >= Integer.SIZE) {
      throw new ConfigException(key + " must be an integer, got " + value);
    }
    return integral.intValue();
  }

  private boolean readBoolean(String key, JsonElement value) {
    if (!value.isJsonPrimitive()) {
      throw new ConfigException(key + " must be a boolean, got " + value);
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    return primitive.isBoolean()
        ? primitive.getAsBoolean()
        : BooleanParser.parse(primitive.getAsString(), warnings);
  }

  private static String readString(String key, JsonElement value) {
    if (!value.isJsonPrimitive()) {
      throw new ConfigException(key + " must be a string, got " + value);
    }
    return value.getAsString();
  }

  private static char readChar(String key, JsonElement value) {
    String text = readString(key, value);
    if (text.isEmpty()) {
      throw new ConfigException(key + " must not be empty");
    }
    return text.charAt(0);
  }

  private static JsonArray readArray(String key, JsonElement value) {
    if (!value.isJsonArray()) {
      throw new ConfigException(key + " must be a list, got " + value);
    }
    return value.getAsJsonArray();
  }

  private static ImmutableList<String> readStringList(String key, JsonElement value) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement element : readArray(key, value)) {
      result.add(readString(key, element));
    }
    return result.build();
  }

  private static ImmutableList<Integer> readIntList(String key, JsonElement value) {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (JsonElement element : readArray(key, value)) {
      result.add(readInt(key, element));
    }
    return result.build();
  }
}
