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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Map;
import net.cmakeformat.java.syntax.ArgGrammar;
import net.cmakeformat.java.syntax.Arity;

/**
 * Converts between {@link ArgGrammar} and the JSON shape in which configuration files declare
 * custom commands:
 *
 * <pre>
 * {"pargs": "*", "flags": ["BAR", "BAZ"], "kwargs": {"HEADERS": "*", "NAME": 1, "SUB": {...}}}
 * </pre>
 *
 * An arity is an integer or one of {@code "?"}, {@code "*"}, {@code "+"}; a keyword maps to an
 * arity or to a nested command spec.
 */
final class CommandSpecs {

  private CommandSpecs() {}

  static ArgGrammar fromJson(String path, JsonElement json) {
    if (!json.isJsonObject()) {
      throw new ConfigException(path + ": expected an object, got " + json);
    }
    JsonObject spec = json.getAsJsonObject();
    ArgGrammar.Builder grammar = ArgGrammar.standard();
    for (Map.Entry<String, JsonElement> entry : spec.entrySet()) {
      String key = entry.getKey();
      JsonElement value = entry.getValue();
      switch (key) {
        case "pargs":
          Arity pargs = arityFromJson(path + ".pargs", value);
          // Every argument that is not a keyword or flag must land in some positional group.
          if (pargs.isExact() && pargs.getCount() == 0) {
            throw new ConfigException(path + ".pargs: must admit positional arguments, got 0");
          }
          grammar.arity(pargs);
          break;
        case "flags":
          if (!value.isJsonArray()) {
            throw new ConfigException(path + ".flags: expected a list, got " + value);
          }
          for (JsonElement flag : value.getAsJsonArray()) {
            if (!flag.isJsonPrimitive() || !flag.getAsJsonPrimitive().isString()) {
              throw new ConfigException(path + ".flags: expected a string, got " + flag);
            }
            grammar.flags(flag.getAsString());
          }
          break;
        case "kwargs":
          if (!value.isJsonObject()) {
            throw new ConfigException(path + ".kwargs: expected an object, got " + value);
          }
          for (Map.Entry<String, JsonElement> kwarg : value.getAsJsonObject().entrySet()) {
            String kwargPath = path + ".kwargs." + kwarg.getKey();
            JsonElement kwargSpec = kwarg.getValue();
            if (kwargSpec.isJsonObject()) {
              grammar.keyword(kwarg.getKey(), fromJson(kwargPath, kwargSpec));
            } else {
              grammar.keyword(kwarg.getKey(), arityFromJson(kwargPath, kwargSpec));
            }
          }
          break;
        default:
          throw new ConfigException(path + ": unknown command spec field '" + key + "'");
      }
    }
    return grammar.build();
  }

  private static Arity arityFromJson(String path, JsonElement json) {
    if (!json.isJsonPrimitive()) {
      throw new ConfigException(path + ": expected an arity, got " + json);
    }
    try {
      return Arity.parse(json.getAsString());
    } catch (IllegalArgumentException ex) {
      throw new ConfigException(path + ": " + ex.getMessage(), ex);
    }
  }

  static JsonElement toJson(ArgGrammar grammar) {
    if (grammar.getKind() == ArgGrammar.Kind.POSITIONAL && grammar.getFlags().isEmpty()) {
      return arityToJson(grammar.getArity());
    }
    JsonObject spec = new JsonObject();
    spec.add("pargs", arityToJson(grammar.getArity()));
    if (!grammar.getFlags().isEmpty()) {
      JsonArray flags = new JsonArray();
      for (String flag : grammar.getFlags()) {
        flags.add(flag);
      }
      spec.add("flags", flags);
    }
    if (!grammar.getKeywords().isEmpty()) {
      JsonObject kwargs = new JsonObject();
      for (Map.Entry<String, ArgGrammar> entry : grammar.getKeywords().entrySet()) {
        kwargs.add(entry.getKey(), toJson(entry.getValue()));
      }
      spec.add("kwargs", kwargs);
    }
    return spec;
  }

  private static JsonPrimitive arityToJson(Arity arity) {
    return arity.isExact()
        ? new JsonPrimitive(arity.getCount())
        : new JsonPrimitive(arity.toString());
  }
}
