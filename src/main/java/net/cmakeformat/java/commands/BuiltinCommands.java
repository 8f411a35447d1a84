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

package net.cmakeformat.java.commands;

import static net.cmakeformat.java.syntax.ArgGrammar.standard;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import net.cmakeformat.java.lint.LintRecord;
import net.cmakeformat.java.syntax.ArgGrammar;
import net.cmakeformat.java.syntax.Arity;

/**
 * The grammars of the commands built into the language. Only the structure that matters for
 * layout is described: keywords, flags and positional arities. Commands with free-form arguments,
 * such as {@code string} or {@code list}, are left to the default grammar.
 */
final class BuiltinCommands {

  private static final Arity ONE = Arity.exactly(1);
  private static final Arity ANY = Arity.ZERO_OR_MORE;
  private static final Arity SOME = Arity.ONE_OR_MORE;

  private BuiltinCommands() {}

  @CanIgnoreReturnValue
  static CommandRegistry.Builder addTo(CommandRegistry.Builder registry) {
    addFlowControl(registry);
    addProjectCommands(registry);
    addTargetCommands(registry);
    addPropertyCommands(registry);
    addInstall(registry);
    return registry;
  }

  private static void addFlowControl(CommandRegistry.Builder registry) {
    for (String name : new String[] {"if", "elseif", "else", "endif", "while", "endwhile"}) {
      registry.add(name, ArgGrammar.conditional());
    }
    registry.add(
        "foreach",
        standard()
            .flags("IN")
            .keyword("RANGE", ANY)
            .keyword("LISTS", ANY)
            .keyword("ITEMS", ANY)
            .keyword("ZIP_LISTS", ANY)
            .build());
  }

  private static void addProjectCommands(CommandRegistry.Builder registry) {
    registry.add(
        "cmake_minimum_required",
        standard()
            .flags("FATAL_ERROR")
            .keyword("VERSION", ONE)
            .required("VERSION", LintRecord.MISSING_REQUIRED_KEYWORD)
            .build());
    registry.add(
        "project",
        standard()
            .keyword("VERSION", ONE)
            .keyword("DESCRIPTION", ONE)
            .keyword("HOMEPAGE_URL", ONE)
            .keyword("LANGUAGES", ANY)
            .build());
    registry.add(
        "message",
        standard()
            .flags(
                "FATAL_ERROR",
                "SEND_ERROR",
                "WARNING",
                "AUTHOR_WARNING",
                "DEPRECATION",
                "NOTICE",
                "STATUS",
                "VERBOSE",
                "DEBUG",
                "TRACE",
                "CHECK_START",
                "CHECK_PASS",
                "CHECK_FAIL")
            .build());
    registry.add(
        "set",
        standard()
            .flags("PARENT_SCOPE", "FORCE")
            .keyword(
                "CACHE",
                ArgGrammar.positional(
                    ANY,
                    ImmutableList.of("BOOL", "FILEPATH", "PATH", "STRING", "INTERNAL"),
                    false))
            .build());
    registry.add("option", standard().build());
    registry.add(
        "find_package",
        standard()
            .flags(
                "EXACT",
                "QUIET",
                "MODULE",
                "REQUIRED",
                "CONFIG",
                "NO_MODULE",
                "GLOBAL",
                "NO_POLICY_SCOPE",
                "NO_DEFAULT_PATH",
                "NO_CMAKE_PATH",
                "NO_CMAKE_ENVIRONMENT_PATH",
                "NO_SYSTEM_ENVIRONMENT_PATH",
                "NO_CMAKE_SYSTEM_PATH")
            .keyword("COMPONENTS", ANY)
            .keyword("OPTIONAL_COMPONENTS", ANY)
            .keyword("NAMES", ANY)
            .keyword("CONFIGS", ANY)
            .keyword("HINTS", ANY)
            .keyword("PATHS", ANY)
            .keyword("PATH_SUFFIXES", ANY)
            .build());
    registry.add(
        "include",
        standard().flags("OPTIONAL", "NO_POLICY_SCOPE").keyword("RESULT_VARIABLE", ONE).build());
    registry.add("add_subdirectory", standard().flags("EXCLUDE_FROM_ALL", "SYSTEM").build());
    registry.add(
        "configure_file",
        standard()
            .flags("COPYONLY", "ESCAPE_QUOTES", "@ONLY", "NO_SOURCE_PERMISSIONS")
            .keyword("NEWLINE_STYLE", ONE)
            .keyword("FILE_PERMISSIONS", ANY)
            .build());
    registry.add(
        "execute_process",
        standard()
            .flags(
                "OUTPUT_QUIET",
                "ERROR_QUIET",
                "OUTPUT_STRIP_TRAILING_WHITESPACE",
                "ERROR_STRIP_TRAILING_WHITESPACE")
            .keyword("COMMAND", ANY)
            .keyword("WORKING_DIRECTORY", ONE)
            .keyword("TIMEOUT", ONE)
            .keyword("RESULT_VARIABLE", ONE)
            .keyword("RESULTS_VARIABLE", ONE)
            .keyword("OUTPUT_VARIABLE", ONE)
            .keyword("ERROR_VARIABLE", ONE)
            .keyword("INPUT_FILE", ONE)
            .keyword("OUTPUT_FILE", ONE)
            .keyword("ERROR_FILE", ONE)
            .keyword("COMMAND_ECHO", ONE)
            .keyword("ENCODING", ONE)
            .build());
    registry.add(
        "add_test",
        standard()
            .keyword("NAME", ONE)
            .keyword("COMMAND", ANY)
            .keyword("CONFIGURATIONS", ANY)
            .keyword("WORKING_DIRECTORY", ONE)
            .flags("COMMAND_EXPAND_LISTS")
            .build());
    registry.add(
        "include_directories",
        standard().flags("AFTER", "BEFORE", "SYSTEM").sortable(true).build());
  }

  private static void addTargetCommands(CommandRegistry.Builder registry) {
    registry.add(
        "add_library",
        standard()
            .sortable(true)
            .flags(
                "STATIC",
                "SHARED",
                "MODULE",
                "OBJECT",
                "INTERFACE",
                "UNKNOWN",
                "IMPORTED",
                "GLOBAL",
                "EXCLUDE_FROM_ALL")
            .keyword("ALIAS", ONE)
            .build());
    registry.add(
        "add_executable",
        standard()
            .sortable(true)
            .flags("WIN32", "MACOSX_BUNDLE", "EXCLUDE_FROM_ALL", "IMPORTED", "GLOBAL")
            .keyword("ALIAS", ONE)
            .build());
    registry.add(
        "add_custom_command",
        standard()
            .flags(
                "APPEND",
                "VERBATIM",
                "USES_TERMINAL",
                "COMMAND_EXPAND_LISTS",
                "PRE_BUILD",
                "PRE_LINK",
                "POST_BUILD")
            .keyword("OUTPUT", ANY)
            .keyword("COMMAND", ANY)
            .keyword("MAIN_DEPENDENCY", ONE)
            .keyword("DEPENDS", ANY)
            .keyword("BYPRODUCTS", ANY)
            .keyword("IMPLICIT_DEPENDS", ANY)
            .keyword("WORKING_DIRECTORY", ONE)
            .keyword("COMMENT", ONE)
            .keyword("DEPFILE", ONE)
            .keyword("JOB_POOL", ONE)
            .keyword("TARGET", ONE)
            .build());
    registry.add(
        "add_custom_target",
        standard()
            .arity(ONE)
            .flags("ALL", "VERBATIM", "USES_TERMINAL", "COMMAND_EXPAND_LISTS")
            .keyword("COMMAND", ANY)
            .keyword("DEPENDS", ANY)
            .keyword("BYPRODUCTS", ANY)
            .keyword("WORKING_DIRECTORY", ONE)
            .keyword("COMMENT", ONE)
            .keyword("JOB_POOL", ONE)
            .keyword("SOURCES", ANY)
            .build());
    registry.add("add_dependencies", standard().sortable(true).build());

    ArgGrammar scoped =
        standard()
            .keyword("INTERFACE", ANY)
            .keyword("PUBLIC", ANY)
            .keyword("PRIVATE", ANY)
            .build();
    for (String name :
        new String[] {
          "target_compile_definitions",
          "target_compile_features",
          "target_compile_options",
          "target_link_directories",
          "target_link_options",
          "target_precompile_headers",
        }) {
      registry.add(name, scoped.toBuilder().flags("BEFORE").build());
    }
    registry.add(
        "target_include_directories",
        scoped.toBuilder().flags("SYSTEM", "BEFORE", "AFTER").build());
    registry.add("target_sources", scoped);
    registry.add(
        "target_link_libraries",
        scoped.toBuilder()
            .keyword("LINK_PUBLIC", ANY)
            .keyword("LINK_PRIVATE", ANY)
            .keyword("LINK_INTERFACE_LIBRARIES", ANY)
            .flags("DEBUG", "OPTIMIZED", "GENERAL")
            .build());
  }

  private static void addPropertyCommands(CommandRegistry.Builder registry) {
    ArgGrammar properties =
        standard()
            .keyword("PROPERTIES", ANY)
            .required("PROPERTIES", LintRecord.MISSING_REQUIRED_KEYWORD)
            .build();
    registry.add("set_target_properties", properties);
    registry.add("set_tests_properties", properties);
    registry.add("set_directory_properties", properties);
    registry.add(
        "set_source_files_properties",
        properties.toBuilder()
            .keyword("DIRECTORY", ANY)
            .keyword("TARGET_DIRECTORY", ANY)
            .build());
    registry.add(
        "set_property",
        standard()
            .flags("GLOBAL", "APPEND", "APPEND_STRING")
            .keyword("DIRECTORY", Arity.ZERO_OR_ONE)
            .keyword("TARGET", ANY)
            .keyword("SOURCE", ANY)
            .keyword("INSTALL", ANY)
            .keyword("TEST", ANY)
            .keyword("CACHE", ANY)
            .keyword("PROPERTY", SOME)
            .required("PROPERTY", LintRecord.MISSING_REQUIRED_KEYWORD)
            .build());
  }

  // The artifact kinds of install(TARGETS) are flags: the options that follow one apply to it, but
  // the same options are also legal directly after the target names, so they all sit at one level.
  private static void addInstall(CommandRegistry.Builder registry) {
    ArgGrammar targets =
        standard()
            .sortable(true)
            .flags(
                "ARCHIVE",
                "LIBRARY",
                "RUNTIME",
                "OBJECTS",
                "FRAMEWORK",
                "BUNDLE",
                "PRIVATE_HEADER",
                "PUBLIC_HEADER",
                "RESOURCE",
                "INCLUDES",
                "OPTIONAL",
                "EXCLUDE_FROM_ALL",
                "NAMELINK_ONLY",
                "NAMELINK_SKIP")
            .keyword("EXPORT", ONE)
            .keyword("FILE_SET", ONE)
            .keyword("DESTINATION", ONE)
            .keyword("PERMISSIONS", ANY)
            .keyword("CONFIGURATIONS", ANY)
            .keyword("COMPONENT", ONE)
            .keyword("NAMELINK_COMPONENT", ONE)
            .build();

    ArgGrammar files =
        standard()
            .sortable(true)
            .flags("OPTIONAL", "EXCLUDE_FROM_ALL")
            .keyword("DESTINATION", ONE)
            .keyword("TYPE", ONE)
            .keyword("PERMISSIONS", ANY)
            .keyword("CONFIGURATIONS", ANY)
            .keyword("COMPONENT", ONE)
            .keyword("RENAME", ONE)
            .build();

    ArgGrammar directory =
        files.toBuilder()
            .sortable(false)
            .flags("USE_SOURCE_PERMISSIONS", "MESSAGE_NEVER", "FILES_MATCHING", "EXCLUDE")
            .keyword("FILE_PERMISSIONS", ANY)
            .keyword("DIRECTORY_PERMISSIONS", ANY)
            .keyword("PATTERN", ANY)
            .keyword("REGEX", ANY)
            .build();

    ArgGrammar export =
        standard()
            .flags("EXPORT_LINK_INTERFACE_LIBRARIES", "EXCLUDE_FROM_ALL")
            .keyword("DESTINATION", ONE)
            .keyword("NAMESPACE", ONE)
            .keyword("FILE", ONE)
            .keyword("PERMISSIONS", ANY)
            .keyword("CONFIGURATIONS", ANY)
            .keyword("COMPONENT", ONE)
            .build();

    registry.add(
        "install",
        standard()
            .keyword("TARGETS", targets)
            .keyword("FILES", files)
            .keyword("PROGRAMS", files)
            .keyword("DIRECTORY", directory)
            .keyword("SCRIPT", ONE)
            .keyword("CODE", ONE)
            .keyword("EXPORT", export)
            .build());
  }
}
