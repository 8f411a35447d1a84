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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Paths;
import java.util.List;
import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import net.cmakeformat.java.commands.CommandRegistry;
import net.cmakeformat.java.config.ConfigException;
import net.cmakeformat.java.config.ConfigLoader;
import net.cmakeformat.java.config.Configuration;
import net.cmakeformat.java.config.WarningSink;
import net.cmakeformat.java.lint.LintCollector;
import net.cmakeformat.java.lint.LintRecord;
import net.cmakeformat.java.lint.RequiredKeywordLinter;
import net.cmakeformat.java.lint.TeeLintSink;
import net.cmakeformat.java.syntax.LintSink;
import net.cmakeformat.java.syntax.ListFile;
import net.cmakeformat.java.syntax.ParserInput;
import net.cmakeformat.java.syntax.SyntaxError;
import net.cmakeformat.java.syntax.TreeDumper;

/**
 * Main is a command-line tool that parses listfiles and prints their tokens, their syntax tree, or
 * the lint records found in them.
 *
 * <pre>
 * usage: cmake-parse [--dump tokens|parse|lint] [--lint] [--config-file FILE] [--dump-config]
 *                    [FILE | -]...
 * </pre>
 *
 * Exits with 0 on success, 1 if any file has a syntax error, and 2 on a usage, configuration or
 * I/O error.
 */
public final class Main {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  static final int EXIT_SYNTAX_ERROR = 1;
  static final int EXIT_USAGE = 2;

  private static final ImmutableList<String> DUMP_MODES =
      ImmutableList.of("tokens", "parse", "lint");

  private final InputStream stdin;
  private final PrintStream out;
  private final PrintStream err;

  private Main(InputStream stdin, PrintStream out, PrintStream err) {
    this.stdin = stdin;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /** Runs the tool with the given arguments and streams, and returns the exit code. */
  static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
    return new Main(stdin, out, err).run(args);
  }

  private int run(String[] args) {
    OptionParser parser = new OptionParser();
    OptionSpec<String> dumpOption =
        parser
            .accepts("dump", "what to print: tokens, parse or lint")
            .withRequiredArg()
            .ofType(String.class)
            .defaultsTo("parse");
    OptionSpec<Void> lintOption = parser.accepts("lint", "same as --dump lint");
    OptionSpec<String> configOption =
        parser
            .accepts("config-file", "JSON configuration file")
            .withRequiredArg()
            .ofType(String.class);
    OptionSpec<Void> dumpConfigOption =
        parser.accepts("dump-config", "print the effective configuration as JSON and exit");
    OptionSpec<Void> helpOption = parser.accepts("help", "print this message").forHelp();
    NonOptionArgumentSpec<String> filesOption =
        parser.nonOptions("listfiles to read, or - for standard input");

    OptionSet options;
    try {
      options = parser.parse(args);
    } catch (OptionException ex) {
      err.println("cmake-parse: " + ex.getMessage());
      return EXIT_USAGE;
    }
    if (options.has(helpOption)) {
      try {
        parser.printHelpOn(out);
      } catch (IOException ex) {
        err.println("cmake-parse: " + ex.getMessage());
        return EXIT_USAGE;
      }
      return EXIT_OK;
    }

    String mode = options.has(lintOption) ? "lint" : options.valueOf(dumpOption);
    if (!DUMP_MODES.contains(mode)) {
      err.format("cmake-parse: --dump must be one of %s, got '%s'%n", DUMP_MODES, mode);
      return EXIT_USAGE;
    }

    Configuration config;
    try {
      config = loadConfig(options.valueOf(configOption));
    } catch (IOException | ConfigException ex) {
      err.println("cmake-parse: " + ex.getMessage());
      return EXIT_USAGE;
    }
    if (options.has(dumpConfigOption)) {
      out.println(ConfigLoader.toJson(config));
      return EXIT_OK;
    }

    Charset encoding;
    try {
      encoding = Charset.forName(config.inputEncoding());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      err.println("cmake-parse: unsupported input_encoding '" + config.inputEncoding() + "'");
      return EXIT_USAGE;
    }

    List<String> files = options.valuesOf(filesOption);
    if (files.isEmpty()) {
      err.println("cmake-parse: no input files (use - for standard input)");
      return EXIT_USAGE;
    }

    CommandRegistry registry = config.commandRegistry();
    int exit = EXIT_OK;
    for (String file : files) {
      if (files.size() > 1) {
        out.println("# " + file);
      }
      exit = Math.max(exit, process(file, encoding, mode, registry));
    }
    return exit;
  }

  private Configuration loadConfig(String path) throws IOException {
    if (path == null) {
      return Configuration.DEFAULT;
    }
    WarningSink warnings = message -> logger.atWarning().log("%s: %s", path, message);
    return ConfigLoader.loadFile(Paths.get(path), warnings);
  }

  private int process(String file, Charset encoding, String mode, CommandRegistry registry) {
    ParserInput input;
    try {
      if (file.equals("-")) {
        String content = new String(ByteStreams.toByteArray(stdin), encoding);
        input = ParserInput.fromString(content, "<stdin>");
      } else {
        input = ParserInput.readFile(Paths.get(file), encoding);
      }
    } catch (IOException ex) {
      err.format("Error reading %s: %s%n", file, ex);
      return EXIT_USAGE;
    }

    ListFile listFile;
    try {
      listFile = ListFile.parse(input, registry);
    } catch (SyntaxError.Exception ex) {
      for (SyntaxError error : ex.errors()) {
        err.println(error);
      }
      return EXIT_SYNTAX_ERROR;
    }

    switch (mode) {
      case "tokens":
        out.print(TreeDumper.dumpTokens(listFile.getTokens()));
        break;
      case "lint":
        LintCollector lint = new LintCollector();
        LintSink logged =
            (lintId, payload, location) ->
                logger.atFine().log("%s: lint %s %s", location, lintId, payload);
        RequiredKeywordLinter.check(listFile, registry, new TeeLintSink(lint, logged));
        for (LintRecord record : lint.getRecords()) {
          out.println(record);
        }
        break;
      default:
        out.print(TreeDumper.dump(listFile.getBody()));
        break;
    }
    return EXIT_OK;
  }
}
