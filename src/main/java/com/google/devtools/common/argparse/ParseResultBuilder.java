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
package com.google.devtools.common.argparse;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the problems of one parse, including those of nested command parsers, and produces the
 * immutable {@link ParseResult}.
 */
final class ParseResultBuilder {
  private final List<ParseError> errors = new ArrayList<>();
  private final List<String> ignoredArguments = new ArrayList<>();
  private final List<CommandOptions> commands = new ArrayList<>();
  private boolean helpWasShown = false;
  private boolean exitRequested = false;
  private boolean errorsWereShown = false;

  void addError(String name, ErrorKind kind) {
    errors.add(ParseError.create(name, kind));
  }

  void addError(String name, ErrorKind kind, String message) {
    errors.add(ParseError.create(name, kind, message));
  }

  void addIgnored(String argument) {
    ignoredArguments.add(argument);
  }

  void addCommand(CommandOptions command) {
    commands.add(command);
  }

  void signalHelpShown() {
    helpWasShown = true;
  }

  /** Records the exit request; the {@code EXIT_REQUESTED} entry is added only once. */
  void requestExit() {
    if (!exitRequested) {
      exitRequested = true;
      errors.add(ParseError.create("", ErrorKind.EXIT_REQUESTED));
    }
  }

  void signalErrorsShown() {
    errorsWereShown = true;
  }

  boolean wasExitRequested() {
    return exitRequested;
  }

  /** True if anything other than an intentional exit should be reported to the user. */
  boolean hasArgumentProblems() {
    if (!ignoredArguments.isEmpty()) {
      return true;
    }
    for (ParseError error : errors) {
      if (error.kind() != ErrorKind.EXIT_REQUESTED) {
        return true;
      }
    }
    return false;
  }

  ParseResult build() {
    return new ParseResult(
        ImmutableList.copyOf(errors),
        ImmutableList.copyOf(ignoredArguments),
        ImmutableList.copyOf(commands),
        helpWasShown,
        exitRequested,
        errorsWereShown);
  }
}
