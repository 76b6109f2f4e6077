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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * The outcome of one {@link ArgumentParser#parse} call. Parsed values are not part of the result;
 * they are stored in the value targets that were registered with the parser.
 */
public final class ParseResult {
  private final ImmutableList<ParseError> errors;
  private final ImmutableList<String> ignoredArguments;
  private final ImmutableList<CommandOptions> commands;
  private final boolean helpWasShown;
  private final boolean exitRequested;
  private final boolean errorsWereShown;

  ParseResult(
      ImmutableList<ParseError> errors,
      ImmutableList<String> ignoredArguments,
      ImmutableList<CommandOptions> commands,
      boolean helpWasShown,
      boolean exitRequested,
      boolean errorsWereShown) {
    this.errors = errors;
    this.ignoredArguments = ignoredArguments;
    this.commands = commands;
    this.helpWasShown = helpWasShown;
    this.exitRequested = exitRequested;
    this.errorsWereShown = errorsWereShown;
  }

  /** True iff no errors were recorded and no tokens were left over. */
  public boolean isSuccess() {
    return errors.isEmpty() && ignoredArguments.isEmpty();
  }

  /** The problems in the order they were found. */
  public ImmutableList<ParseError> getErrors() {
    return errors;
  }

  /** Free tokens that no positional argument or command consumed. */
  public ImmutableList<String> getIgnoredArguments() {
    return ignoredArguments;
  }

  /**
   * The options objects of the commands that were selected, outermost first. Their value targets
   * hold the values parsed for the command.
   */
  public ImmutableList<CommandOptions> getCommands() {
    return commands;
  }

  public boolean helpWasShown() {
    return helpWasShown;
  }

  /**
   * Whether parsing stopped on purpose. Callers must not act on the parsed values when this is
   * set.
   */
  public boolean exitRequested() {
    return exitRequested;
  }

  /** Whether the problems were already written to the parser's output stream. */
  public boolean errorsWereShown() {
    return errorsWereShown;
  }

  /** Returns the problems as one line each, in the form written to the output stream. */
  public String describeErrors() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (ParseError error : errors) {
      String line = error.describe();
      if (line != null) {
        lines.add(line);
      }
    }
    if (!ignoredArguments.isEmpty()) {
      lines.add("Error: Ignored arguments: " + Joiner.on(", ").join(ignoredArguments));
    }
    return Joiner.on('\n').join(lines.build());
  }

  @Override
  public String toString() {
    return "ParseResult{success=" + isSuccess() + ", errors=" + errors + ", ignored="
        + ignoredArguments + "}";
  }
}
