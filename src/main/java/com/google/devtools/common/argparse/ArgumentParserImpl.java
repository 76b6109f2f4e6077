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

import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The class that does the actual token matching for one parse. It is intentionally package
 * private, and a new instance is created for every parse.
 *
 * <p>The matcher is either idle or has an active option that is waiting for its arguments. A
 * token that names an option always starts that option, even while another one is active; the
 * only tokens that feed an active option are those that look like values. Free tokens that no
 * option consumes are distributed among the positional arguments when the scan ends, or when a
 * command name is found among them.
 */
final class ArgumentParserImpl {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ArgumentParser owner;
  private final ParserDefinition definition;
  private final ParseResultBuilder result;

  @Nullable private ArgumentDefinition activeOption = null;
  private final List<String> freeArguments = new ArrayList<>();
  private boolean ignoreOptions = false;
  private boolean stopped = false;
  private int assignmentCounter = 0;

  ArgumentParserImpl(ArgumentParser owner, ParseResultBuilder result) {
    this.owner = owner;
    this.definition = owner.getDefinition();
    this.result = result;
  }

  void parse(List<String> args) {
    for (int i = 0; i < args.size() && !stopped; ++i) {
      String arg = args.get(i);
      if (ignoreOptions) {
        addFreeArgument(arg, args, i);
      } else if (arg.equals("--")) {
        closeActiveOption();
        ignoreOptions = true;
      } else if (isNegativeNumber(arg)) {
        addFreeArgument(arg, args, i);
      } else if (arg.startsWith("--")) {
        parseLongOption(arg);
      } else if (arg.length() > 1 && arg.charAt(0) == '-') {
        parseShortOptions(arg);
      } else {
        addFreeArgument(arg, args, i);
      }
    }

    if (!stopped) {
      closeActiveOption();
      distributePositionals();
    }
  }

  /**
   * A token like {@code -5} is a value if the active option takes it or if no short option is
   * spelled like its first two characters.
   */
  private boolean isNegativeNumber(String arg) {
    if (arg.length() < 2 || arg.charAt(0) != '-' || !Character.isDigit(arg.charAt(1))) {
      return false;
    }
    if (activeOption != null && activeOption.willAcceptArgument()) {
      return true;
    }
    return definition.findOption(arg.substring(0, 2)) == null;
  }

  private void parseLongOption(String arg) {
    int equals = arg.indexOf('=');
    String name = equals < 0 ? arg : arg.substring(0, equals);
    ArgumentDefinition option = definition.findOption(name);
    if (option == null) {
      result.addError(name, ErrorKind.UNKNOWN_OPTION);
      return;
    }
    if (equals < 0) {
      beginOption(option);
      return;
    }
    if (!option.acceptsAnyArguments()) {
      closeActiveOption();
      result.addError(option.getHelpName(), ErrorKind.FLAG_TAKES_NO_PARAMETER);
      return;
    }
    if (beginOption(option)) {
      addOptionArgument(arg.substring(equals + 1));
    }
  }

  /** Handles {@code -x}, and clusters like {@code -abc} or {@code -n5} when no option matches. */
  private void parseShortOptions(String arg) {
    ArgumentDefinition option = definition.findOption(arg);
    if (option != null) {
      beginOption(option);
      return;
    }
    if (arg.length() == 2 || definition.findOption(arg.substring(0, 2)) == null) {
      result.addError(arg, ErrorKind.UNKNOWN_OPTION);
      return;
    }

    for (int i = 1; i < arg.length(); ++i) {
      String name = "-" + arg.charAt(i);
      ArgumentDefinition clustered = definition.findOption(name);
      if (clustered == null) {
        result.addError(name, ErrorKind.UNKNOWN_OPTION);
        continue;
      }
      if (!beginOption(clustered) || stopped) {
        return;
      }
      if (clustered.acceptsAnyArguments() && i + 1 < arg.length()) {
        String rest = arg.substring(i + 1);
        addOptionArgument(rest.startsWith("=") ? rest.substring(1) : rest);
        return;
      }
    }
  }

  /** Starts {@code option}; returns false if it was a help option and the scan stopped. */
  private boolean beginOption(ArgumentDefinition option) {
    if (owner.isHelpOption(option)) {
      owner.showHelp(result);
      stopped = true;
      return false;
    }
    startOption(option);
    return true;
  }

  private void startOption(ArgumentDefinition option) {
    closeActiveOption();
    option.onOptionStarted();
    if (option.acceptsAnyArguments()) {
      activeOption = option;
    } else {
      assignFlag(option);
    }
  }

  /** Returns to idle, reporting an active option that did not get enough arguments. */
  private void closeActiveOption() {
    if (activeOption == null) {
      return;
    }
    ArgumentDefinition option = activeOption;
    activeOption = null;
    if (option.needsMoreArguments()) {
      result.addError(option.getHelpName(), ErrorKind.MISSING_ARGUMENT);
    } else if (option.getArgumentCount() == 0 && !option.getValue().isSequence()) {
      assignFlag(option);
    }
  }

  private void addOptionArgument(String token) {
    ArgumentDefinition option = activeOption;
    if (option == null) {
      return;
    }
    assign(option, token);
    if (activeOption == option && !option.willAcceptArgument()) {
      activeOption = null;
    }
  }

  private void addFreeArgument(String arg, List<String> args, int index) {
    if (activeOption != null) {
      if (activeOption.willAcceptArgument()) {
        addOptionArgument(arg);
        return;
      }
      closeActiveOption();
    }

    if (!ignoreOptions) {
      Command command = definition.findCommand(arg);
      if (command != null) {
        distributePositionals();
        if (!stopped) {
          owner.runCommand(command, args.subList(index + 1, args.size()), result);
          stopped = true;
        }
        return;
      }
    }
    freeArguments.add(arg);
  }

  /**
   * Assigns the free tokens to the positional arguments in registration order. A positional that
   * has its minimum passes the next token on when the tokens left are needed for the minimums of
   * the positionals after it.
   */
  private void distributePositionals() {
    List<ArgumentDefinition> positionals = definition.positionals;
    int count = positionals.size();
    int[] reserved = new int[count + 1];
    for (int p = count - 1; p >= 0; --p) {
      ArgumentDefinition positional = positionals.get(p);
      reserved[p] =
          reserved[p + 1]
              + Math.max(0, positional.getMinArgs() - positional.getArgumentCount());
    }

    int position = 0;
    for (int j = 0; j < freeArguments.size() && !stopped; ++j) {
      String token = freeArguments.get(j);
      int remaining = freeArguments.size() - j;
      while (position < count) {
        ArgumentDefinition positional = positionals.get(position);
        if (!positional.willAcceptArgument()) {
          ++position;
        } else if (!positional.needsMoreArguments() && remaining <= reserved[position + 1]) {
          ++position;
        } else {
          break;
        }
      }
      if (position == count) {
        result.addIgnored(token);
      } else {
        assign(positionals.get(position), token);
      }
    }
    freeArguments.clear();
  }

  private void assignFlag(ArgumentDefinition option) {
    option.assignFlagValue(owner.newEnvironment(option, result), ++assignmentCounter);
    checkExitRequested(option);
  }

  private void assign(ArgumentDefinition argument, String token) {
    if (!argument.getChoices().isEmpty() && !argument.getChoices().contains(token)) {
      argument.skipArgument();
      result.addError(argument.getHelpName(), ErrorKind.INVALID_CHOICE, token);
      return;
    }
    argument.setValue(token, owner.newEnvironment(argument, result), ++assignmentCounter);
    checkExitRequested(argument);
  }

  private void checkExitRequested(ArgumentDefinition argument) {
    if (result.wasExitRequested() && !stopped) {
      logger.atFine().log("%s requested an exit; stopping the parser", argument.getHelpName());
      stopped = true;
      activeOption = null;
    }
  }
}
