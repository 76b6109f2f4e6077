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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The arguments and commands registered with one {@link ArgumentParser}, in registration order.
 * Options are also indexed by each of their names.
 */
final class ParserDefinition {
  final List<ArgumentDefinition> options = new ArrayList<>();
  final List<ArgumentDefinition> positionals = new ArrayList<>();
  final List<Command> commands = new ArrayList<>();
  private final Map<String, ArgumentDefinition> optionsByName = new HashMap<>();

  void addOption(ArgumentDefinition option) {
    options.add(option);
    if (!option.getLongName().isEmpty()) {
      optionsByName.put(option.getLongName(), option);
    }
    if (!option.getShortName().isEmpty()) {
      optionsByName.put(option.getShortName(), option);
    }
  }

  void addPositional(ArgumentDefinition positional) {
    positionals.add(positional);
  }

  void addCommand(Command command) {
    commands.add(command);
  }

  @Nullable
  ArgumentDefinition findOption(String name) {
    return optionsByName.get(name);
  }

  @Nullable
  Command findCommand(String name) {
    for (Command command : commands) {
      if (command.getName().equals(name)) {
        return command;
      }
    }
    return null;
  }

  /** All arguments, options first. */
  List<ArgumentDefinition> allArguments() {
    List<ArgumentDefinition> all = new ArrayList<>(options.size() + positionals.size());
    all.addAll(options);
    all.addAll(positionals);
    return all;
  }
}
