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

import com.google.common.base.Preconditions;
import java.util.function.Supplier;

/**
 * A sub-command. Its arguments are registered lazily: only when the command's name is found on the
 * command line does the factory create the {@link CommandOptions} that register them on a fresh
 * parser.
 */
public final class Command {
  private final String name;
  private final Supplier<? extends CommandOptions> factory;
  private String help = "";

  Command(String name, Supplier<? extends CommandOptions> factory) {
    this.name = name;
    this.factory = factory;
  }

  public String getName() {
    return name;
  }

  public String getHelp() {
    return help;
  }

  void setHelp(String help) {
    this.help = help;
  }

  CommandOptions createOptions() {
    return Preconditions.checkNotNull(
        factory.get(), "The factory of command %s returned null", name);
  }
}
