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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/**
 * Everything a {@link HelpFormatter} needs to render one argument or command. The parser never
 * formats help itself beyond the usage fragment in {@link #arguments()}.
 */
@AutoValue
public abstract class ArgumentDescription {

  /** The name used in error reports, e.g. {@code --depth} or {@code FILE}. */
  public abstract String helpName();

  public abstract String shortName();

  public abstract String longName();

  public abstract String metavar();

  /**
   * The tokens the argument takes, rendered with its metavar: {@code X}, {@code X X}, {@code [X]},
   * {@code [X ...]} or {@code X [X {0..3}]}. Empty for flags and commands.
   */
  public abstract String arguments();

  /** The raw help text. */
  public abstract String help();

  public abstract boolean isRequired();

  public abstract boolean isCommand();

  @Nullable
  public abstract GroupDescription group();

  static Builder builder() {
    return new AutoValue_ArgumentDescription.Builder()
        .setShortName("")
        .setLongName("")
        .setMetavar("")
        .setArguments("")
        .setHelp("")
        .setIsRequired(false)
        .setIsCommand(false);
  }

  /** Builder for {@link ArgumentDescription}. */
  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setHelpName(String helpName);

    abstract Builder setShortName(String shortName);

    abstract Builder setLongName(String longName);

    abstract Builder setMetavar(String metavar);

    abstract Builder setArguments(String arguments);

    abstract Builder setHelp(String help);

    abstract Builder setIsRequired(boolean isRequired);

    abstract Builder setIsCommand(boolean isCommand);

    abstract Builder setGroup(@Nullable GroupDescription group);

    abstract ArgumentDescription build();
  }
}
