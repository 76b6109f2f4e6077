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
import com.google.common.collect.ImmutableList;
import com.google.devtools.common.argparse.ArgumentParser.ConstructionException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Configures an argument returned by {@link ArgumentParser#addArgument}.
 *
 * <pre>
 * parser.addArgument(depth, "--depth", "-d").nargs(1).absent("3").help("How deep to go.");
 * </pre>
 *
 * @param <V> the type of the value the argument assigns to
 */
public final class ArgumentConfig<V extends Value> {
  private final ArgumentDefinition definition;
  private final V value;

  ArgumentConfig(ArgumentDefinition definition, V value) {
    this.definition = definition;
    this.value = value;
  }

  /** The argument takes exactly {@code count} tokens each time it is used. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> nargs(int count) {
    Preconditions.checkArgument(count >= 0, "nargs must not be negative: %s", count);
    checkPositionalArity(count, count);
    definition.setNArgs(count);
    syncPositionalRequired();
    return this;
  }

  /** The argument takes at least {@code count} tokens, with no upper bound. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> minargs(int count) {
    Preconditions.checkArgument(count >= 0, "minargs must not be negative: %s", count);
    checkPositionalArity(count, ArgumentDefinition.UNBOUNDED);
    definition.setMinArgs(count);
    syncPositionalRequired();
    return this;
  }

  /** The argument takes at most {@code count} tokens. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> maxargs(int count) {
    Preconditions.checkArgument(count >= 0, "maxargs must not be negative: %s", count);
    checkPositionalArity(Math.min(definition.getMinArgs(), count), count);
    definition.setMaxArgs(count);
    syncPositionalRequired();
    return this;
  }

  /**
   * A required option that is not used reports {@code MISSING_OPTION}. For a positional argument
   * this sets the minimum arity to one (required) or zero (optional).
   */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> required(boolean required) {
    if (definition.isPositional()) {
      if (required && definition.getMinArgs() == 0) {
        int maxArgs = definition.getMaxArgs();
        definition.setMinArgs(1);
        definition.setMaxArgs(maxArgs);
      } else if (!required) {
        int maxArgs = definition.getMaxArgs();
        definition.setMinArgs(0);
        definition.setMaxArgs(maxArgs);
      }
    }
    definition.setRequired(required);
    return this;
  }

  @CanIgnoreReturnValue
  public ArgumentConfig<V> help(String help) {
    definition.setHelp(Preconditions.checkNotNull(help));
    return this;
  }

  /** The placeholder for the argument's tokens in help output. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> metavar(String metavar) {
    definition.setMetavar(Preconditions.checkNotNull(metavar));
    return this;
  }

  /**
   * The value to assign when the argument does not appear on the command line, as a token that is
   * converted like a command line token.
   */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> absent(String defaultToken) {
    Preconditions.checkNotNull(defaultToken);
    if (!(value instanceof ConvertedValue)) {
      throw new ConstructionException(
          "A default token needs a converted value: " + definition.getHelpName());
    }
    ConvertedValue<?> converted = (ConvertedValue<?>) value;
    definition.setDefaultAction(target -> converted.assignDefaultToken(defaultToken));
    return this;
  }

  /** The action that assigns the default when the argument does not appear. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> absent(AssignDefaultAction<? super V> defaultAction) {
    Preconditions.checkNotNull(defaultAction);
    definition.setDefaultAction(target -> defaultAction.assignDefault(value));
    return this;
  }

  /** Replaces the conversion of tokens with {@code action}. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> action(AssignAction<? super V> action) {
    Preconditions.checkNotNull(action);
    definition.setAssignAction((target, token, env) -> action.assign(value, token, env));
    return this;
  }

  /** Restricts the accepted tokens; others report {@code INVALID_CHOICE}. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> choices(String... choices) {
    definition.setChoices(ImmutableList.copyOf(choices));
    return this;
  }

  /** The token a flag assigns when it appears. Defaults to {@code "1"}. */
  @CanIgnoreReturnValue
  public ArgumentConfig<V> flagValue(String flagValue) {
    definition.setFlagValue(Preconditions.checkNotNull(flagValue));
    return this;
  }

  public ArgumentDefinition getDefinition() {
    return definition;
  }

  private void checkPositionalArity(int minArgs, int maxArgs) {
    if (definition.isPositional() && !value.isSequence() && (minArgs > 1 || maxArgs != 1)) {
      throw new ConstructionException(
          "A positional argument with a single value takes exactly one token: "
              + definition.getHelpName());
    }
  }

  private void syncPositionalRequired() {
    if (definition.isPositional()) {
      definition.setRequired(definition.getMinArgs() > 0);
    }
  }
}
