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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Everything the {@link ArgumentParser} needs to know about one option or positional argument:
 * its names, its arity, whether it is required, its group, and the value it assigns to.
 *
 * <p>Besides the static description a definition carries the number of tokens it consumed in the
 * current parse. For an option the count restarts every time the option appears on the command
 * line; for a positional it covers the whole parse.
 */
public final class ArgumentDefinition {
  /** The {@link #getMaxArgs() maximum arity} of arguments that take any number of tokens. */
  public static final int UNBOUNDED = -1;

  private static final CharMatcher DASHES = CharMatcher.is('-');

  private final Value value;
  private final boolean positional;
  private String longName = "";
  private String shortName = "";
  private String metavar = "";
  private String help = "";
  private int minArgs = 0;
  private int maxArgs = 0;
  private boolean required = false;
  private String flagValue = "1";
  private ImmutableList<String> choices = ImmutableList.of();
  @Nullable private AssignAction<Value> assignAction;
  @Nullable private AssignDefaultAction<Value> defaultAction;
  @Nullable private ArgumentGroup group;

  private int argumentCount = 0;
  private int assignmentOrder = Integer.MAX_VALUE;

  ArgumentDefinition(Value value, boolean positional) {
    this.value = value;
    this.positional = positional;
  }

  public boolean isPositional() {
    return positional;
  }

  /** The long name of an option including the dashes, or the name of a positional argument. */
  public String getLongName() {
    return longName;
  }

  /** The short name of an option including the dash, or empty. */
  public String getShortName() {
    return shortName;
  }

  /** The long name if there is one, otherwise the short name. */
  public String getName() {
    return longName.isEmpty() ? shortName : longName;
  }

  /** The name used in error reports and help output. */
  public String getHelpName() {
    return getName();
  }

  public boolean hasName(String name) {
    return !name.isEmpty() && (name.equals(longName) || name.equals(shortName));
  }

  /**
   * The placeholder for the argument's tokens in help output. Derived from the name unless one was
   * configured: {@code --max-depth} becomes {@code MAX_DEPTH}.
   */
  public String getMetavar() {
    if (!metavar.isEmpty()) {
      return metavar;
    }
    if (positional) {
      return longName;
    }
    return Ascii.toUpperCase(DASHES.trimLeadingFrom(getName()).replace('-', '_'));
  }

  public String getRawHelp() {
    return help;
  }

  public int getMinArgs() {
    return minArgs;
  }

  /** The maximum number of tokens, or {@link #UNBOUNDED}. */
  public int getMaxArgs() {
    return maxArgs;
  }

  public boolean isRequired() {
    return required;
  }

  public String getFlagValue() {
    return flagValue;
  }

  public ImmutableList<String> getChoices() {
    return choices;
  }

  @Nullable
  public ArgumentGroup getGroup() {
    return group;
  }

  public boolean hasDefault() {
    return defaultAction != null;
  }

  Value getValue() {
    return value;
  }

  void setLongName(String longName) {
    this.longName = longName;
  }

  void setShortName(String shortName) {
    this.shortName = shortName;
  }

  void setMetavar(String metavar) {
    this.metavar = metavar;
  }

  void setHelp(String help) {
    this.help = help;
  }

  void setNArgs(int count) {
    minArgs = count;
    maxArgs = count;
  }

  /** Requires at least {@code count} tokens and lifts the upper bound. */
  void setMinArgs(int count) {
    minArgs = count;
    maxArgs = UNBOUNDED;
  }

  void setMaxArgs(int count) {
    maxArgs = count;
    if (count != UNBOUNDED && minArgs > count) {
      minArgs = count;
    }
  }

  void setRequired(boolean required) {
    this.required = required;
  }

  void setFlagValue(String flagValue) {
    this.flagValue = flagValue;
  }

  void setChoices(ImmutableList<String> choices) {
    this.choices = choices;
  }

  void setAssignAction(@Nullable AssignAction<Value> assignAction) {
    this.assignAction = assignAction;
  }

  void setDefaultAction(@Nullable AssignDefaultAction<Value> defaultAction) {
    this.defaultAction = defaultAction;
  }

  void setGroup(@Nullable ArgumentGroup group) {
    this.group = group;
  }

  /** Whether the argument takes tokens at all; a flag takes none. */
  public boolean acceptsAnyArguments() {
    return maxArgs != 0;
  }

  /** Whether the argument can take another token in the current activation. */
  boolean willAcceptArgument() {
    return maxArgs == UNBOUNDED || argumentCount < maxArgs;
  }

  /** Whether fewer tokens than the minimum arity were consumed in the current activation. */
  boolean needsMoreArguments() {
    return argumentCount < minArgs;
  }

  int getArgumentCount() {
    return argumentCount;
  }

  /** Whether the value was assigned in this parse, through this argument or one of its aliases. */
  public boolean wasAssigned() {
    return value.getAssignCount() > 0;
  }

  /**
   * The position of this argument in the order of first assignments of the current parse, or
   * {@code Integer.MAX_VALUE} if it was not assigned through its own names.
   */
  int getAssignmentOrder() {
    return assignmentOrder;
  }

  /** Starts a new activation of an option. */
  void onOptionStarted() {
    argumentCount = 0;
  }

  void resetValue() {
    value.reset();
    argumentCount = 0;
    assignmentOrder = Integer.MAX_VALUE;
  }

  /** Assigns one token; {@code order} is the parse-wide sequence number of this assignment. */
  boolean setValue(String token, Environment env, int order) {
    ++argumentCount;
    if (assignmentOrder == Integer.MAX_VALUE) {
      assignmentOrder = order;
    }
    return value.setValue(token, assignAction, env);
  }

  /** Counts a token that was consumed but rejected before assignment. */
  void skipArgument() {
    ++argumentCount;
  }

  /** Assigns the flag value; used when an option appears without tokens. */
  boolean assignFlagValue(Environment env, int order) {
    if (assignmentOrder == Integer.MAX_VALUE) {
      assignmentOrder = order;
    }
    return value.setValue(flagValue, assignAction, env);
  }

  void assignDefault(Environment env) {
    if (defaultAction != null) {
      value.setDefault(defaultAction, env);
    }
  }

  @Override
  public String toString() {
    return (positional ? "positional " : "option ") + getHelpName();
  }
}
