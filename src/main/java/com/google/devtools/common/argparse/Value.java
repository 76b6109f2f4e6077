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
import javax.annotation.Nullable;

/**
 * A target that receives the values of one or more arguments.
 *
 * <p>The caller owns the value object and reads the parsed value from it after {@link
 * ArgumentParser#parse}. Registering the same instance under several arguments makes them aliases:
 * they write the same variable and share the assignment count, so {@code -v} and {@code --verbose}
 * registered separately count together. The object identity of the value is its target identity.
 *
 * <p>Every parse resets the value first, so a value only ever reflects the most recent parse.
 */
public abstract class Value {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private int assignCount = 0;
  private boolean hasErrors = false;

  /**
   * The number of assignments in the current parse, through all the arguments that share this
   * value.
   */
  public int getAssignCount() {
    return assignCount;
  }

  /**
   * The identity of the bound variable. Arguments registered with the same value instance report
   * the same target and share the assignment count.
   */
  public final Object getTargetId() {
    return this;
  }

  /** Whether a token assigned in the current parse could not be converted. */
  public boolean hasErrors() {
    return hasErrors;
  }

  /**
   * Assigns {@code token} with {@code action}, or with {@link #assign} if there is no action.
   * Conversion problems are recorded in {@code env} and do not propagate.
   *
   * @return false if the token could not be assigned
   */
  final boolean setValue(String token, @Nullable AssignAction<Value> action, Environment env) {
    ++assignCount;
    try {
      if (action != null) {
        action.assign(this, token, env);
      } else {
        assign(token, env);
      }
      return true;
    } catch (ArgumentParsingException | IllegalArgumentException e) {
      // IllegalArgumentException covers NumberFormatException from user converters and actions.
      logger.atFine().withCause(e).log(
          "Could not assign '%s' to %s", token, env.getArgumentName());
      markBadArgument();
      env.addConversionError(e.getMessage());
      return false;
    }
  }

  /** Applies the default of an argument that did not appear on the command line. */
  final void setDefault(AssignDefaultAction<Value> action, Environment env) {
    try {
      action.assignDefault(this);
    } catch (ArgumentParsingException | IllegalArgumentException e) {
      logger.atFine().withCause(e).log("Could not assign default to %s", env.getArgumentName());
      markBadArgument();
      env.addConversionError(e.getMessage());
    }
  }

  final void markBadArgument() {
    hasErrors = true;
  }

  /** Clears the assignment count and the error flag and restores the empty value. */
  final void reset() {
    assignCount = 0;
    hasErrors = false;
    doReset();
  }

  /** Whether the target collects any number of values. Positional sequences take (0, ∞) args. */
  boolean isSequence() {
    return false;
  }

  /** Describes the expected token in help output; empty if nothing is known. */
  String getTypeDescription() {
    return "";
  }

  /** Restores the empty value of the target. */
  protected abstract void doReset();

  /** Converts {@code token} and stores the result in the target. */
  protected abstract void assign(String token, Environment env) throws ArgumentParsingException;
}
