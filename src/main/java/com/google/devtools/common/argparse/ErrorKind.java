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

/** The kinds of problems that {@link ArgumentParser#parse} records in a {@link ParseResult}. */
public enum ErrorKind {
  UNKNOWN_OPTION("Unknown option"),
  EXCLUSIVE_VIOLATION("Only one option from an exclusive group can be set"),
  MISSING_OPTION("A required option is missing"),
  MISSING_OPTION_GROUP("A required option from a group is missing"),
  MISSING_ARGUMENT("An argument is missing"),
  CONVERSION_ERROR("The argument could not be converted"),
  INVALID_CHOICE("The value is not in the list of valid values"),
  FLAG_TAKES_NO_PARAMETER("Flag options do not accept parameters"),
  /** Scanning was stopped on purpose, by a help option or by an assign action. */
  EXIT_REQUESTED(""),
  /** An assign action reported a problem through {@link Environment#addError}. */
  ACTION_ERROR(""),
  /** The token list itself was unusable, e.g. null. */
  INVALID_INPUT("Parser input is invalid");

  private final String description;

  ErrorKind(String description) {
    this.description = description;
  }

  /** A short English description used when errors are written to the output stream. */
  public String getDescription() {
    return description;
  }
}
