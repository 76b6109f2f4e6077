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
 * One problem found while parsing. The name is the help name of the argument or group involved,
 * the offending token for unknown options, or empty when the problem is not tied to an argument.
 */
@AutoValue
public abstract class ParseError {

  static ParseError create(String name, ErrorKind kind) {
    return create(name, kind, "");
  }

  static ParseError create(String name, ErrorKind kind, String message) {
    return new AutoValue_ParseError(name, kind, message);
  }

  public abstract String name();

  public abstract ErrorKind kind();

  /** Additional detail, e.g. the converter's message. Empty if there is none. */
  public abstract String message();

  /** Returns the line written to the output stream for this error, or null for exit requests. */
  @Nullable
  public String describe() {
    switch (kind()) {
      case EXIT_REQUESTED:
        return null;
      case ACTION_ERROR:
        return name().isEmpty()
            ? "Error: " + message()
            : "Error: " + name() + ": " + message();
      case INVALID_INPUT:
        return "Error: " + kind().getDescription() + ".";
      default:
        String line = "Error: " + kind().getDescription() + ": '" + name() + "'";
        return message().isEmpty() ? line : line + " (" + message() + ")";
    }
  }
}
