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

/**
 * A named constraint over the arguments registered while it was active. At most one member of an
 * exclusive group may be assigned; at least one member of a required group must be.
 *
 * <p>The group does not own its members; each {@link ArgumentDefinition} refers to at most one
 * group. Whether a group is exclusive is fixed when it is created.
 */
public final class ArgumentGroup {
  private final String name;
  private final boolean exclusive;
  private boolean required = false;
  private String title = "";
  private String description = "";

  ArgumentGroup(String name, boolean exclusive) {
    this.name = name;
    this.exclusive = exclusive;
  }

  /** The lowercase name of the group. Group names are case-insensitive. */
  public String getName() {
    return name;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  public boolean isRequired() {
    return required;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  void setRequired(boolean required) {
    this.required = required;
  }

  void setTitle(String title) {
    this.title = title;
  }

  void setDescription(String description) {
    this.description = description;
  }

  @Override
  public String toString() {
    return (exclusive ? "exclusive group " : "group ") + name;
  }
}
