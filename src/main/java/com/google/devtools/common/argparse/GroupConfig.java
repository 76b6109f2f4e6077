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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Configures the group returned by {@link ArgumentParser#addGroup}. */
public final class GroupConfig {
  private final ArgumentGroup group;

  GroupConfig(ArgumentGroup group) {
    this.group = group;
  }

  /** The heading of the group in the help output. */
  @CanIgnoreReturnValue
  public GroupConfig title(String title) {
    group.setTitle(Preconditions.checkNotNull(title));
    return this;
  }

  @CanIgnoreReturnValue
  public GroupConfig description(String description) {
    group.setDescription(Preconditions.checkNotNull(description));
    return this;
  }

  /** A required group reports {@code MISSING_OPTION_GROUP} if none of its members is assigned. */
  @CanIgnoreReturnValue
  public GroupConfig required(boolean required) {
    group.setRequired(required);
    return this;
  }

  public ArgumentGroup getGroup() {
    return group;
  }
}
