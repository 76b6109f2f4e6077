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
 * A value that stores nothing. Only the assignment count is tracked; help options and options
 * handled entirely by an {@link AssignAction} use it.
 */
public final class VoidValue extends Value {

  @Override
  protected void doReset() {}

  @Override
  protected void assign(String token, Environment env) {}
}
