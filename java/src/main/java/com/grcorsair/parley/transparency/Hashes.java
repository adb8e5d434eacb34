//
// Copyright 2026 The Parley Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.grcorsair.parley.transparency;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.Hashing;

/** Hex-encoded SHA-256, the digest every log hash is expressed in. */
final class Hashes {
  static String sha256Hex(String text) {
    return Hashing.sha256().hashString(text, UTF_8).toString();
  }

  static boolean isSha256Hex(String value) {
    return value != null && value.matches("[0-9a-f]{64}");
  }

  private Hashes() {}
}
