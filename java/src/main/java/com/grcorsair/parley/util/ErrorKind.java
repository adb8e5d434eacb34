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

package com.grcorsair.parley.util;

/** Classifies why an attestation or log operation failed. */
public enum ErrorKind {
  /** Bad token shape, bad JSON or an identifier that cannot be parsed. Never retried. */
  MALFORMED_INPUT(false),
  /** The issuer's identity document could not be fetched. */
  UNREACHABLE_IDENTITY(true),
  /** The identity document was fetched but does not contain the requested key. */
  KEY_NOT_FOUND(false),
  INVALID_SIGNATURE(false),
  EXPIRED(false),
  /** A receipt, entry or keypair does not exist. */
  NOT_FOUND(false),
  /** A concurrent append claimed the same tree position. */
  WRITE_CONFLICT(true),
  /** The caller's deadline passed before the operation could complete. */
  DEADLINE_EXCEEDED(true);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
