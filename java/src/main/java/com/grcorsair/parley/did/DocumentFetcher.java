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

package com.grcorsair.parley.did;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/** Fetches identity documents. Implementations must give up once {@code timeout} elapses. */
public interface DocumentFetcher {
  /**
   * Performs a single GET request.
   *
   * @throws java.net.http.HttpTimeoutException if the request did not complete within
   *     {@code timeout}
   * @throws IOException on any other network failure
   */
  FetchResponse fetch(URI url, Duration timeout) throws IOException, InterruptedException;
}
