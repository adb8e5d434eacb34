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
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** {@link DocumentFetcher} over HTTPS. Redirects are not followed. */
public class HttpDocumentFetcher implements DocumentFetcher {
  /** Documents larger than this are rejected. */
  static final int MAX_DOCUMENT_CHARS = 256 * 1024;

  private final HttpClient httpClient;

  public HttpDocumentFetcher(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  public HttpDocumentFetcher(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public FetchResponse fetch(URI url, Duration timeout) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(url)
        .timeout(timeout)
        .header("Accept", "application/did+json, application/json")
        .GET()
        .build();

    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    HttpResponse<String> response;
    try {
      response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new HttpTimeoutException("request to " + url + " timed out after " + timeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new IOException("request to " + url + " failed", cause);
    }

    String body = response.body();
    if (body != null && body.length() > MAX_DOCUMENT_CHARS) {
      throw new IOException("document at " + url + " exceeds " + MAX_DOCUMENT_CHARS + " characters");
    }
    return new FetchResponse(response.statusCode(), body);
  }
}
