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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResultTest {
  private static final ParleyError NOT_FOUND = ParleyError.of(ErrorKind.NOT_FOUND, "no entry %s", "e1");

  @Test
  public void testFailureCarriesKindAndFormattedReason() {
    Result<String, ParleyError> result = ParleyError.failure(ErrorKind.EXPIRED, "at %d", 42);
    assertTrue(result.isError());
    assertEquals(ErrorKind.EXPIRED, result.error().get().getKind());
    assertEquals("at 42", result.error().get().getReason());
    assertTrue(result.success().isEmpty());
  }

  @Test
  public void testReasonWithoutArgumentsIsNotFormatted() {
    assertEquals("100% broken", ParleyError.of(ErrorKind.MALFORMED_INPUT, "100% broken").getReason());
  }

  @Test
  public void testRetryableKinds() {
    assertTrue(ErrorKind.UNREACHABLE_IDENTITY.isRetryable());
    assertTrue(ErrorKind.WRITE_CONFLICT.isRetryable());
    assertTrue(ErrorKind.DEADLINE_EXCEEDED.isRetryable());
    assertFalse(ErrorKind.MALFORMED_INPUT.isRetryable());
    assertFalse(ErrorKind.INVALID_SIGNATURE.isRetryable());
    assertFalse(ErrorKind.EXPIRED.isRetryable());
    assertFalse(NOT_FOUND.isRetryable());
  }

  @Test
  public void testMapLeavesErrorUntouched() {
    Result<Integer, ParleyError> error = Result.error(NOT_FOUND);
    Result<Integer, ParleyError> mapped = error.map(size -> size + 1);
    assertEquals(NOT_FOUND, mapped.error().get());
  }

  @Test
  public void testMapErrorReclassifies() {
    Result<Integer, ParleyError> error = Result.error(NOT_FOUND);
    Result<Integer, ParleyError> result =
        error.mapError(e -> new ParleyError(ErrorKind.INVALID_SIGNATURE, e.getReason()));
    assertEquals(ErrorKind.INVALID_SIGNATURE, result.error().get().getKind());
    assertEquals("no entry e1", result.error().get().getReason());
  }

  @Test
  public void testAndThenStopsAtFirstError() {
    Result<Integer, ParleyError> start = Result.success(1);
    Result<Integer, ParleyError> result = start
        .andThen(value -> Result.<Integer, ParleyError>error(NOT_FOUND))
        .andThen(value -> Result.success(value * 10));
    assertEquals(NOT_FOUND, result.error().get());
  }

  @Test
  public void testAndThenChainsSuccesses() {
    Result<Integer, ParleyError> result = Result.<Integer, ParleyError>success(2)
        .andThen(value -> Result.success(value * 21));
    assertEquals(42, result.success().get().intValue());
  }

  @Test
  public void testCallbacks() {
    Result<String, ParleyError> error = Result.error(NOT_FOUND);
    AtomicReference<ParleyError> seen = new AtomicReference<>();
    error.ifError(seen::set);
    error.ifSuccess(value -> seen.set(null));
    assertEquals(NOT_FOUND, seen.get());
  }

  @Test
  public void testSuccessRejectsNull() {
    assertThrows(NullPointerException.class, () -> Result.success(null));
  }
}
