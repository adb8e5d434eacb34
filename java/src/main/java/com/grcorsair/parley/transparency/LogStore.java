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

import java.util.List;
import java.util.Optional;

/**
 * Storage behind a {@link TransparencyLog}. Entries are addressed by their one-based tree size.
 *
 * <p>Reads may run concurrently with an append and must see either the state before it or the
 * state after it, never a partially written entry.
 */
public interface LogStore {
  /**
   * Commits {@code entry} and its receipt together.
   *
   * @throws WriteConflictException if {@code entry.getTreeSize()} is not {@code size() + 1}, i.e.
   *     another append got there first; nothing is written in that case
   */
  void append(LogEntry entry, Receipt receipt) throws WriteConflictException;

  long size();

  /** The most recent entry; empty when the log is empty. */
  Optional<LogEntry> tail();

  /**
   * Up to {@code count} entries starting at tree size {@code fromTreeSize}, in tree order.
   */
  List<LogEntry> readRange(long fromTreeSize, int count);

  Optional<LogEntry> findById(String entryId);

  Optional<Receipt> findReceipt(String entryId);
}
