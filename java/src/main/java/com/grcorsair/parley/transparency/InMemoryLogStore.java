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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Optional;

/**
 * Copy-on-write {@link LogStore}. Every append publishes a new immutable snapshot, so readers never
 * take a lock and never see a torn entry.
 */
public class InMemoryLogStore implements LogStore {
  private static final class Snapshot {
    final ImmutableList<LogEntry> entries;
    final ImmutableMap<String, LogEntry> entriesById;
    final ImmutableMap<String, Receipt> receipts;

    Snapshot(ImmutableList<LogEntry> entries, ImmutableMap<String, LogEntry> entriesById,
        ImmutableMap<String, Receipt> receipts) {
      this.entries = entries;
      this.entriesById = entriesById;
      this.receipts = receipts;
    }
  }

  private volatile Snapshot snapshot =
      new Snapshot(ImmutableList.of(), ImmutableMap.of(), ImmutableMap.of());

  @Override
  public synchronized void append(LogEntry entry, Receipt receipt) throws WriteConflictException {
    Preconditions.checkArgument(entry.getEntryId().equals(receipt.getEntryId()),
        "receipt %s does not belong to entry %s", receipt.getEntryId(), entry.getEntryId());
    Snapshot current = snapshot;
    long expected = current.entries.size() + 1L;
    if (entry.getTreeSize() != expected) {
      throw new WriteConflictException(String.format(
          "tree size %d already taken, next free position is %d", entry.getTreeSize(), expected));
    }
    if (current.entriesById.containsKey(entry.getEntryId())) {
      throw new WriteConflictException("duplicate entry id " + entry.getEntryId());
    }
    snapshot = new Snapshot(
        ImmutableList.<LogEntry>builder().addAll(current.entries).add(entry).build(),
        ImmutableMap.<String, LogEntry>builder()
            .putAll(current.entriesById).put(entry.getEntryId(), entry).build(),
        ImmutableMap.<String, Receipt>builder()
            .putAll(current.receipts).put(receipt.getEntryId(), receipt).build());
  }

  @Override
  public long size() {
    return snapshot.entries.size();
  }

  @Override
  public Optional<LogEntry> tail() {
    ImmutableList<LogEntry> entries = snapshot.entries;
    return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
  }

  @Override
  public List<LogEntry> readRange(long fromTreeSize, int count) {
    Preconditions.checkArgument(fromTreeSize >= 1, "tree sizes start at 1: %s", fromTreeSize);
    Preconditions.checkArgument(count >= 0, "negative count: %s", count);
    ImmutableList<LogEntry> entries = snapshot.entries;
    if (fromTreeSize > entries.size()) {
      return ImmutableList.of();
    }
    int from = (int) (fromTreeSize - 1);
    int to = (int) Math.min(entries.size(), (long) from + count);
    return entries.subList(from, to);
  }

  @Override
  public Optional<LogEntry> findById(String entryId) {
    return Optional.ofNullable(snapshot.entriesById.get(entryId));
  }

  @Override
  public Optional<Receipt> findReceipt(String entryId) {
    return Optional.ofNullable(snapshot.receipts.get(entryId));
  }
}
