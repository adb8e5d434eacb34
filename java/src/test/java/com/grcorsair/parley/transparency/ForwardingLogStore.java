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

/** Delegates to another store; tests override single methods to inject behaviour. */
class ForwardingLogStore implements LogStore {
  private final LogStore delegate;

  ForwardingLogStore(LogStore delegate) {
    this.delegate = delegate;
  }

  @Override
  public void append(LogEntry entry, Receipt receipt) throws WriteConflictException {
    delegate.append(entry, receipt);
  }

  @Override
  public long size() {
    return delegate.size();
  }

  @Override
  public Optional<LogEntry> tail() {
    return delegate.tail();
  }

  @Override
  public List<LogEntry> readRange(long fromTreeSize, int count) {
    return delegate.readRange(fromTreeSize, count);
  }

  @Override
  public Optional<LogEntry> findById(String entryId) {
    return delegate.findById(entryId);
  }

  @Override
  public Optional<Receipt> findReceipt(String entryId) {
    return delegate.findReceipt(entryId);
  }
}
