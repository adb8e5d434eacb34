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
import com.google.common.primitives.Ints;
import com.grcorsair.parley.config.ParleyConfig;
import com.grcorsair.parley.cose.CoseSign1;
import com.grcorsair.parley.evidence.ProvenanceSource;
import com.grcorsair.parley.keys.Ed25519PublicKey;
import com.grcorsair.parley.keys.SigningKeyPair;
import com.grcorsair.parley.util.Deadline;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only transparency log of credential tokens.
 *
 * <p>Each registration hashes the token, folds the hash into the tree, appends the entry and
 * returns a receipt signed with the log's key. Registrations on one instance are serialised by a
 * single writer lock; reads go straight to the {@link LogStore} and never block. A registration
 * that gives up (deadline, interrupt, repeated conflicts) has written nothing.
 */
public class TransparencyLog {
  static final String ENTRY_ID_PREFIX = "entry-";

  private static final Logger logger = Logger.getLogger(TransparencyLog.class.getName());

  private final LogStore store;
  private final TreeHasher hasher;
  private final SigningKeyPair keyPair;
  private final String logId;
  private final Clock clock;
  private final int maxWriteAttempts;
  private final ReentrantLock writeLock = new ReentrantLock(true);

  public TransparencyLog(
      LogStore store, TreeHasher hasher, SigningKeyPair keyPair, String logId, Clock clock) {
    this(store, hasher, keyPair, logId, clock, 3);
  }

  public TransparencyLog(LogStore store, TreeHasher hasher, SigningKeyPair keyPair, String logId,
      Clock clock, int maxWriteAttempts) {
    Preconditions.checkArgument(maxWriteAttempts > 0, "maxWriteAttempts must be positive");
    this.store = Objects.requireNonNull(store);
    this.hasher = Objects.requireNonNull(hasher);
    this.keyPair = Objects.requireNonNull(keyPair);
    this.logId = Objects.requireNonNull(logId);
    this.clock = Objects.requireNonNull(clock);
    this.maxWriteAttempts = maxWriteAttempts;
  }

  /** An in-memory Merkle log configured from {@code config}. */
  public static TransparencyLog create(SigningKeyPair keyPair, ParleyConfig config) {
    return new TransparencyLog(new InMemoryLogStore(), new MerkleTreeHasher(), keyPair,
        config.getLogId(), Clock.systemUTC(), config.getMaxWriteAttempts());
  }

  public String getLogId() {
    return logId;
  }

  /** The key receipts verify under. */
  public Ed25519PublicKey getPublicKey() {
    return keyPair.getPublicKey();
  }

  public long size() {
    return store.size();
  }

  /** Tree hash of the newest entry; empty while the log is empty. */
  public Optional<String> currentTreeHash() {
    return store.tail().map(LogEntry::getTreeHash);
  }

  /**
   * Registers {@code token}. The statement and tree hashes depend only on the token, never on
   * {@link RegisterOptions#isProofOnly()}.
   *
   * @return the registration, or {@link ErrorKind#DEADLINE_EXCEEDED} if the deadline passed before
   *     the entry was committed, or {@link ErrorKind#WRITE_CONFLICT} if the store kept rejecting
   *     the append
   */
  public Result<Registration, ParleyError> register(String token, RegisterOptions options) {
    if (token == null || token.isEmpty()) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "empty statement");
    }
    Deadline deadline = options.getDeadline();
    if (deadline.isExpired()) {
      return ParleyError.failure(ErrorKind.DEADLINE_EXCEEDED, "deadline passed before registration");
    }
    try {
      if (!acquireWriteLock(deadline)) {
        return ParleyError.failure(
            ErrorKind.DEADLINE_EXCEEDED, "deadline passed waiting for the log writer");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ParleyError.failure(
          ErrorKind.DEADLINE_EXCEEDED, "interrupted waiting for the log writer");
    }

    try {
      String statementHash = Hashes.sha256Hex(token);
      String statement = options.isProofOnly() ? null : token;
      for (int attempt = 1; ; attempt++) {
        LogEntry entry = nextEntry(statementHash, statement);
        Receipt receipt = signReceipt(entry);
        if (deadline.isExpired()) {
          return ParleyError.failure(
              ErrorKind.DEADLINE_EXCEEDED, "deadline passed before commit of %s", entry.getEntryId());
        }
        try {
          store.append(entry, receipt);
        } catch (WriteConflictException e) {
          if (attempt >= maxWriteAttempts) {
            logger.warning("Giving up after " + attempt + " conflicting appends: " + e.getMessage());
            return ParleyError.failure(ErrorKind.WRITE_CONFLICT,
                "append conflicted %d times: %s", attempt, e.getMessage());
          }
          logger.warning("Append conflict, retrying (attempt " + attempt + "): " + e.getMessage());
          continue;
        }
        logger.info("Registered " + entry.getEntryId() + " at tree size " + entry.getTreeSize()
            + (entry.isProofOnly() ? " (proof only)" : ""));
        return Result.success(new Registration(entry, receipt));
      }
    } finally {
      writeLock.unlock();
    }
  }

  private boolean acquireWriteLock(Deadline deadline) throws InterruptedException {
    if (deadline.isUnbounded()) {
      writeLock.lockInterruptibly();
      return true;
    }
    return writeLock.tryLock(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
  }

  private LogEntry nextEntry(String statementHash, String statement) {
    List<LogEntry> existing = allEntries();
    List<String> statementHashes = new ArrayList<>(existing.size() + 1);
    for (LogEntry entry : existing) {
      statementHashes.add(entry.getStatementHash());
    }
    statementHashes.add(statementHash);
    String parentHash = existing.isEmpty() ? null : existing.get(existing.size() - 1).getTreeHash();
    return new LogEntry(ENTRY_ID_PREFIX + UUID.randomUUID(), statementHash, statement,
        existing.size() + 1L, hasher.rootHash(statementHashes), parentHash, clock.instant());
  }

  private Receipt signReceipt(LogEntry entry) {
    try {
      byte[] proof = CoseSign1.sign(ReceiptClaims.of(logId, entry).encode(), keyPair);
      return new Receipt(entry.getEntryId(), logId, proof, entry.getRegistrationTime());
    } catch (GeneralSecurityException e) {
      logger.log(Level.SEVERE, "Signing receipt for " + entry.getEntryId() + " failed", e);
      throw new IllegalStateException("log signing key unusable", e);
    }
  }

  private List<LogEntry> allEntries() {
    return store.readRange(1, Ints.saturatedCast(store.size()));
  }

  public Result<LogEntry, ParleyError> getEntry(String entryId) {
    return store.findById(entryId)
        .map(Result::<LogEntry, ParleyError>success)
        .orElseGet(() -> ParleyError.failure(ErrorKind.NOT_FOUND, "no entry %s", entryId));
  }

  /**
   * Returns the receipt of {@code entryId} after checking that it still verifies under the log's
   * key and still describes the stored entry.
   */
  public Result<Receipt, ParleyError> getReceipt(String entryId) {
    Optional<Receipt> receipt = store.findReceipt(entryId);
    Optional<LogEntry> entry = store.findById(entryId);
    if (!receipt.isPresent() || !entry.isPresent()) {
      return ParleyError.failure(ErrorKind.NOT_FOUND, "no receipt for %s", entryId);
    }
    return ReceiptVerifier.verify(receipt.get(), keyPair.getPublicKey())
        .mapError(error -> ParleyError.of(ErrorKind.INVALID_SIGNATURE, "%s", error.getReason()))
        .<Receipt>andThen(claims -> claims.matches(logId, entry.get())
            ? Result.success(receipt.get())
            : ParleyError.failure(ErrorKind.INVALID_SIGNATURE,
                "receipt for %s no longer matches its entry", entryId));
  }

  /** Proves that {@code entryId} is included in the current tree. */
  public Result<InclusionProof, ParleyError> inclusionProof(String entryId) {
    Optional<LogEntry> entry = store.findById(entryId);
    if (!entry.isPresent()) {
      return ParleyError.failure(ErrorKind.NOT_FOUND, "no entry %s", entryId);
    }
    List<String> statementHashes = new ArrayList<>();
    for (LogEntry logged : allEntries()) {
      statementHashes.add(logged.getStatementHash());
    }
    return hasher.inclusionProof(statementHashes, Ints.checkedCast(entry.get().getTreeSize() - 1))
        .map(Result::<InclusionProof, ParleyError>success)
        .orElseGet(() -> ParleyError.failure(ErrorKind.NOT_FOUND,
            "%s does not produce inclusion proofs", hasher.getClass().getSimpleName()));
  }

  /** Entries newest first. Proof-only entries are listed only when no filter is set. */
  public List<ListedEntry> listEntries(ListOptions options) {
    List<LogEntry> entries = allEntries();
    List<ListedEntry> page = new ArrayList<>();
    int skipped = 0;
    for (int i = entries.size() - 1; i >= 0 && page.size() < options.getLimit(); i--) {
      LogEntry entry = entries.get(i);
      if (entry.isProofOnly() && options.hasFilter()) {
        continue;
      }
      StatementMetadata metadata = StatementMetadata.of(entry);
      if (!matches(metadata, options)) {
        continue;
      }
      if (skipped < options.getOffset()) {
        skipped++;
        continue;
      }
      page.add(new ListedEntry(entry, metadata));
    }
    return page;
  }

  private static boolean matches(StatementMetadata metadata, ListOptions options) {
    if (options.getIssuer().isPresent() && !options.getIssuer().get().equals(metadata.issuer)) {
      return false;
    }
    if (options.getFramework().isPresent()
        && !metadata.getFrameworks().contains(options.getFramework().get())) {
      return false;
    }
    return !options.getSource().isPresent()
        || options.getSource().get().getId().equals(metadata.source);
  }

  /** Aggregates the full-body entries of {@code issuerDid}, or {@link ErrorKind#NOT_FOUND}. */
  public Result<IssuerProfile, ParleyError> issuerProfile(String issuerDid) {
    List<ListedEntry> issued = new ArrayList<>();
    List<LogEntry> entries = allEntries();
    for (int i = entries.size() - 1; i >= 0; i--) {
      LogEntry entry = entries.get(i);
      if (entry.isProofOnly()) {
        continue;
      }
      StatementMetadata metadata = StatementMetadata.of(entry);
      if (issuerDid.equals(metadata.issuer)) {
        issued.add(new ListedEntry(entry, metadata));
      }
    }
    if (issued.isEmpty()) {
      return ParleyError.failure(ErrorKind.NOT_FOUND, "no credentials from %s", issuerDid);
    }

    Set<String> frameworks = new LinkedHashSet<>();
    Map<ProvenanceSource, Integer> provenance = new EnumMap<>(ProvenanceSource.class);
    for (ProvenanceSource source : ProvenanceSource.values()) {
      provenance.put(source, 0);
    }
    long totalScore = 0;
    List<IssuerProfile.HistoryItem> history = new ArrayList<>();
    for (ListedEntry entry : issued) {
      frameworks.addAll(entry.getFrameworks());
      ProvenanceSource.fromId(entry.getProvenanceSource())
          .ifPresent(source -> provenance.merge(source, 1, Integer::sum));
      totalScore += entry.getSummary().map(s -> s.getOverallScore()).orElse(0);
      if (history.size() < IssuerProfile.HISTORY_LIMIT) {
        history.add(new IssuerProfile.HistoryItem(entry));
      }
    }
    int averageScore = (int) Math.round((double) totalScore / issued.size());
    Instant lastCredentialDate = issued.get(0).getRegistrationTime();
    return Result.success(new IssuerProfile(issuerDid, issued.size(), frameworks, averageScore,
        provenance, lastCredentialDate, history));
  }

  /**
   * Re-derives every stored hash from the statement hashes and checks positions and parent links.
   * Full-body entries also have their statement hash recomputed.
   *
   * @return empty if the log is consistent, or the first inconsistency found
   */
  public Optional<ParleyError> verifyChain() {
    List<LogEntry> entries = allEntries();
    List<String> statementHashes = new ArrayList<>(entries.size());
    String previousTreeHash = null;
    for (int i = 0; i < entries.size(); i++) {
      LogEntry entry = entries.get(i);
      if (entry.getTreeSize() != i + 1) {
        return chainFailure("%s has tree size %d at position %d", entry.getEntryId(),
            entry.getTreeSize(), i + 1);
      }
      if (entry.getStatement().isPresent()
          && !Hashes.sha256Hex(entry.getStatement().get()).equals(entry.getStatementHash())) {
        return chainFailure("%s statement does not match its hash", entry.getEntryId());
      }
      statementHashes.add(entry.getStatementHash());
      if (!hasher.rootHash(statementHashes).equals(entry.getTreeHash())) {
        return chainFailure("%s tree hash does not match the recomputed tree", entry.getEntryId());
      }
      if (!Objects.equals(previousTreeHash, entry.getParentHash().orElse(null))) {
        return chainFailure("%s parent hash does not match the previous tree hash",
            entry.getEntryId());
      }
      previousTreeHash = entry.getTreeHash();
    }
    logger.fine("Verified hash chain of " + entries.size() + " entries in " + logId);
    return Optional.empty();
  }

  private static Optional<ParleyError> chainFailure(String format, Object... args) {
    ParleyError error = ParleyError.of(ErrorKind.INVALID_SIGNATURE, format, args);
    logger.warning("Log consistency check failed: " + error.getReason());
    return Optional.of(error);
  }
}
