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

import com.grcorsair.parley.cbor.CborException;
import com.grcorsair.parley.cose.CoseSign1;
import com.grcorsair.parley.keys.Ed25519PublicKey;
import com.grcorsair.parley.util.ErrorKind;
import com.grcorsair.parley.util.ParleyError;
import com.grcorsair.parley.util.Result;
import java.util.logging.Logger;

/** Checks receipts independently of the log that issued them. */
public final class ReceiptVerifier {
  private static final Logger logger = Logger.getLogger(ReceiptVerifier.class.getName());

  /**
   * Verifies the receipt's signature under {@code logKey} and that its unsigned fields agree with
   * the signed claims.
   *
   * @return the signed claims, or {@link ErrorKind#MALFORMED_INPUT} if the proof cannot be decoded
   *     and {@link ErrorKind#INVALID_SIGNATURE} if it does not verify
   */
  public static Result<ReceiptClaims, ParleyError> verify(Receipt receipt, Ed25519PublicKey logKey) {
    Result<ReceiptClaims, ParleyError> result = CoseSign1.verify(receipt.getProof(), logKey)
        .<ReceiptClaims>andThen(ReceiptVerifier::decodeClaims)
        .<ReceiptClaims>andThen(claims -> {
          if (!claims.getEntryId().equals(receipt.getEntryId())
              || !claims.getLogId().equals(receipt.getLogId())) {
            return ParleyError.failure(ErrorKind.INVALID_SIGNATURE,
                "receipt for %s in %s carries claims for %s in %s", receipt.getEntryId(),
                receipt.getLogId(), claims.getEntryId(), claims.getLogId());
          }
          return Result.success(claims);
        });
    result.ifError(error -> logger.warning("Receipt " + receipt.getEntryId() + " rejected: " + error));
    return result;
  }

  /**
   * As {@link #verify(Receipt, Ed25519PublicKey)}, additionally checking that the receipt was
   * issued for exactly {@code statement}.
   */
  public static Result<ReceiptClaims, ParleyError> verify(
      Receipt receipt, Ed25519PublicKey logKey, String statement) {
    return verify(receipt, logKey).<ReceiptClaims>andThen(claims -> {
      String statementHash = Hashes.sha256Hex(statement);
      if (!statementHash.equals(claims.getStatementHash())) {
        return ParleyError.failure(ErrorKind.INVALID_SIGNATURE,
            "statement hash %s does not match receipt %s", statementHash,
            claims.getStatementHash());
      }
      return Result.success(claims);
    });
  }

  private static Result<ReceiptClaims, ParleyError> decodeClaims(byte[] payload) {
    try {
      return Result.success(ReceiptClaims.decode(payload));
    } catch (CborException e) {
      return ParleyError.failure(ErrorKind.MALFORMED_INPUT, "bad receipt payload: %s",
          e.getMessage());
    }
  }

  private ReceiptVerifier() {}
}
