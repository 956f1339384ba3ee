package io.b2mash.b2b.deliverytracker.signature;

import java.util.UUID;

/**
 * Kind-specific side of the signature workflow. {@link SignatureService} runs the same slot
 * checks and conditional updates for every kind and delegates the rest here. Exactly one bean per
 * {@link SignatureEntityKind} is expected.
 */
public interface SignatureCompletionHandler {

  SignatureEntityKind kind();

  /**
   * Checks the entity currently accepts signatures, e.g. a deliverable must be in review-complete.
   * Called before any slot is written.
   */
  void assertSignable(UUID entityId);

  /**
   * Applies the completion side effect. Runs inside the signing transaction, once per record;
   * throwing rolls back the completing signature along with everything the handler wrote.
   */
  void onCompleted(SignatureRecord record, UUID completingSignerId);
}
