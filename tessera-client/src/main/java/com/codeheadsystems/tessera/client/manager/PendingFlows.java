package com.codeheadsystems.tessera.client.manager;

import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.store.CredentialStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a callback's state against the stored pending flow. The pending entry is consumed
 * whether or not it matches, so every state value is single-use.
 */
final class PendingFlows {

  private static final Logger log = LoggerFactory.getLogger(PendingFlows.class);

  private PendingFlows() {
  }

  static ApiResult<PendingFlowState> consume(final CredentialStore store,
                                             final FlowKind kind,
                                             final String presentedState) {
    final Optional<PendingFlowState> pending;
    try {
      pending = store.consumePending(kind);
    } catch (CredentialStoreException e) {
      log.warn("consume({}): credential store unavailable", kind, e);
      return ApiResult.validationError(ApiResult.ValidationError.Kind.CREDENTIAL_STORE, e.getMessage());
    }
    if (pending.isEmpty()) {
      log.warn("consume({}): no pending flow, rejecting callback", kind);
      return ApiResult.validationError(ApiResult.ValidationError.Kind.STATE_MISMATCH,
          "no pending " + kind.name().toLowerCase() + " flow; restart it");
    }
    if (!pending.get().matches(presentedState)) {
      log.warn("consume({}): state mismatch, rejecting callback", kind);
      return ApiResult.validationError(ApiResult.ValidationError.Kind.STATE_MISMATCH,
          "state mismatch; restart the " + kind.name().toLowerCase() + " flow");
    }
    return ApiResult.success(pending.get());
  }
}
