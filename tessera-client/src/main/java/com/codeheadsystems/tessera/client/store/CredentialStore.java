package com.codeheadsystems.tessera.client.store;

import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.model.TokenSet;
import java.util.Optional;

/**
 * Confidential persistence for the registration, the current tokens, and at most one pending
 * flow per {@link FlowKind}. Values are only ever overwritten whole. Implementations must be
 * thread-safe and throw {@link CredentialStoreException} when the backing storage fails.
 */
public interface CredentialStore {

  Optional<DeviceRegistration> loadRegistration();

  void saveRegistration(DeviceRegistration registration);

  void clearRegistration();

  Optional<TokenSet> loadTokens();

  void saveTokens(TokenSet tokens);

  void clearTokens();

  Optional<PendingFlowState> loadPending(FlowKind kind);

  /**
   * Stores the pending flow, replacing any earlier one of the same kind.
   *
   * @param pending the pending flow state
   */
  void savePending(PendingFlowState pending);

  /**
   * Removes and returns the pending flow of the kind in one step, so a state value can be
   * presented at most once.
   *
   * @param kind the flow kind
   * @return the pending flow state, if one was stored
   */
  Optional<PendingFlowState> consumePending(FlowKind kind);

  void clearPending(FlowKind kind);

  /**
   * Clears registration, tokens and all pending flows.
   */
  void clearAll();
}
