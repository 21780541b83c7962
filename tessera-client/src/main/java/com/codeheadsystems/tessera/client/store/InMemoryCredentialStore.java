package com.codeheadsystems.tessera.client.store;

import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.model.TokenSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-only {@link CredentialStore}. Everything is lost when the process exits.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final AtomicReference<DeviceRegistration> registration = new AtomicReference<>();
  private final AtomicReference<TokenSet> tokens = new AtomicReference<>();
  private final Map<FlowKind, PendingFlowState> pending = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.info("InMemoryCredentialStore()");
  }

  @Override
  public Optional<DeviceRegistration> loadRegistration() {
    return Optional.ofNullable(registration.get());
  }

  @Override
  public void saveRegistration(final DeviceRegistration value) {
    registration.set(value);
  }

  @Override
  public void clearRegistration() {
    registration.set(null);
  }

  @Override
  public Optional<TokenSet> loadTokens() {
    return Optional.ofNullable(tokens.get());
  }

  @Override
  public void saveTokens(final TokenSet value) {
    tokens.set(value);
  }

  @Override
  public void clearTokens() {
    tokens.set(null);
  }

  @Override
  public Optional<PendingFlowState> loadPending(final FlowKind kind) {
    return Optional.ofNullable(pending.get(kind));
  }

  @Override
  public void savePending(final PendingFlowState value) {
    pending.put(value.kind(), value);
  }

  @Override
  public Optional<PendingFlowState> consumePending(final FlowKind kind) {
    return Optional.ofNullable(pending.remove(kind));
  }

  @Override
  public void clearPending(final FlowKind kind) {
    pending.remove(kind);
  }

  @Override
  public void clearAll() {
    log.debug("clearAll()");
    registration.set(null);
    tokens.set(null);
    pending.clear();
  }
}
