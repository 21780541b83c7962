package com.codeheadsystems.tessera.client.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.model.TokenSet;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  private final InMemoryCredentialStore store = new InMemoryCredentialStore();

  @Test
  void registrationAndTokens_areIndependent() {
    store.saveRegistration(new DeviceRegistration("https://h", "client_abc", "key-1", 1L));
    store.saveTokens(new TokenSet("T1", "R1", 10L));

    store.clearTokens();

    assertThat(store.loadTokens()).isEmpty();
    assertThat(store.loadRegistration()).map(DeviceRegistration::clientId).contains("client_abc");
  }

  @Test
  void consumePending_returnsOnce() {
    store.savePending(PendingFlowState.login("s1", "v1"));

    assertThat(store.consumePending(FlowKind.LOGIN)).map(PendingFlowState::codeVerifier).contains("v1");
    assertThat(store.consumePending(FlowKind.LOGIN)).isEmpty();
  }

  @Test
  void savePending_lastRequestWins() {
    store.savePending(PendingFlowState.enrollment("first", "https://a"));
    store.savePending(PendingFlowState.enrollment("second", "https://b"));

    assertThat(store.loadPending(FlowKind.ENROLLMENT)).map(PendingFlowState::state).contains("second");
  }

  @Test
  void clearAll_removesEverything() {
    store.saveRegistration(new DeviceRegistration("https://h", "c", "k", 1L));
    store.saveTokens(new TokenSet("T1", null, 10L));
    store.savePending(PendingFlowState.login("s", "v"));

    store.clearAll();

    assertThat(store.loadRegistration()).isEmpty();
    assertThat(store.loadTokens()).isEmpty();
    assertThat(store.loadPending(FlowKind.LOGIN)).isEmpty();
  }
}
