package com.codeheadsystems.tessera.client.custody;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.exceptions.KeyGenerationException;
import com.codeheadsystems.tessera.client.exceptions.KeyNotFoundException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.util.Collections;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyStoreKeyCustodyTest {

  private static final char[] PASSPHRASE = "correct horse battery staple".toCharArray();

  private KeyStoreKeyCustody custody;

  @BeforeEach
  void setUp() {
    custody = KeyStoreKeyCustody.inMemory();
  }

  // ── Generation ────────────────────────────────────────────────────────────

  @Test
  void generateKeyPair_returnsUuidAndStoresRsa2048() {
    String keyId = custody.generateKeyPair();

    assertThat(UUID.fromString(keyId).toString()).isEqualTo(keyId);
    assertThat(custody.hasKey(keyId)).isTrue();
    assertThat(custody.publicKey(keyId).getModulus().bitLength()).isEqualTo(2048);
  }

  @Test
  void generateKeyPair_returnsDistinctIds() {
    assertThat(custody.generateKeyPair()).isNotEqualTo(custody.generateKeyPair());
  }

  // ── JWKS and signing ──────────────────────────────────────────────────────

  @Test
  void exportPublicJwks_holdsOnlyPublicKeyTaggedWithKid() throws Exception {
    String keyId = custody.generateKeyPair();

    JWKSet set = JWKSet.parse(custody.exportPublicJwks(keyId));

    assertThat(set.getKeys()).hasSize(1);
    JWK jwk = set.getKeys().get(0);
    assertThat(jwk.getKeyID()).isEqualTo(keyId);
    assertThat(jwk.getKeyType().getValue()).isEqualTo("RSA");
    assertThat(jwk.getKeyUse().identifier()).isEqualTo("sig");
    assertThat(jwk.getAlgorithm().getName()).isEqualTo("RS256");
    assertThat(jwk.isPrivate()).isFalse();
  }

  @Test
  void sign_verifiesWithExportedJwksOnly() throws Exception {
    String keyId = custody.generateKeyPair();
    byte[] message = "header.payload".getBytes(StandardCharsets.US_ASCII);

    byte[] signatureBytes = custody.sign(keyId, message);

    RSAPublicKey exported = ((RSAKey) JWKSet.parse(custody.exportPublicJwks(keyId)).getKeyByKeyId(keyId))
        .toRSAPublicKey();
    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(exported);
    verifier.update(message);
    assertThat(verifier.verify(signatureBytes)).isTrue();
  }

  @Test
  void exportPublicJwks_unknownKey_throwsKeyNotFound() {
    assertThatThrownBy(() -> custody.exportPublicJwks("nope"))
        .isInstanceOf(KeyNotFoundException.class);
  }

  @Test
  void sign_unknownKey_throwsKeyNotFound() {
    assertThatThrownBy(() -> custody.sign("nope", new byte[]{1}))
        .isInstanceOf(KeyNotFoundException.class);
  }

  @Test
  void keyMaterial_redactsPrivateHandle() {
    String keyId = custody.generateKeyPair();

    KeyMaterial material = custody.keyMaterial(keyId);

    assertThat(material.keyId()).isEqualTo(keyId);
    assertThat(material.hardwareBacked()).isFalse();
    assertThat(material.publicKey()).isEqualTo(custody.publicKey(keyId));
    assertThat(material.privateKeyHandle().toString()).isEqualTo("PrivateKeyHandle[redacted]");
    assertThat(material.privateKeyHandle()).isNotInstanceOf(java.io.Serializable.class);
  }

  // ── Deletion ──────────────────────────────────────────────────────────────

  @Test
  void deleteKey_isIdempotent() {
    String keyId = custody.generateKeyPair();

    custody.deleteKey(keyId);
    custody.deleteKey(keyId);

    assertThat(custody.hasKey(keyId)).isFalse();
  }

  @Test
  void deleteAllManagedKeys_removesEveryKey() {
    String first = custody.generateKeyPair();
    String second = custody.generateKeyPair();

    custody.deleteAllManagedKeys();

    assertThat(custody.hasKey(first)).isFalse();
    assertThat(custody.hasKey(second)).isFalse();
  }

  // ── Persistence ───────────────────────────────────────────────────────────

  @Test
  void fileBacked_keysSurviveReopen(@TempDir Path dir) {
    Path file = dir.resolve("keys.p12");
    KeyStoreKeyCustody first = KeyStoreKeyCustody.fileBacked(file, PASSPHRASE);
    String keyId = first.generateKeyPair();
    byte[] signature = first.sign(keyId, new byte[]{1, 2, 3});

    KeyStoreKeyCustody reopened = KeyStoreKeyCustody.fileBacked(file, PASSPHRASE);

    assertThat(reopened.hasKey(keyId)).isTrue();
    assertThat(reopened.sign(keyId, new byte[]{1, 2, 3})).isEqualTo(signature);
  }

  @Test
  void fileBacked_deletionIsPersisted(@TempDir Path dir) {
    Path file = dir.resolve("keys.p12");
    KeyStoreKeyCustody first = KeyStoreKeyCustody.fileBacked(file, PASSPHRASE);
    String keyId = first.generateKeyPair();
    first.deleteKey(keyId);

    assertThat(KeyStoreKeyCustody.fileBacked(file, PASSPHRASE).hasKey(keyId)).isFalse();
  }

  @Test
  void fileBacked_wrongPassphrase_throws(@TempDir Path dir) {
    Path file = dir.resolve("keys.p12");
    KeyStoreKeyCustody.fileBacked(file, PASSPHRASE).generateKeyPair();

    assertThatThrownBy(() -> KeyStoreKeyCustody.fileBacked(file, "wrong".toCharArray()))
        .isInstanceOf(KeyCustodyException.class);
  }

  @Test
  void fileBacked_failedWrite_leavesNoKeyBehind(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("keys.p12");
    KeyStoreKeyCustody custody = KeyStoreKeyCustody.fileBacked(file, PASSPHRASE);
    blockWrites(file);

    assertThatThrownBy(custody::generateKeyPair).isInstanceOf(KeyGenerationException.class);

    unblockWrites(file);
    String keyId = custody.generateKeyPair();
    KeyStore onDisk = KeyStore.getInstance("PKCS12");
    try (InputStream in = Files.newInputStream(file)) {
      onDisk.load(in, PASSPHRASE);
    }
    assertThat(Collections.list(onDisk.aliases()))
        .containsExactly(KeyStoreKeyCustody.KEY_ALIAS_PREFIX + keyId);
  }

  @Test
  void fileBacked_failedWrite_keepsDeletedKey(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("keys.p12");
    KeyStoreKeyCustody custody = KeyStoreKeyCustody.fileBacked(file, PASSPHRASE);
    String keyId = custody.generateKeyPair();
    Files.delete(file);
    blockWrites(file);

    assertThatThrownBy(() -> custody.deleteKey(keyId)).isInstanceOf(KeyCustodyException.class);

    assertThat(custody.hasKey(keyId)).isTrue();
    assertThat(custody.sign(keyId, new byte[]{1})).isNotEmpty();
  }

  // A non-empty directory where the key store file belongs makes the final move fail.
  private static void blockWrites(final Path file) throws Exception {
    Files.createDirectories(file);
    Files.writeString(file.resolve("occupied"), "x");
  }

  private static void unblockWrites(final Path file) throws Exception {
    Files.delete(file.resolve("occupied"));
    Files.delete(file);
  }
}
