package com.codeheadsystems.tessera.client.store;

import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.model.TokenSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} persisted as two AES-256-GCM encrypted JSON files in one directory:
 * {@code credentials.enc} for the registration and tokens, {@code pending.enc} for pending
 * flows.
 * <p>
 * The file key is derived from the passphrase with PBKDF2-HMAC-SHA256 and a fresh random salt on
 * every write. The file name is bound as associated data so the two files cannot be swapped.
 * Writes go to a temporary file that is atomically moved into place, with owner-only permissions
 * where the file system supports them. Every call reads the files again, so several processes
 * sharing the directory see each other's writes.
 */
public class EncryptedFileCredentialStore implements CredentialStore {

  static final String CREDENTIALS_FILE = "credentials.enc";
  static final String PENDING_FILE = "pending.enc";
  static final int DEFAULT_ITERATIONS = 210_000;

  private static final Logger log = LoggerFactory.getLogger(EncryptedFileCredentialStore.class);
  private static final int FORMAT_VERSION = 1;
  private static final int SALT_LENGTH = 16;
  private static final int NONCE_LENGTH = 12;
  private static final int KEY_LENGTH_BITS = 256;
  private static final int GCM_TAG_LENGTH_BITS = 128;
  private static final Set<PosixFilePermission> FILE_PERMISSIONS =
      EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);

  private final Path directory;
  private final char[] passphrase;
  private final ObjectMapper objectMapper;
  private final int iterations;
  private final SecureRandom random = new SecureRandom();

  public EncryptedFileCredentialStore(final Path directory, final char[] passphrase,
                                      final ObjectMapper objectMapper) {
    this(directory, passphrase, objectMapper, DEFAULT_ITERATIONS);
  }

  EncryptedFileCredentialStore(final Path directory, final char[] passphrase,
                               final ObjectMapper objectMapper, final int iterations) {
    log.info("EncryptedFileCredentialStore({})", directory);
    if (passphrase == null || passphrase.length == 0) {
      throw new IllegalArgumentException("passphrase is required");
    }
    this.directory = directory;
    this.passphrase = passphrase.clone();
    this.objectMapper = objectMapper;
    this.iterations = iterations;
  }

  // ── Registration ──────────────────────────────────────────────────────────

  @Override
  public synchronized Optional<DeviceRegistration> loadRegistration() {
    StoredCredentials stored = readCredentials();
    if (!stored.isRegistered() || stored.clientId() == null || stored.keyId() == null) {
      return Optional.empty();
    }
    return Optional.of(new DeviceRegistration(stored.serverUrl(), stored.clientId(), stored.keyId(),
        stored.registrationDate()));
  }

  @Override
  public synchronized void saveRegistration(final DeviceRegistration registration) {
    updateCredentials(stored -> stored.withRegistration(registration.serverUrl(), registration.clientId(),
        registration.keyId(), true, registration.registeredAtEpochMs()));
  }

  @Override
  public synchronized void clearRegistration() {
    updateCredentials(stored -> stored.withRegistration(null, null, null, false, 0L));
  }

  // ── Tokens ────────────────────────────────────────────────────────────────

  @Override
  public synchronized Optional<TokenSet> loadTokens() {
    StoredCredentials stored = readCredentials();
    if (stored.accessToken() == null) {
      return Optional.empty();
    }
    return Optional.of(new TokenSet(stored.accessToken(), stored.refreshToken(), stored.tokenExpiresAt()));
  }

  @Override
  public synchronized void saveTokens(final TokenSet tokens) {
    updateCredentials(stored -> stored.withTokens(tokens.accessToken(), tokens.refreshToken(),
        tokens.expiresAtEpochMs()));
  }

  @Override
  public synchronized void clearTokens() {
    updateCredentials(stored -> stored.withTokens(null, null, 0L));
  }

  // ── Pending flows ─────────────────────────────────────────────────────────

  @Override
  public synchronized Optional<PendingFlowState> loadPending(final FlowKind kind) {
    StoredPending stored = readPending();
    if (kind == FlowKind.ENROLLMENT) {
      return stored.pendingState() == null ? Optional.empty()
          : Optional.of(PendingFlowState.enrollment(stored.pendingState(), stored.pendingServerUrl()));
    }
    return stored.oauthState() == null ? Optional.empty()
        : Optional.of(PendingFlowState.login(stored.oauthState(), stored.oauthCodeVerifier()));
  }

  @Override
  public synchronized void savePending(final PendingFlowState pending) {
    StoredPending stored = readPending();
    if (pending.kind() == FlowKind.ENROLLMENT) {
      writeFile(PENDING_FILE, stored.withEnrollment(pending.state(), pending.serverUrl()));
    } else {
      writeFile(PENDING_FILE, stored.withLogin(pending.state(), pending.codeVerifier()));
    }
  }

  @Override
  public synchronized Optional<PendingFlowState> consumePending(final FlowKind kind) {
    Optional<PendingFlowState> pending = loadPending(kind);
    if (pending.isPresent()) {
      clearPending(kind);
    }
    return pending;
  }

  @Override
  public synchronized void clearPending(final FlowKind kind) {
    StoredPending stored = readPending();
    if (kind == FlowKind.ENROLLMENT) {
      writeFile(PENDING_FILE, stored.withEnrollment(null, null));
    } else {
      writeFile(PENDING_FILE, stored.withLogin(null, null));
    }
  }

  @Override
  public synchronized void clearAll() {
    log.debug("clearAll({})", directory);
    try {
      Files.deleteIfExists(directory.resolve(CREDENTIALS_FILE));
      Files.deleteIfExists(directory.resolve(PENDING_FILE));
    } catch (IOException e) {
      throw new CredentialStoreException("Unable to clear credential store: " + directory, e);
    }
  }

  // ── File handling ─────────────────────────────────────────────────────────

  private StoredCredentials readCredentials() {
    return readFile(CREDENTIALS_FILE, StoredCredentials.class).orElse(StoredCredentials.EMPTY);
  }

  private StoredPending readPending() {
    return readFile(PENDING_FILE, StoredPending.class).orElse(StoredPending.EMPTY);
  }

  private void updateCredentials(final UnaryOperator<StoredCredentials> update) {
    writeFile(CREDENTIALS_FILE, update.apply(readCredentials()));
  }

  private <T> Optional<T> readFile(final String name, final Class<T> type) {
    Path file = directory.resolve(name);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      EncryptedEnvelope envelope = objectMapper.readValue(file.toFile(), EncryptedEnvelope.class);
      if (envelope.version() != FORMAT_VERSION) {
        throw new CredentialStoreException("Unsupported credential file version " + envelope.version(), null);
      }
      Base64.Decoder decoder = Base64.getDecoder();
      byte[] salt = decoder.decode(envelope.salt());
      SecretKey key = deriveKey(salt, envelope.iterations());
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, decoder.decode(envelope.nonce())));
      cipher.updateAAD(name.getBytes(StandardCharsets.UTF_8));
      byte[] plaintext = cipher.doFinal(decoder.decode(envelope.ciphertext()));
      return Optional.of(objectMapper.readValue(plaintext, type));
    } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
      throw new CredentialStoreException("Unable to read " + file, e);
    }
  }

  private void writeFile(final String name, final Object value) {
    Path file = directory.resolve(name);
    try {
      byte[] salt = new byte[SALT_LENGTH];
      byte[] nonce = new byte[NONCE_LENGTH];
      random.nextBytes(salt);
      random.nextBytes(nonce);
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt, iterations), new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
      cipher.updateAAD(name.getBytes(StandardCharsets.UTF_8));
      byte[] ciphertext = cipher.doFinal(objectMapper.writeValueAsBytes(value));
      Base64.Encoder encoder = Base64.getEncoder();
      EncryptedEnvelope envelope = new EncryptedEnvelope(FORMAT_VERSION, encoder.encodeToString(salt),
          encoder.encodeToString(nonce), iterations, encoder.encodeToString(ciphertext));

      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, name, ".tmp");
      restrictPermissions(temp);
      Files.write(temp, objectMapper.writeValueAsBytes(envelope));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException | GeneralSecurityException e) {
      throw new CredentialStoreException("Unable to write " + file, e);
    }
  }

  private SecretKey deriveKey(final byte[] salt, final int rounds) throws GeneralSecurityException {
    PBEKeySpec spec = new PBEKeySpec(passphrase, salt, rounds, KEY_LENGTH_BITS);
    try {
      byte[] keyBytes = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
      return new SecretKeySpec(keyBytes, "AES");
    } finally {
      spec.clearPassword();
    }
  }

  private static void restrictPermissions(final Path file) throws IOException {
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      Files.setPosixFilePermissions(file, FILE_PERMISSIONS);
    } else {
      log.debug("restrictPermissions(): posix permissions unsupported for {}", file);
    }
  }
}
