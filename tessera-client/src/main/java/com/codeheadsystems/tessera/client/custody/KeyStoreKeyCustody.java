package com.codeheadsystems.tessera.client.custody;

import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.exceptions.KeyGenerationException;
import com.codeheadsystems.tessera.client.exceptions.KeyNotFoundException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyCustody} over a PKCS#12 {@link KeyStore}.
 * <p>
 * A key store entry needs a certificate chain, so each generated key pair is stored with a
 * self-signed certificate issued by Bouncy Castle; the certificate is never sent anywhere.
 * Entries are aliased {@code tessera_key_<keyId>} so {@link #deleteAllManagedKeys()} leaves
 * foreign entries alone.
 * <p>
 * {@link #inMemory()} keeps everything on the heap. {@link #fileBacked(Path, char[])} loads the
 * store from disk and rewrites it atomically after every mutation. Neither is hardware backed.
 */
public class KeyStoreKeyCustody implements KeyCustody {

  static final String KEY_ALIAS_PREFIX = "tessera_key_";

  private static final Logger log = LoggerFactory.getLogger(KeyStoreKeyCustody.class);
  private static final String KEY_STORE_TYPE = "PKCS12";
  private static final String KEY_ALGORITHM = "RSA";
  private static final int KEY_SIZE = 2048;
  private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  private static final Duration CERTIFICATE_VALIDITY = Duration.ofDays(3650);

  private final KeyStore keyStore;
  private final char[] protection;
  private final Path backingFile;
  private final SecureRandom random = new SecureRandom();

  KeyStoreKeyCustody(final KeyStore keyStore, final char[] protection, final Path backingFile) {
    log.info("KeyStoreKeyCustody(backingFile={})", backingFile);
    this.keyStore = keyStore;
    this.protection = protection.clone();
    this.backingFile = backingFile;
  }

  /**
   * A custody that lives only as long as this object.
   *
   * @return the key store key custody
   */
  public static KeyStoreKeyCustody inMemory() {
    char[] protection = UUID.randomUUID().toString().toCharArray();
    return new KeyStoreKeyCustody(emptyKeyStore(), protection, null);
  }

  /**
   * A custody persisted to a PKCS#12 file protected by the passphrase. The file is created on
   * the first key generation if it does not exist.
   *
   * @param file       the key store file
   * @param passphrase the passphrase
   * @return the key store key custody
   * @throws KeyCustodyException if an existing file cannot be read with the passphrase
   */
  public static KeyStoreKeyCustody fileBacked(final Path file, final char[] passphrase) {
    if (!Files.exists(file)) {
      return new KeyStoreKeyCustody(emptyKeyStore(), passphrase, file);
    }
    try (InputStream in = Files.newInputStream(file)) {
      KeyStore keyStore = KeyStore.getInstance(KEY_STORE_TYPE);
      keyStore.load(in, passphrase);
      return new KeyStoreKeyCustody(keyStore, passphrase, file);
    } catch (IOException | GeneralSecurityException e) {
      throw new KeyCustodyException("Unable to open key store: " + file, e);
    }
  }

  @Override
  public synchronized String generateKeyPair() {
    String keyId = UUID.randomUUID().toString();
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
      generator.initialize(KEY_SIZE, random);
      KeyPair keyPair = generator.generateKeyPair();
      X509Certificate certificate = selfSigned(keyId, keyPair);
      keyStore.setKeyEntry(alias(keyId), keyPair.getPrivate(), protection, new Certificate[]{certificate});
    } catch (GeneralSecurityException | OperatorCreationException e) {
      throw new KeyGenerationException("Unable to generate key pair", e);
    }
    try {
      persist();
    } catch (KeyCustodyException e) {
      // the caller never sees this key id, so the entry must not reach a later write
      removeEntry(alias(keyId));
      throw new KeyGenerationException("Unable to store key pair", e);
    }
    log.debug("generateKeyPair(): keyId={}", keyId);
    return keyId;
  }

  @Override
  public synchronized boolean hasKey(final String keyId) {
    try {
      return keyStore.isKeyEntry(alias(keyId));
    } catch (KeyStoreException e) {
      throw new KeyCustodyException("Key store unavailable", e);
    }
  }

  @Override
  public synchronized void deleteKey(final String keyId) {
    final KeyStore.Entry removed;
    try {
      if (!keyStore.containsAlias(alias(keyId))) {
        return;
      }
      removed = keyStore.getEntry(alias(keyId), new KeyStore.PasswordProtection(protection));
      keyStore.deleteEntry(alias(keyId));
    } catch (GeneralSecurityException e) {
      throw new KeyCustodyException("Unable to delete key " + keyId, e);
    }
    try {
      persist();
    } catch (KeyCustodyException e) {
      // memory and file must keep agreeing on which keys exist
      restoreEntry(alias(keyId), removed);
      throw e;
    }
    log.debug("deleteKey(keyId={})", keyId);
  }

  @Override
  public synchronized void deleteAllManagedKeys() {
    try {
      List<String> managed = Collections.list(keyStore.aliases()).stream()
          .filter(alias -> alias.startsWith(KEY_ALIAS_PREFIX))
          .collect(Collectors.toList());
      for (String alias : managed) {
        keyStore.deleteEntry(alias);
      }
      persist();
      log.debug("deleteAllManagedKeys(): removed {}", managed.size());
    } catch (KeyStoreException e) {
      throw new KeyCustodyException("Unable to delete managed keys", e);
    }
  }

  @Override
  public synchronized RSAPublicKey publicKey(final String keyId) {
    try {
      Certificate certificate = keyStore.getCertificate(alias(keyId));
      if (certificate == null) {
        throw new KeyNotFoundException(keyId);
      }
      return (RSAPublicKey) certificate.getPublicKey();
    } catch (KeyStoreException e) {
      throw new KeyCustodyException("Key store unavailable", e);
    }
  }

  @Override
  public KeyMaterial keyMaterial(final String keyId) {
    return new KeyMaterial(keyId, publicKey(keyId), new PrivateKeyHandle(alias(keyId)), false);
  }

  @Override
  public String exportPublicJwks(final String keyId) {
    RSAKey jwk = new RSAKey.Builder(publicKey(keyId))
        .keyID(keyId)
        .keyUse(KeyUse.SIGNATURE)
        .algorithm(JWSAlgorithm.RS256)
        .build();
    return new JWKSet(jwk).toString(true);
  }

  @Override
  public synchronized byte[] sign(final String keyId, final byte[] signingInput) {
    try {
      Key key = keyStore.getKey(alias(keyId), protection);
      if (!(key instanceof PrivateKey privateKey)) {
        throw new KeyNotFoundException(keyId);
      }
      Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
      signature.initSign(privateKey);
      signature.update(signingInput);
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new KeyCustodyException("Unable to sign with key " + keyId, e);
    }
  }

  private X509Certificate selfSigned(final String keyId, final KeyPair keyPair)
      throws OperatorCreationException, GeneralSecurityException {
    Instant now = Instant.now();
    X500Name subject = new X500Name("CN=" + keyId);
    JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        subject,
        new BigInteger(64, random).abs().add(BigInteger.ONE),
        Date.from(now.minus(Duration.ofMinutes(1))),
        Date.from(now.plus(CERTIFICATE_VALIDITY)),
        subject,
        keyPair.getPublic());
    ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(keyPair.getPrivate());
    return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
  }

  private void persist() {
    if (backingFile == null) {
      return;
    }
    try {
      Path parent = backingFile.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, "keys", ".tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        keyStore.store(out, protection);
      }
      Files.move(temp, backingFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException | GeneralSecurityException e) {
      throw new KeyCustodyException("Unable to persist key store: " + backingFile, e);
    }
  }

  private void removeEntry(final String alias) {
    try {
      keyStore.deleteEntry(alias);
    } catch (KeyStoreException e) {
      log.error("removeEntry(): unable to discard unpersisted entry {}", alias, e);
    }
  }

  private void restoreEntry(final String alias, final KeyStore.Entry entry) {
    try {
      keyStore.setEntry(alias, entry, new KeyStore.PasswordProtection(protection));
    } catch (KeyStoreException e) {
      log.error("restoreEntry(): unable to restore entry {}", alias, e);
    }
  }

  private static String alias(final String keyId) {
    return KEY_ALIAS_PREFIX + keyId;
  }

  private static KeyStore emptyKeyStore() {
    try {
      KeyStore keyStore = KeyStore.getInstance(KEY_STORE_TYPE);
      keyStore.load(null, null);
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new KeyCustodyException("Key store type unavailable: " + KEY_STORE_TYPE, e);
    }
  }
}
