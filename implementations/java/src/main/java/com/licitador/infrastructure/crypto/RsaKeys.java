package com.licitador.infrastructure.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * RSA helpers for one-time key pairs.
 *
 * <p>Public keys travel as base64 X.509 SubjectPublicKeyInfo, private keys as
 * base64 PKCS#8. Field values use RSA-OAEP with SHA-256 for both the label hash
 * and MGF1, matching WebCrypto's {@code RSA-OAEP}/{@code SHA-256}.
 */
public final class RsaKeys {

    public static final int DEFAULT_KEY_SIZE = 2048;

    private static final String KEY_ALGORITHM = "RSA";
    private static final String OAEP_TRANSFORMATION = "RSA/ECB/OAEPPadding";

    // The JCA name "OAEPWithSHA-256AndMGF1Padding" defaults MGF1 to SHA-1; parameters are given explicitly
    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
        "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private RsaKeys() {}

    /**
     * Base64-encoded halves of a freshly generated RSA key pair.
     */
    public record EncodedKeyPair(String publicKey, String privateKey) {
        @Override
        public String toString() {
            return "EncodedKeyPair[publicKey=" + publicKey + ", privateKey=****]";
        }
    }

    public static EncodedKeyPair generate(int keySize) throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
        generator.initialize(keySize, SECURE_RANDOM);
        java.security.KeyPair pair = generator.generateKeyPair();

        Base64.Encoder encoder = Base64.getEncoder();
        return new EncodedKeyPair(
            encoder.encodeToString(pair.getPublic().getEncoded()),
            encoder.encodeToString(pair.getPrivate().getEncoded())
        );
    }

    public static PrivateKey importPrivateKey(String privateKeyBase64) throws GeneralSecurityException {
        return KeyFactory.getInstance(KEY_ALGORITHM)
            .generatePrivate(new PKCS8EncodedKeySpec(decodeKey(privateKeyBase64)));
    }

    public static PublicKey importPublicKey(String publicKeyBase64) throws GeneralSecurityException {
        return KeyFactory.getInstance(KEY_ALGORITHM)
            .generatePublic(new X509EncodedKeySpec(decodeKey(publicKeyBase64)));
    }

    /**
     * Encrypt with a public key. Used by callers that play the client role.
     */
    public static byte[] encrypt(PublicKey publicKey, byte[] plaintext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(OAEP_TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256);
        return cipher.doFinal(plaintext);
    }

    public static byte[] decrypt(PrivateKey privateKey, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(OAEP_TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
        return cipher.doFinal(ciphertext);
    }

    private static byte[] decodeKey(String base64) throws InvalidKeySpecException {
        if (base64 == null || base64.isEmpty()) {
            throw new InvalidKeySpecException("Key is empty");
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Key is not valid Base64", e);
        }
    }
}
