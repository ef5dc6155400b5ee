package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Optional;

/**
 * Decrypts Chromium "v10" cookie values on Linux.
 *
 * <p>Without a keyring Chromium encrypts with AES-128-CBC under a PBKDF2-HMAC-SHA1 key
 * derived from the password "peanuts" (salt "saltysalt", one iteration) and an IV of sixteen
 * spaces. Since Chromium 130 the plaintext starts with SHA-256 of the cookie host, which is
 * removed. Keyring-protected "v11" values are not supported.
 */
public class ChromiumCookieDecryptor {
    private static final Logger log = LoggerFactory.getLogger(ChromiumCookieDecryptor.class);

    static final String V10 = "v10";
    private static final byte[] IV = "                ".getBytes(StandardCharsets.US_ASCII);
    private static final int HOST_DIGEST_LEN = 32;

    private final SecretKeySpec key;

    public ChromiumCookieDecryptor() {
        this.key = v10Key();
    }

    public Optional<String> decrypt(byte[] encrypted, String hostKey) {
        if (encrypted == null || encrypted.length <= V10.length()) return Optional.empty();

        String prefix = new String(encrypted, 0, V10.length(), StandardCharsets.US_ASCII);
        if (!V10.equals(prefix)) {
            log.debug("[Cookies] unsupported encrypted cookie format {} host={}", prefix, hostKey);
            return Optional.empty();
        }

        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(IV));
            byte[] plain = cipher.doFinal(encrypted, V10.length(), encrypted.length - V10.length());
            return Optional.of(new String(stripHostDigest(plain, hostKey), StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.debug("[Cookies] v10 decryption failed host={}: {}", hostKey, e.getMessage());
            return Optional.empty();
        }
    }

    static byte[] stripHostDigest(byte[] plain, String hostKey) throws GeneralSecurityException {
        if (hostKey == null || plain.length < HOST_DIGEST_LEN) return plain;
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(hostKey.getBytes(StandardCharsets.UTF_8));
        if (Arrays.equals(digest, Arrays.copyOf(plain, HOST_DIGEST_LEN))) {
            return Arrays.copyOfRange(plain, HOST_DIGEST_LEN, plain.length);
        }
        return plain;
    }

    static SecretKeySpec v10Key() {
        try {
            PBEKeySpec spec = new PBEKeySpec("peanuts".toCharArray(),
                    "saltysalt".getBytes(StandardCharsets.US_ASCII), 1, 128);
            byte[] raw = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA1").generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA1 unavailable", e);
        }
    }

    static byte[] iv() {
        return IV.clone();
    }
}
