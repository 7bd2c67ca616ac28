package org.javai.dialogs.config;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-CBC encryption of configuration secrets.
 *
 * <p>The key is a base64-encoded 32-byte value. Encrypted values have the form
 * {@code base64(iv)!base64(cipherText)}.</p>
 */
public final class SecretCipher {

	private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
	private static final int KEY_LENGTH = 32;
	private static final int IV_LENGTH = 16;
	private static final char SEPARATOR = '!';
	private static final SecureRandom RANDOM = new SecureRandom();

	private SecretCipher() {
	}

	/**
	 * A fresh random key, base64-encoded.
	 */
	public static String generateKey() {
		byte[] key = new byte[KEY_LENGTH];
		RANDOM.nextBytes(key);
		return Base64.getEncoder().encodeToString(key);
	}

	public static String encrypt(String plainText, String key) {
		if (plainText == null || plainText.isEmpty()) {
			return plainText;
		}
		byte[] iv = new byte[IV_LENGTH];
		RANDOM.nextBytes(iv);
		try {
			Cipher cipher = Cipher.getInstance(TRANSFORMATION);
			cipher.init(Cipher.ENCRYPT_MODE, keySpec(key), new IvParameterSpec(iv));
			byte[] cipherText = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
			Base64.Encoder encoder = Base64.getEncoder();
			return encoder.encodeToString(iv) + SEPARATOR + encoder.encodeToString(cipherText);
		} catch (GeneralSecurityException e) {
			throw new ConfigurationException("Failed to encrypt secret", e);
		}
	}

	/**
	 * @throws ConfigurationException if the value is not in the encrypted form or the key is wrong
	 * @throws IllegalArgumentException if the key is not a base64-encoded 32-byte key
	 */
	public static String decrypt(String encrypted, String key) {
		if (encrypted == null || encrypted.isEmpty()) {
			return encrypted;
		}
		int separator = encrypted.indexOf(SEPARATOR);
		if (separator < 0) {
			throw new ConfigurationException("Value is not an encrypted secret");
		}
		SecretKeySpec keySpec = keySpec(key);
		try {
			Base64.Decoder decoder = Base64.getDecoder();
			byte[] iv = decoder.decode(encrypted.substring(0, separator));
			byte[] cipherText = decoder.decode(encrypted.substring(separator + 1));
			Cipher cipher = Cipher.getInstance(TRANSFORMATION);
			cipher.init(Cipher.DECRYPT_MODE, keySpec, new IvParameterSpec(iv));
			return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
		} catch (GeneralSecurityException | IllegalArgumentException e) {
			throw new ConfigurationException("Failed to decrypt secret", e);
		}
	}

	private static SecretKeySpec keySpec(String key) {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key must not be blank");
		}
		byte[] bytes;
		try {
			bytes = Base64.getDecoder().decode(key);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("key must be base64-encoded", e);
		}
		if (bytes.length != KEY_LENGTH) {
			throw new IllegalArgumentException("key must be " + KEY_LENGTH + " bytes, got " + bytes.length);
		}
		return new SecretKeySpec(bytes, "AES");
	}
}
