package dev.jbang.harvest.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Utility class for computing digests */
public class HashUtils {

	/**
	 * Compute a hash over a sequence of strings. Every part is fed as {@code <length>:<value>} so
	 * that no two distinct sequences produce the same digest input.
	 *
	 * @param algorithm The hash algorithm (SHA-1, SHA-256, ...)
	 * @param parts The values to hash, none of them null
	 * @return The hex-encoded hash
	 */
	public static String computeHash(String algorithm, String... parts) {
		try {
			MessageDigest digest = MessageDigest.getInstance(algorithm);
			for (String part : parts) {
				if (part == null) {
					throw new IllegalArgumentException("Cannot hash a null value");
				}
				digest.update((part.length() + ":" + part).getBytes(StandardCharsets.UTF_8));
			}
			return bytesToHex(digest.digest());
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalArgumentException("Hash algorithm not supported: " + algorithm, e);
		}
	}

	/** Convert byte array to hex string */
	private static String bytesToHex(byte[] bytes) {
		StringBuilder result = new StringBuilder();
		for (byte b : bytes) {
			result.append(String.format("%02x", b));
		}
		return result.toString();
	}
}
