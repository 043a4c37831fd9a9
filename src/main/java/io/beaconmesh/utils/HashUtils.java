package io.beaconmesh.utils;

import lombok.NoArgsConstructor;

import static lombok.AccessLevel.PRIVATE;
import static org.apache.commons.codec.binary.Hex.encodeHexString;
import static org.apache.commons.codec.digest.DigestUtils.getSha256Digest;
import static org.apache.commons.lang3.ArrayUtils.subarray;

@NoArgsConstructor(access = PRIVATE)
public class HashUtils {

    /**
     * Bytes of a SHA-256 hash kept by {@link #truncatedHash(byte[])}
     */
    public static final int TRUNCATED_HASH_BYTES = 16;

    public static byte[] fullHash(final byte[] data) {
        return getSha256Digest().digest(data);
    }

    /**
     * Get a truncated SHA-256 hash of passed data.
     *
     * @param data Data to be hashed.
     * @return Truncated SHA-256 hash
     */
    public static byte[] truncatedHash(final byte[] data) {
        return subarray(fullHash(data), 0, TRUNCATED_HASH_BYTES);
    }

    public static String truncatedHashHex(final byte[] data) {
        return encodeHexString(truncatedHash(data));
    }
}
