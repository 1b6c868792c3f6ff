package nl.pim16aap2.protonkeeper.manager.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers producing the lower-case hex digests used by integrity checks.
 */
public final class HashUtil
{
    private HashUtil()
    {
    }

    public static String sha256(byte[] input)
    {
        return toHex(newSha256Digest().digest(input));
    }

    public static String sha256(String input)
    {
        return sha256(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a new SHA-256 digest for hashing a payload while it is being streamed.
     *
     * @return The new digest.
     */
    public static MessageDigest newSha256Digest()
    {
        try
        {
            return MessageDigest.getInstance("SHA-256");
        }
        catch (NoSuchAlgorithmException exception)
        {
            throw new IllegalStateException("SHA-256 is unavailable in the current JVM.", exception);
        }
    }

    public static String toHex(byte[] bytes)
    {
        final StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (final byte value : bytes)
            hex.append(Character.forDigit((value >>> 4) & 0xF, 16)).append(Character.forDigit(value & 0xF, 16));
        return hex.toString();
    }
}
