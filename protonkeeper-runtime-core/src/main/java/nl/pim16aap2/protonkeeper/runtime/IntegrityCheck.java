package nl.pim16aap2.protonkeeper.runtime;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * The integrity information a registry declares for an asset.
 * <p>
 * When a SHA-256 digest is available it is authoritative. Otherwise, the declared byte size is checked instead.
 *
 * @param sha256
 *     The lowercase hex SHA-256 digest of the asset, or {@code null} if the registry does not publish one.
 * @param sizeBytes
 *     The declared size of the asset in bytes, or {@code -1} if unknown.
 */
public record IntegrityCheck(@Nullable String sha256, long sizeBytes)
{
    public IntegrityCheck
    {
        if (sha256 != null)
        {
            sha256 = sha256.trim().toLowerCase(Locale.ROOT);
            if (!sha256.matches("[0-9a-f]{64}"))
                throw new IllegalArgumentException("Invalid SHA-256 digest: '%s'.".formatted(sha256));
        }
        if (sha256 == null && sizeBytes < 0)
            throw new IllegalArgumentException("An integrity check needs a digest or a declared size.");
    }

    public static IntegrityCheck ofSha256(String sha256, long sizeBytes)
    {
        return new IntegrityCheck(sha256, sizeBytes);
    }

    public static IntegrityCheck ofSize(long sizeBytes)
    {
        return new IntegrityCheck(null, sizeBytes);
    }

    public boolean hasDigest()
    {
        return sha256 != null;
    }

    /**
     * Checks a downloaded payload against this declaration.
     *
     * @param actualSha256
     *     The SHA-256 digest computed while downloading.
     * @param actualSize
     *     The number of bytes written.
     * @return {@code null} if the payload matches, otherwise a description of the mismatch.
     */
    public @Nullable String mismatch(String actualSha256, long actualSize)
    {
        if (sha256 != null)
        {
            if (!sha256.equalsIgnoreCase(actualSha256))
                return "expected SHA-256 %s but got %s".formatted(sha256, actualSha256);
            return null;
        }
        if (sizeBytes != actualSize)
            return "expected %d bytes but got %d".formatted(sizeBytes, actualSize);
        return null;
    }
}
