package nl.pim16aap2.protonkeeper.manager.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilTest
{
    private static final String ABC_DIGEST = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void sha256_shouldMatchKnownDigestForStringAndBytes()
    {
        // execute
        final String fromString = HashUtil.sha256("abc");
        final String fromBytes = HashUtil.sha256("abc".getBytes(StandardCharsets.UTF_8));

        // verify
        assertThat(fromString).isEqualTo(ABC_DIGEST).isEqualTo(fromBytes);
    }

    @Test
    void newSha256Digest_shouldProduceSameDigestWhenFedInChunks()
    {
        // setup
        final byte[] payload = "abc".repeat(5_000).getBytes(StandardCharsets.UTF_8);
        final MessageDigest digest = HashUtil.newSha256Digest();

        // execute
        for (int offset = 0; offset < payload.length; offset += 4_096)
            digest.update(payload, offset, Math.min(4_096, payload.length - offset));

        // verify
        assertThat(HashUtil.toHex(digest.digest())).isEqualTo(HashUtil.sha256(payload));
    }

    @Test
    void toHex_shouldKeepLeadingZerosInLowerCase()
    {
        // execute
        final String hex = HashUtil.toHex(new byte[]{0x00, 0x0f, (byte) 0xAB});

        // verify
        assertThat(hex).isEqualTo("000fab");
    }
}
