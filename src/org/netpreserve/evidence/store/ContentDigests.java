package org.netpreserve.evidence.store;

import org.netpreserve.jwarc.WarcDigest;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Payload digests in the form the Wayback CDX index reports them: Base32 SHA-1 without an algorithm prefix.
 */
public final class ContentDigests {
    private ContentDigests() {
    }

    public static String sha1(byte[] data) {
        var digest = newSha1();
        digest.update(data);
        return unprefixed(new WarcDigest(digest));
    }

    /**
     * Digest of everything remaining in the stream. Doesn't close it.
     */
    public static String sha1(InputStream in) throws IOException {
        var digest = newSha1();
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) != -1) {
            digest.update(buffer, 0, n);
        }
        return unprefixed(new WarcDigest(digest));
    }

    private static MessageDigest newSha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    static String unprefixed(WarcDigest digest) {
        String prefixed = digest.prefixedBase32();
        return prefixed.substring(prefixed.indexOf(':') + 1);
    }

    /**
     * Whether the string looks like a Base32 SHA-1 digest, i.e. is safe to use as a file name.
     */
    public static boolean isValid(String digest) {
        if (digest.length() != 32) return false;
        for (int i = 0; i < digest.length(); i++) {
            char c = digest.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || (c >= '2' && c <= '7'))) return false;
        }
        return true;
    }
}
