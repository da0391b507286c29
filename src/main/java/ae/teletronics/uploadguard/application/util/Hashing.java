package ae.teletronics.uploadguard.application.util;

import ae.teletronics.uploadguard.ports.StreamSource;

import java.io.IOException;
import java.io.InputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {
    private Hashing() {}

    public static String sha256Hex(StreamSource source) throws IOException {
        MessageDigest md = newDigest();
        try (InputStream in = new DigestInputStream(source.openStream(), md)) {
            byte[] buf = new byte[8192];
            while (in.read(buf) != -1) { /* drain */ }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
