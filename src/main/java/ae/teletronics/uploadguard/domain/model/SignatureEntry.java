package ae.teletronics.uploadguard.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A magic-byte prefix expected at {@code offset}, mapped to a media type.
 */
public record SignatureEntry(int offset, byte[] prefix, String mediaType, Refinement refinement) {

    public enum Refinement {
        NONE,
        /** Look for OOXML part folders inside the prefix window. */
        ZIP_CONTAINER,
        /** Read the RIFF form type at offset 8. */
        RIFF_CONTAINER,
        /** Read the ISO base-media major brand at offset 8. */
        ISO_BMFF,
        /** Check an XML document for an SVG root. */
        XML_ROOT
    }

    public SignatureEntry {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(mediaType, "mediaType");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        if (prefix.length == 0) throw new IllegalArgumentException("prefix must not be empty");
        prefix = prefix.clone();
        refinement = refinement == null ? Refinement.NONE : refinement;
    }

    public static SignatureEntry of(String mediaType, int... bytes) {
        return new SignatureEntry(0, toBytes(bytes), mediaType, Refinement.NONE);
    }

    public static SignatureEntry ascii(String mediaType, String text) {
        return new SignatureEntry(0, text.getBytes(StandardCharsets.ISO_8859_1), mediaType, Refinement.NONE);
    }

    public SignatureEntry refinedBy(Refinement r) {
        return new SignatureEntry(offset, prefix, mediaType, r);
    }

    public boolean matches(byte[] window) {
        if (window.length < offset + prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (window[offset + i] != prefix[i]) return false;
        }
        return true;
    }

    @Override
    public byte[] prefix() {
        return prefix.clone();
    }

    public int length() {
        return offset + prefix.length;
    }

    private static byte[] toBytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) out[i] = (byte) values[i];
        return out;
    }
}
