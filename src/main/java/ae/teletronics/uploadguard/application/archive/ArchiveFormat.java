package ae.teletronics.uploadguard.application.archive;

import java.nio.charset.StandardCharsets;

/**
 * Container formats the inspector can recognise. Gzip, bzip2 and xz are compressed streams that usually,
 * but not always, wrap a tar archive.
 */
public enum ArchiveFormat {
    ZIP, TAR, GZIP, BZIP2, XZ, SEVEN_ZIP, RAR;

    /** Enough to reach the ustar magic at offset 257. */
    public static final int HEADER_LENGTH = 262;

    private static final byte[] ZIP_LOCAL = {0x50, 0x4B, 0x03, 0x04};
    private static final byte[] ZIP_EMPTY = {0x50, 0x4B, 0x05, 0x06};
    private static final byte[] GZIP_MAGIC = {0x1F, (byte) 0x8B};
    private static final byte[] BZIP2_MAGIC = {'B', 'Z', 'h'};
    private static final byte[] XZ_MAGIC = {(byte) 0xFD, '7', 'z', 'X', 'Z', 0x00};
    private static final byte[] RAR_MAGIC = {'R', 'a', 'r', '!', 0x1A, 0x07};
    private static final byte[] SEVEN_ZIP_MAGIC = {'7', 'z', (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C};
    private static final byte[] USTAR = "ustar".getBytes(StandardCharsets.US_ASCII);

    /**
     * @return the format, or null when the header matches no supported container
     */
    public static ArchiveFormat detect(byte[] header) {
        if (header == null) return null;
        if (startsWith(header, 0, ZIP_LOCAL) || startsWith(header, 0, ZIP_EMPTY)) return ZIP;
        if (startsWith(header, 0, GZIP_MAGIC)) return GZIP;
        if (startsWith(header, 0, BZIP2_MAGIC)) return BZIP2;
        if (startsWith(header, 0, XZ_MAGIC)) return XZ;
        if (startsWith(header, 0, RAR_MAGIC)) return RAR;
        if (startsWith(header, 0, SEVEN_ZIP_MAGIC)) return SEVEN_ZIP;
        if (startsWith(header, 257, USTAR)) return TAR;
        return null;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) return false;
        for (int i = 0; i < magic.length; i++) {
            if (data[offset + i] != magic[i]) return false;
        }
        return true;
    }
}
