package ae.teletronics.uploadguard.domain.model;

/**
 * Central-directory view of one archive member. Sizes are -1 when the container does not record them.
 */
public record ArchiveEntry(String name, long compressedSize, long uncompressedSize) {

    public boolean isDirectory() {
        return name.endsWith("/") || name.endsWith("\\");
    }
}
