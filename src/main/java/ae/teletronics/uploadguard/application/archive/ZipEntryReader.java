package ae.teletronics.uploadguard.application.archive;

import ae.teletronics.uploadguard.domain.model.ArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;

/**
 * Reads entry names and sizes from the zip central directory; nothing is inflated unless a visitor opens
 * a payload.
 */
public class ZipEntryReader implements ArchiveEntryReader {

    @Override
    public void read(SeekableByteChannel archive, String declaredName, long decodeBudget, EntryVisitor visitor) throws IOException {
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(archive)
                .setCharset(StandardCharsets.UTF_8)
                .get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry e = entries.nextElement();
                ArchiveEntry entry = new ArchiveEntry(rawName(e), e.getCompressedSize(), e.getSize());
                EntryPayload payload = e.isDirectory() ? null : () -> zip.getInputStream(e);
                if (!visitor.visit(entry, payload)) {
                    return;
                }
            }
        }
    }

    /** Name as stored; {@link ZipArchiveEntry#getName()} turns DOS backslashes into slashes. */
    private static String rawName(ZipArchiveEntry e) {
        byte[] raw = e.getRawName();
        return raw == null ? e.getName() : new String(raw, StandardCharsets.UTF_8);
    }
}
