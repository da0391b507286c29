package ae.teletronics.uploadguard.application.archive;

import ae.teletronics.uploadguard.domain.model.ArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * Reads 7z archive headers (Apache Commons Compress, LZMA via XZ for Java). Sizes come from the header;
 * per-entry compressed sizes are not recorded by the format.
 */
public class SevenZipEntryReader implements ArchiveEntryReader {

    @Override
    public void read(SeekableByteChannel archive, String declaredName, long decodeBudget, EntryVisitor visitor) throws IOException {
        try (SevenZFile sevenZ = SevenZFile.builder().setSeekableByteChannel(archive).get()) {
            for (SevenZArchiveEntry e : sevenZ.getEntries()) {
                long size = e.hasStream() ? e.getSize() : 0;
                ArchiveEntry entry = new ArchiveEntry(Objects.toString(e.getName(), ""), -1, size);
                EntryPayload payload = e.hasStream() && !e.isDirectory() ? () -> sevenZ.getInputStream(e) : null;
                if (!visitor.visit(entry, payload)) {
                    return;
                }
            }
        }
    }
}
