package ae.teletronics.uploadguard.application.archive;

import ae.teletronics.uploadguard.domain.model.ArchiveEntry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;

/**
 * Enumerates the members of one container format without extracting them.
 */
public interface ArchiveEntryReader {

    /**
     * Walks the entries in container order until the visitor returns false or the entries run out.
     *
     * @param archive channel opened by the caller; a reader may close it when done
     * @param declaredName name the archive was uploaded under, used to name the member of a bare compressed stream
     * @param decodeBudget most bytes a reader may decompress to learn a size the container does not record
     */
    void read(SeekableByteChannel archive, String declaredName, long decodeBudget, EntryVisitor visitor) throws IOException;

    @FunctionalInterface
    interface EntryVisitor {
        /**
         * @param payload opens the member's content, or null when the reader cannot provide it
         * @return false to stop the walk
         */
        boolean visit(ArchiveEntry entry, EntryPayload payload) throws IOException;
    }

    /**
     * Content of one member. Only valid during the {@link EntryVisitor#visit} call it was passed to.
     */
    @FunctionalInterface
    interface EntryPayload {
        InputStream open() throws IOException;
    }
}
