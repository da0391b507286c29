package ae.teletronics.uploadguard.application.archive;

import ae.teletronics.uploadguard.domain.model.ArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.apache.commons.io.input.CloseShieldInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.util.Locale;

/**
 * Reads tar archives, plain or wrapped in gzip, bzip2 or xz (Apache Commons Compress). Entries are
 * read sequentially from tar headers; payloads are skipped unless a visitor opens them.
 *
 * <p>A compressed stream that does not contain a tar archive is reported as a single member named after
 * the upload minus its compression suffix. Its size is learnt by decompressing, never past the decode
 * budget.</p>
 */
public class TarFamilyEntryReader implements ArchiveEntryReader {

    public enum Compression { NONE, GZIP, BZIP2, XZ }

    private static final int TAR_RECORD = 512;

    private final Compression compression;

    public TarFamilyEntryReader(Compression compression) {
        this.compression = compression;
    }

    @Override
    public void read(SeekableByteChannel archive, String declaredName, long decodeBudget, EntryVisitor visitor) throws IOException {
        try (InputStream in = new BufferedInputStream(decompress(fromStart(archive)))) {
            in.mark(TAR_RECORD + 1);
            byte[] head = in.readNBytes(TAR_RECORD);
            in.reset();

            if (compression == Compression.NONE || TarArchiveInputStream.matches(head, head.length)) {
                readTar(in, visitor);
            } else {
                readSingleStream(in, archive, declaredName, decodeBudget, visitor);
            }
        }
    }

    private void readTar(InputStream in, EntryVisitor visitor) throws IOException {
        TarArchiveInputStream tar = new TarArchiveInputStream(in);
        TarArchiveEntry e;
        while ((e = tar.getNextEntry()) != null) {
            long compressed = compression == Compression.NONE ? e.getSize() : -1;
            ArchiveEntry entry = new ArchiveEntry(e.getName(), compressed, e.getSize());
            EntryPayload payload = e.isFile() ? () -> CloseShieldInputStream.wrap(tar) : null;
            if (!visitor.visit(entry, payload)) {
                return;
            }
        }
    }

    private void readSingleStream(InputStream in, SeekableByteChannel archive, String declaredName, long decodeBudget,
                                  EntryVisitor visitor) throws IOException {
        byte[] buf = new byte[8192];
        long total = 0;
        int r;
        while (total <= decodeBudget && (r = in.read(buf)) != -1) {
            total += r;
        }
        ArchiveEntry entry = new ArchiveEntry(memberName(declaredName), archive.size(), total);
        visitor.visit(entry, () -> decompress(fromStart(archive)));
    }

    /** Reads the channel from offset 0; closing the stream leaves the channel open for a second pass. */
    private static InputStream fromStart(SeekableByteChannel archive) throws IOException {
        archive.position(0);
        return CloseShieldInputStream.wrap(Channels.newInputStream(archive));
    }

    private InputStream decompress(InputStream raw) throws IOException {
        InputStream buffered = new BufferedInputStream(raw);
        try {
            return switch (compression) {
                case NONE -> buffered;
                case GZIP -> new GzipCompressorInputStream(buffered, true);
                case BZIP2 -> new BZip2CompressorInputStream(buffered, true);
                case XZ -> new XZCompressorInputStream(buffered, true);
            };
        } catch (IOException | RuntimeException e) {
            buffered.close();
            throw e;
        }
    }

    static String memberName(String declaredName) {
        String name = declaredName == null ? "" : declaredName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tgz") || lower.endsWith(".tbz2") || lower.endsWith(".txz")) {
            return name.substring(0, name.lastIndexOf('.')) + ".tar";
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
