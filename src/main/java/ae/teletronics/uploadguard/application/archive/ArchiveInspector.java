package ae.teletronics.uploadguard.application.archive;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.archive.ArchiveEntryReader.EntryPayload;
import ae.teletronics.uploadguard.application.scanning.ScanBoundary;
import ae.teletronics.uploadguard.application.scanning.ThreatScanner;
import ae.teletronics.uploadguard.domain.model.ArchiveEntry;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.ArchivePolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Inspects archive members without extracting them to their declared paths.
 *
 * <p>Entries are visited in container order. Count, ratio and size limits are checked as each entry
 * is seen, so enumeration stops at the first breach; findings gathered up to that point are kept. The
 * ratio is checked before the absolute size cap. Nested archives are copied to a temporary sibling of
 * the outer file, bounded by the decode budget, and inspected one level deeper.</p>
 */
public class ArchiveInspector implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(ArchiveInspector.class);

    public static final String NAME = "archive";

    static final List<String> DEFAULT_BLOCKED_EXTENSIONS = List.of(
            "php", "phtml", "php3", "php4", "php5", "php7", "phps", "phar",
            "exe", "com", "bat", "cmd", "ps1", "vbs", "vbe", "js", "jse", "wsf", "wsh", "msc", "scr", "pif",
            "hta", "cpl", "sh", "bash", "zsh", "csh", "ksh", "jar", "war", "ear", "dll", "so", "dylib",
            "asp", "aspx", "jsp", "jspx", "cfm");

    static final Set<String> ARCHIVE_EXTENSIONS = Set.of(
            "zip", "tar", "gz", "tgz", "bz2", "tbz2", "xz", "txz", "7z", "rar", "cab", "iso");

    private static final Pattern TRAVERSAL = Pattern.compile("(^|[\\\\/])\\.\\.([\\\\/]|$)");
    private static final Pattern ABSOLUTE = Pattern.compile("^([\\\\/]|[A-Za-z]:)");
    private static final Pattern ENCODED_TRAVERSAL = Pattern.compile(
            "(%2e%2e|%2e\\.|\\.%2e)([\\\\/]|%2f|%5c)|\\.\\.(%2f|%5c)", Pattern.CASE_INSENSITIVE);

    private final AccessValidator access;
    private final Map<ArchiveFormat, ArchiveEntryReader> readers;

    public ArchiveInspector(AccessValidator access) {
        this(access, defaultReaders());
    }

    public ArchiveInspector(AccessValidator access, Map<ArchiveFormat, ArchiveEntryReader> readers) {
        this.access = access;
        this.readers = readers.isEmpty()
                ? new EnumMap<>(ArchiveFormat.class)
                : new EnumMap<>(readers);
    }

    public static Map<ArchiveFormat, ArchiveEntryReader> defaultReaders() {
        Map<ArchiveFormat, ArchiveEntryReader> readers = new EnumMap<>(ArchiveFormat.class);
        readers.put(ArchiveFormat.ZIP, new ZipEntryReader());
        readers.put(ArchiveFormat.TAR, new TarFamilyEntryReader(TarFamilyEntryReader.Compression.NONE));
        readers.put(ArchiveFormat.GZIP, new TarFamilyEntryReader(TarFamilyEntryReader.Compression.GZIP));
        readers.put(ArchiveFormat.BZIP2, new TarFamilyEntryReader(TarFamilyEntryReader.Compression.BZIP2));
        readers.put(ArchiveFormat.XZ, new TarFamilyEntryReader(TarFamilyEntryReader.Compression.XZ));
        readers.put(ArchiveFormat.SEVEN_ZIP, new SevenZipEntryReader());
        return readers;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return scan(target, policy, 0);
    }

    ScanResult scan(ScanTarget target, ScanPolicy policy, int depth) {
        return ScanBoundary.guard(NAME, ThreatType.ARCHIVE_THREAT, target, policy, access, log,
                () -> inspect(target, policy, depth));
    }

    private ScanResult inspect(ScanTarget target, ScanPolicy policy, int depth) throws IOException {
        ArchivePolicy limits = policy.archive();
        if (depth >= limits.maxDepth()) {
            return ScanResult.rejected(NAME, ThreatType.ARCHIVE_THREAT, "Archive nesting depth exceeds limit");
        }

        byte[] header = access.readPrefix(target.path(), ArchiveFormat.HEADER_LENGTH, policy.access());
        ArchiveFormat format = ArchiveFormat.detect(header);
        if (format == null) {
            return ScanResult.rejected(NAME, ThreatType.ARCHIVE_THREAT, "Unsupported archive format");
        }

        ScanResult.Builder result = ScanResult.builder(NAME).detail("archive.format", format.name().toLowerCase(Locale.ROOT));
        ArchiveEntryReader reader = readers.get(format);
        if (reader == null) {
            if (limits.failOpenWhenBackendMissing()) {
                log.info("No reader for {} archive {}, accepting unscanned", format, target.declaredName());
                return result.flag(ScanFlag.BACKEND_UNAVAILABLE).build();
            }
            return result.finding(ThreatType.ARCHIVE_THREAT,
                    format.name() + " scanning requires an archive backend that is not available").build();
        }

        EntryWalk walk;
        try (SeekableByteChannel channel = access.openChannel(target.path(), policy.access())) {
            walk = new EntryWalk(target, policy, depth, channel.size(), result);
            reader.read(channel, target.declaredName(), walk.decodeBudget(), walk::visit);
        }

        result.detail("archive.entries", walk.count)
                .detail("archive.uncompressedSize", walk.total)
                .detail("archive.ratio", walk.ratio());
        return result.build();
    }

    /** True when {@code uncompressed} is more than {@code maxRatio} times {@code archiveSize}. */
    static boolean exceedsRatio(long uncompressed, long archiveSize, long maxRatio) {
        if (archiveSize <= 0) {
            return uncompressed > 0;
        }
        return uncompressed > saturatingMultiply(archiveSize, maxRatio);
    }

    Set<String> blockedExtensions(ArchivePolicy policy) {
        Set<String> blocked = new LinkedHashSet<>(DEFAULT_BLOCKED_EXTENSIONS);
        policy.blockedExtensions().forEach(e -> blocked.add(e.toLowerCase(Locale.ROOT)));
        policy.excludeExtensions().forEach(e -> blocked.remove(e.toLowerCase(Locale.ROOT)));
        return blocked;
    }

    private static long saturatingMultiply(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        if ((hi == 0 && lo >= 0) || (hi == -1 && lo < 0)) {
            return lo;
        }
        return Long.MAX_VALUE;
    }

    private static String printable(String name) {
        return name.replace("\0", "\\0");
    }

    private static String baseName(String name) {
        String normalized = name.replace('\\', '/');
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    /** State of one pass over an archive's entries. */
    private final class EntryWalk {
        private final ScanTarget target;
        private final ScanPolicy policy;
        private final ArchivePolicy limits;
        private final int depth;
        private final long archiveSize;
        private final ScanResult.Builder result;
        private final Set<String> blocked;

        int count;
        long total;

        EntryWalk(ScanTarget target, ScanPolicy policy, int depth, long archiveSize, ScanResult.Builder result) {
            this.target = target;
            this.policy = policy;
            this.limits = policy.archive();
            this.depth = depth;
            this.archiveSize = archiveSize;
            this.result = result;
            this.blocked = blockedExtensions(limits);
        }

        long decodeBudget() {
            return Math.min(limits.maxUncompressedSize(), saturatingMultiply(Math.max(archiveSize, 1), limits.maxCompressionRatio()));
        }

        long ratio() {
            return archiveSize > 0 ? total / archiveSize : 0;
        }

        boolean visit(ArchiveEntry entry, EntryPayload payload) throws IOException {
            count++;
            if (count > limits.maxFiles()) {
                result.finding(ThreatType.ARCHIVE_THREAT,
                        "Archive contains too many files (more than " + limits.maxFiles() + ")");
                return false;
            }

            long size = Math.max(entry.uncompressedSize(), 0);
            total = total > Long.MAX_VALUE - size ? Long.MAX_VALUE : total + size;
            if (exceedsRatio(total, archiveSize, limits.maxCompressionRatio())) {
                result.finding(ThreatType.DECOMPRESSION_BOMB,
                        "Potential zip bomb detected: compression ratio " + ratio() + ":1");
                return false;
            }
            if (total > limits.maxUncompressedSize()) {
                result.finding(ThreatType.DECOMPRESSION_BOMB, "Archive uncompressed size exceeds limit");
                return false;
            }

            checkName(entry.name());
            if (entry.isDirectory()) {
                return true;
            }
            String base = baseName(entry.name());
            String extension = ScanTarget.extensionOf(base);
            checkExtension(entry.name(), base, extension);
            if (ARCHIVE_EXTENSIONS.contains(extension)) {
                inspectNested(entry, payload);
            }
            return true;
        }

        private void checkName(String name) {
            String shown = printable(name);
            if (TRAVERSAL.matcher(name).find()) {
                result.finding(ThreatType.ARCHIVE_THREAT, "Path traversal detected: " + shown);
            }
            if (ABSOLUTE.matcher(name).find()) {
                result.finding(ThreatType.ARCHIVE_THREAT, "Absolute path detected in archive: " + shown);
            }
            if (ENCODED_TRAVERSAL.matcher(name).find()) {
                result.finding(ThreatType.ARCHIVE_THREAT, "URL-encoded path traversal detected: " + shown);
            }
            if (name.indexOf('\0') >= 0) {
                result.finding(ThreatType.ARCHIVE_THREAT, "Null byte in filename detected: " + shown);
            }
        }

        private void checkExtension(String name, String base, String extension) {
            if (blocked.contains(extension)) {
                result.finding(ThreatType.ARCHIVE_THREAT, "Dangerous file detected in archive: " + printable(name));
                return;
            }
            int dot = base.lastIndexOf('.');
            if (dot > 0) {
                String inner = ScanTarget.extensionOf(base.substring(0, dot));
                if (blocked.contains(inner)) {
                    result.finding(ThreatType.ARCHIVE_THREAT, "Hidden dangerous extension detected: " + printable(name));
                }
            }
        }

        private void inspectNested(ArchiveEntry entry, EntryPayload payload) throws IOException {
            result.flag(ScanFlag.NESTED_ARCHIVE);
            String prefix = printable(entry.name()) + ": ";
            if (depth + 1 >= limits.maxDepth()) {
                result.finding(ThreatType.ARCHIVE_THREAT, prefix + "Archive nesting depth exceeds limit");
                return;
            }
            if (payload == null) {
                result.finding(ThreatType.ARCHIVE_THREAT, "Nested archive could not be inspected: " + printable(entry.name()));
                return;
            }

            Path parent = target.path().toAbsolutePath().getParent();
            Path nested = Files.createTempFile(parent, ".nested-", ".tmp");
            try {
                long budget = decodeBudget();
                long copied;
                try (InputStream in = payload.open(); OutputStream out = Files.newOutputStream(nested)) {
                    copied = copyBounded(in, out, budget + 1);
                }
                if (copied > budget) {
                    result.finding(ThreatType.DECOMPRESSION_BOMB, prefix + "Archive uncompressed size exceeds limit");
                    return;
                }
                ScanResult inner = scan(new ScanTarget(nested, baseName(entry.name())), policy, depth + 1);
                result.mergePrefixed(inner, prefix);
            } finally {
                Files.deleteIfExists(nested);
            }
        }

        private long copyBounded(InputStream in, OutputStream out, long limit) throws IOException {
            byte[] buf = new byte[8192];
            long copied = 0;
            int r;
            while (copied < limit && (r = in.read(buf, 0, (int) Math.min(buf.length, limit - copied))) != -1) {
                out.write(buf, 0, r);
                copied += r;
            }
            return copied;
        }
    }
}
