package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

import static ae.teletronics.uploadguard.domain.policy.CodePolicy.copy;

/**
 * Resource limits and extension rules for archive inspection.
 *
 * @param maxCompressionRatio        uncompressed total may be at most this many times the archive size
 * @param maxUncompressedSize        bytes, summed over all entries
 * @param maxFiles                   entry count including directories
 * @param maxDepth                   nesting limit; the outermost archive is depth 0
 * @param failOpenWhenBackendMissing accept formats we have no reader for instead of rejecting them
 * @param blockedExtensions          added to the built-in blocked list
 * @param excludeExtensions          removed from the effective blocked list
 */
public record ArchivePolicy(boolean enabled,
                            long maxCompressionRatio,
                            long maxUncompressedSize,
                            int maxFiles,
                            int maxDepth,
                            boolean failOpenWhenBackendMissing,
                            List<String> blockedExtensions,
                            List<String> excludeExtensions) {

    public static final long DEFAULT_MAX_RATIO = 100;
    public static final long DEFAULT_MAX_UNCOMPRESSED = 500L * 1024 * 1024;
    public static final int DEFAULT_MAX_FILES = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 3;

    public ArchivePolicy {
        if (maxCompressionRatio <= 0) throw new IllegalArgumentException("maxCompressionRatio must be > 0");
        if (maxUncompressedSize <= 0) throw new IllegalArgumentException("maxUncompressedSize must be > 0");
        if (maxFiles <= 0) throw new IllegalArgumentException("maxFiles must be > 0");
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
        blockedExtensions = copy(blockedExtensions);
        excludeExtensions = copy(excludeExtensions);
    }

    public static ArchivePolicy defaults() {
        return new ArchivePolicy(true, DEFAULT_MAX_RATIO, DEFAULT_MAX_UNCOMPRESSED, DEFAULT_MAX_FILES,
                DEFAULT_MAX_DEPTH, false, List.of(), List.of());
    }

    public ArchivePolicy withLimits(long ratio, long uncompressed, int files, int depth) {
        return new ArchivePolicy(enabled, ratio, uncompressed, files, depth, failOpenWhenBackendMissing,
                blockedExtensions, excludeExtensions);
    }

    public ArchivePolicy withFailOpen(boolean failOpen) {
        return new ArchivePolicy(enabled, maxCompressionRatio, maxUncompressedSize, maxFiles, maxDepth, failOpen,
                blockedExtensions, excludeExtensions);
    }

    public ArchivePolicy withExtensions(List<String> blocked, List<String> excluded) {
        return new ArchivePolicy(enabled, maxCompressionRatio, maxUncompressedSize, maxFiles, maxDepth,
                failOpenWhenBackendMissing, blocked, excluded);
    }
}
