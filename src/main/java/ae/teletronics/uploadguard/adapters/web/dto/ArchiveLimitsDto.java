package ae.teletronics.uploadguard.adapters.web.dto;

import ae.teletronics.uploadguard.domain.policy.ArchivePolicy;

public record ArchiveLimitsDto(
        long maxCompressionRatio,
        long maxUncompressedSize,
        int maxFiles,
        int maxDepth,
        boolean failOpenWhenBackendMissing
) {
    public static ArchiveLimitsDto from(ArchivePolicy p) {
        return new ArchiveLimitsDto(
                p.maxCompressionRatio(),
                p.maxUncompressedSize(),
                p.maxFiles(),
                p.maxDepth(),
                p.failOpenWhenBackendMissing()
        );
    }
}
