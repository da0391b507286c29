package ae.teletronics.uploadguard.domain.policy;

import java.util.Objects;

/**
 * Immutable, per-invocation configuration of every scanner. Built once from configuration at startup;
 * tests derive variants with the {@code with*} methods.
 */
public record ScanPolicy(AccessPolicy access,
                         DetectionPolicy detection,
                         CodePolicy code,
                         MarkupPolicy markup,
                         DocumentPolicy document,
                         MacroPolicy macro,
                         MetadataPolicy metadata,
                         ArchivePolicy archive) {

    public ScanPolicy {
        Objects.requireNonNull(access, "access");
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(markup, "markup");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(macro, "macro");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(archive, "archive");
    }

    public static ScanPolicy defaults() {
        return new ScanPolicy(AccessPolicy.defaults(), DetectionPolicy.defaults(), CodePolicy.defaults(),
                MarkupPolicy.defaults(), DocumentPolicy.defaults(), MacroPolicy.defaults(),
                MetadataPolicy.defaults(), ArchivePolicy.defaults());
    }

    public ScanPolicy withAccess(AccessPolicy a) {
        return new ScanPolicy(a, detection, code, markup, document, macro, metadata, archive);
    }

    public ScanPolicy withDetection(DetectionPolicy d) {
        return new ScanPolicy(access, d, code, markup, document, macro, metadata, archive);
    }

    public ScanPolicy withCode(CodePolicy c) {
        return new ScanPolicy(access, detection, c, markup, document, macro, metadata, archive);
    }

    public ScanPolicy withMarkup(MarkupPolicy m) {
        return new ScanPolicy(access, detection, code, m, document, macro, metadata, archive);
    }

    public ScanPolicy withDocument(DocumentPolicy d) {
        return new ScanPolicy(access, detection, code, markup, d, macro, metadata, archive);
    }

    public ScanPolicy withMacro(MacroPolicy m) {
        return new ScanPolicy(access, detection, code, markup, document, m, metadata, archive);
    }

    public ScanPolicy withMetadata(MetadataPolicy m) {
        return new ScanPolicy(access, detection, code, markup, document, macro, m, archive);
    }

    public ScanPolicy withArchive(ArchivePolicy a) {
        return new ScanPolicy(access, detection, code, markup, document, macro, metadata, a);
    }
}
