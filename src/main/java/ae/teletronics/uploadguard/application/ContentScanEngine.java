package ae.teletronics.uploadguard.application;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.archive.ArchiveInspector;
import ae.teletronics.uploadguard.application.detection.FormatIdentifier;
import ae.teletronics.uploadguard.application.scanning.CodeInjectionScanner;
import ae.teletronics.uploadguard.application.scanning.DocumentActionScanner;
import ae.teletronics.uploadguard.application.scanning.MacroScanner;
import ae.teletronics.uploadguard.application.scanning.MarkupInjectionScanner;
import ae.teletronics.uploadguard.application.scanning.MetadataScanner;
import ae.teletronics.uploadguard.application.scanning.ScanBoundary;
import ae.teletronics.uploadguard.application.util.Hashing;
import ae.teletronics.uploadguard.domain.model.DetectedType;
import ae.teletronics.uploadguard.domain.model.ExtensionMimeMap;
import ae.teletronics.uploadguard.domain.model.Finding;
import ae.teletronics.uploadguard.domain.model.MediaTypes;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.SecurityEvent;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.DetectionPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.SecurityEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs every applicable scanner over one file and folds their results into a single verdict.
 *
 * <p>The file's real type is identified from its content first; the declared name only decides
 * whether the extension agrees with it and which format-specific scanners are worth running. Each unsafe
 * verdict is reported to the {@link SecurityEventSink}, one event per finding.</p>
 */
public class ContentScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ContentScanEngine.class);

    public static final String NAME = "engine";

    static final Set<String> OFFICE_EXTENSIONS = Set.of(
            "docx", "docm", "dotx", "dotm", "xlsx", "xlsm", "xltx", "xltm",
            "pptx", "pptm", "potx", "potm", "ppsx", "ppsm");

    private final AccessValidator access;
    private final FormatIdentifier formats;
    private final CodeInjectionScanner code;
    private final MarkupInjectionScanner markup;
    private final MetadataScanner metadata;
    private final DocumentActionScanner document;
    private final MacroScanner macro;
    private final ArchiveInspector archive;
    private final SecurityEventSink events;

    public ContentScanEngine(AccessValidator access,
                             FormatIdentifier formats,
                             CodeInjectionScanner code,
                             MarkupInjectionScanner markup,
                             MetadataScanner metadata,
                             DocumentActionScanner document,
                             MacroScanner macro,
                             ArchiveInspector archive,
                             SecurityEventSink events) {
        this.access = access;
        this.formats = formats;
        this.code = code;
        this.markup = markup;
        this.metadata = metadata;
        this.document = document;
        this.macro = macro;
        this.archive = archive;
        this.events = events;
    }

    /** Convenience wiring with the default reader set and scanners sharing one validator. */
    public static ContentScanEngine create(AccessValidator access, FormatIdentifier formats, SecurityEventSink events) {
        return new ContentScanEngine(access, formats,
                new CodeInjectionScanner(access, formats),
                new MarkupInjectionScanner(access),
                new MetadataScanner(access, formats),
                new DocumentActionScanner(access),
                new MacroScanner(access),
                new ArchiveInspector(access),
                events);
    }

    public ScanResult scanFile(ScanTarget target, ScanPolicy policy) {
        ScanResult result = ScanBoundary.guard(NAME, ThreatType.DANGEROUS_FILE, target, policy, access, log,
                () -> runScanners(target, policy));
        if (result.safe()) {
            log.debug("{} passed all scanners", target.declaredName());
        } else {
            report(target, policy, result);
        }
        return result;
    }

    private ScanResult runScanners(ScanTarget target, ScanPolicy policy) throws IOException {
        DetectedType detected = formats.identify(target.path(), policy);
        String type = detected.mediaType();
        String extension = target.extension();

        ScanResult.Builder result = ScanResult.builder(NAME)
                .detail("detectedType", type)
                .detail("detectionSource", detected.source().name().toLowerCase(Locale.ROOT));

        DetectionPolicy detection = policy.detection();
        if (detection.blockDangerousTypes() && formats.isDangerous(type, detection)) {
            result.finding(ThreatType.DANGEROUS_FILE, "Dangerous file type detected: " + type);
        }
        if (detection.strictExtensionMatching()
                && detected.isKnown()
                && ExtensionMimeMap.isKnownExtension(extension)
                && !ExtensionMimeMap.isValid(extension, type)) {
            result.finding(ThreatType.MIME_MISMATCH,
                    "File extension ." + extension + " does not match detected type " + type);
        }

        if (policy.code().enabled()) {
            result.merge(code.scan(target, policy));
        }

        boolean markupApplies = MediaTypes.SVG.equals(type) || "svg".equals(extension) || "svgz".equals(extension);
        if (markupApplies && policy.markup().enabled()) {
            result.merge(markup.scan(target, policy));
        }

        if (MediaTypes.isRasterImage(type) && policy.metadata().enabled()) {
            result.merge(metadata.scan(target, policy));
        }

        if ((MediaTypes.PDF.equals(type) || "pdf".equals(extension)) && policy.document().enabled()) {
            result.merge(document.scan(target, policy));
            pdfInfo(target, policy).forEach((k, v) -> result.detail("pdf." + k, v));
        }

        boolean officeContainer = MediaTypes.isOffice(type)
                || (MediaTypes.ZIP.equals(type) && OFFICE_EXTENSIONS.contains(extension));
        if (officeContainer) {
            if (policy.macro().enabled()) {
                result.merge(macro.scan(target, policy));
            }
        } else if (MediaTypes.isArchive(type) && !markupApplies && policy.archive().enabled()) {
            result.merge(archive.scan(target, policy));
        }

        if (!result.hasFindings()
                && policy.metadata().stripMetadata()
                && "image/jpeg".equals(type)
                && metadata.stripMetadata(target.path(), policy)) {
            result.flag(ScanFlag.METADATA_STRIPPED);
        }
        return result.build();
    }

    /** Event context only; a read failure here must not discard the findings already collected. */
    private Map<String, String> pdfInfo(ScanTarget target, ScanPolicy policy) {
        try {
            return document.extractInfo(target.path(), policy);
        } catch (IOException e) {
            log.debug("PDF info unavailable for {}: {}", target.declaredName(), e.toString());
            return Map.of();
        }
    }

    private void report(ScanTarget target, ScanPolicy policy, ScanResult result) {
        Map<String, Object> context = context(target, policy, result);
        for (Finding finding : result.findings()) {
            try {
                events.record(SecurityEvent.of(finding, context));
            } catch (RuntimeException e) {
                log.warn("Security event sink failed for {}: {}", target.declaredName(), e.toString());
            }
        }
    }

    private Map<String, Object> context(ScanTarget target, ScanPolicy policy, ScanResult result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("filename", target.declaredName());
        // a denied path is never read, not even to hash it
        if (access.validate(target.path(), policy.access()).allowed()) {
            Path path = target.path();
            try (SeekableByteChannel channel = access.openChannel(path, policy.access())) {
                context.put("size", channel.size());
                context.put("sha256", Hashing.sha256Hex(() -> access.open(path, policy.access())));
            } catch (IOException e) {
                log.debug("Unable to summarise {}: {}", target.declaredName(), e.toString());
            }
        }
        context.put("detectedType", result.details().getOrDefault("detectedType", MediaTypes.OCTET_STREAM));
        result.details().forEach((k, v) -> {
            if (k.startsWith("pdf.")) context.put(k, v);
        });
        context.put("threats", result.threats());
        return context;
    }
}
