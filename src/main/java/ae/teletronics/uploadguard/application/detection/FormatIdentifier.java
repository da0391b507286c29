package ae.teletronics.uploadguard.application.detection;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.DetectedType;
import ae.teletronics.uploadguard.domain.model.DetectedType.Source;
import ae.teletronics.uploadguard.domain.model.MediaTypes;
import ae.teletronics.uploadguard.domain.model.SignatureEntry;
import ae.teletronics.uploadguard.domain.policy.DetectionPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.FileTypeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identifies the real media type of a file from its leading bytes, independent of its name.
 *
 * <p>Custom signatures are tried first, then the built-in table. ZIP, RIFF, ISO base-media and XML
 * matches are refined further from the same prefix window. Without a signature match the
 * {@link FileTypeDetector} fallback is asked. Identification never throws: malformed or unreadable
 * input yields {@link DetectedType#UNKNOWN}.</p>
 */
public class FormatIdentifier {

    private static final Logger log = LoggerFactory.getLogger(FormatIdentifier.class);

    public static final int PREFIX_WINDOW = 512;

    private final FileTypeDetector fallback;
    private final AccessValidator access;
    private final Map<Map<String, String>, List<SignatureEntry>> customCache = new ConcurrentHashMap<>();

    public FormatIdentifier(FileTypeDetector fallback, AccessValidator access) {
        this.fallback = fallback;
        this.access = access;
    }

    public DetectedType identify(Path path, ScanPolicy policy) {
        byte[] prefix;
        try {
            prefix = access.readPrefix(path, PREFIX_WINDOW, policy.access());
        } catch (IOException | RuntimeException e) {
            log.debug("Unable to read prefix of {}: {}", path, e.toString());
            return DetectedType.UNKNOWN;
        }
        return identify(prefix, policy.detection());
    }

    public DetectedType identify(byte[] prefix, DetectionPolicy policy) {
        if (prefix == null || prefix.length == 0) return DetectedType.UNKNOWN;

        for (SignatureEntry entry : customSignatures(policy)) {
            if (entry.matches(prefix)) {
                return new DetectedType(entry.mediaType(), Source.CUSTOM_SIGNATURE);
            }
        }
        for (SignatureEntry entry : SignatureTable.builtIns()) {
            if (entry.matches(prefix)) {
                return new DetectedType(refine(entry, prefix), Source.SIGNATURE);
            }
        }
        return sniff(prefix);
    }

    public boolean isDangerous(String mediaType, DetectionPolicy policy) {
        return policy.dangerousTypes().contains(MediaTypes.normalize(mediaType));
    }

    private List<SignatureEntry> customSignatures(DetectionPolicy policy) {
        if (policy.customSignatures().isEmpty()) return List.of();
        return customCache.computeIfAbsent(policy.customSignatures(), SignatureTable::parseCustom);
    }

    private static String refine(SignatureEntry entry, byte[] window) {
        return switch (entry.refinement()) {
            case NONE -> entry.mediaType();
            case ZIP_CONTAINER -> refineZip(window);
            case RIFF_CONTAINER -> refineRiff(entry.mediaType(), window);
            case ISO_BMFF -> refineIsoBmff(entry.mediaType(), window);
            case XML_ROOT -> refineXml(entry.mediaType(), window);
        };
    }

    static String refineZip(byte[] window) {
        String text = latin1(window);
        if (text.contains("word/")) return MediaTypes.DOCX;
        if (text.contains("xl/")) return MediaTypes.XLSX;
        if (text.contains("ppt/")) return MediaTypes.PPTX;
        return MediaTypes.ZIP;
    }

    static String refineRiff(String candidate, byte[] window) {
        if (window.length < 12) return candidate;
        return switch (ascii(window, 8, 4)) {
            case "WEBP" -> "image/webp";
            case "AVI " -> "video/x-msvideo";
            case "WAVE" -> "audio/wav";
            default -> MediaTypes.OCTET_STREAM;
        };
    }

    static String refineIsoBmff(String candidate, byte[] window) {
        if (window.length < 12) return candidate;
        return switch (ascii(window, 8, 4)) {
            case "isom", "iso2", "mp41", "mp42" -> "video/mp4";
            case "qt  " -> "video/quicktime";
            case "M4A ", "M4B " -> "audio/mp4";
            case "avif", "avis" -> "image/avif";
            case "heic", "heix" -> "image/heic";
            case "mif1", "msf1" -> "image/heif";
            default -> candidate;
        };
    }

    static String refineXml(String candidate, byte[] window) {
        return latin1(window).contains("<svg") ? MediaTypes.SVG : candidate;
    }

    private DetectedType sniff(byte[] prefix) {
        if (fallback == null) return DetectedType.UNKNOWN;
        try {
            Optional<String> detected = fallback.detect(() -> new ByteArrayInputStream(prefix));
            return detected
                    .map(MediaTypes::normalize)
                    .filter(t -> !t.isBlank() && !MediaTypes.OCTET_STREAM.equals(t))
                    .map(t -> new DetectedType(t, Source.FALLBACK))
                    .orElse(DetectedType.UNKNOWN);
        } catch (IOException | RuntimeException e) {
            log.debug("Fallback detection failed: {}", e.toString());
            return DetectedType.UNKNOWN;
        }
    }

    private static String ascii(byte[] window, int offset, int length) {
        return new String(window, offset, length, StandardCharsets.ISO_8859_1);
    }

    private static String latin1(byte[] window) {
        return new String(window, StandardCharsets.ISO_8859_1);
    }
}
