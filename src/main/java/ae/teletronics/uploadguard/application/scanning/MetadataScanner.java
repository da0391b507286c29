package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.detection.FormatIdentifier;
import ae.teletronics.uploadguard.domain.model.DetectedType;
import ae.teletronics.uploadguard.domain.model.MediaTypes;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.MetadataPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.apache.commons.imaging.ImageInfo;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.ImagingException;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Inspects raster images for payloads hidden in descriptive metadata, in the image bytes themselves and
 * after the image-end marker. The end marker is found by walking the format's segment or chunk structure,
 * so a fake marker appended after a payload does not hide it. Location metadata is reported as {@link ScanFlag#HAS_GPS} and becomes a finding only
 * when the policy blocks it.
 *
 * <p>Metadata is read with Apache Commons Imaging. Unreadable metadata is not a threat by itself; an image
 * whose structure cannot be parsed at all is.</p>
 */
public class MetadataScanner implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(MetadataScanner.class);

    public static final String NAME = "metadata";

    static final List<String> DEFAULT_FIELDS = List.of(
            "Comment", "UserComment", "ImageDescription", "Artist", "Author", "Copyright", "Software",
            "ProcessingSoftware", "DocumentName", "HostComputer", "Description", "Title",
            "XPComment", "XPAuthor", "XPTitle", "XPSubject");

    static final List<String> GPS_FIELDS = List.of(
            "GPSLatitude", "GPSLatitudeRef", "GPSLongitude", "GPSLongitudeRef", "GPSAltitude",
            "GPSAltitudeRef", "GPSTimeStamp", "GPSDateStamp");

    /** Formats whose structure Commons Imaging can validate. */
    private static final Set<String> PARSEABLE = Set.of("image/jpeg", "image/png", "image/gif", "image/bmp", "image/tiff");

    private static final Pattern SERVER_CODE = Pattern.compile("<\\?php|<\\?=|eval\\s*\\(|exec\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLIENT_SCRIPT = Pattern.compile("<script", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHELL = Pattern.compile("\\bbash\\b|\\bsh\\s+-c\\b|cmd\\.exe|powershell", Pattern.CASE_INSENSITIVE);
    private static final Pattern URI_SCHEME = Pattern.compile("javascript:|data:text/html|vbscript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_SCRIPT = Pattern.compile(
            "<\\?php|<\\?=|<script|<%|\\b(eval|exec|system|shell_exec|passthru|assert|base64_decode|proc_open|popen)\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PHP_OPEN_TAG = Pattern.compile("<\\?php", Pattern.CASE_INSENSITIVE);
    private static final Map<String, Pattern> EMBEDDED_CALLS = embeddedCalls(
            "eval", "exec", "system", "shell_exec", "base64_decode");

    private final AccessValidator access;
    private final FormatIdentifier formats;

    public MetadataScanner(AccessValidator access, FormatIdentifier formats) {
        this.access = access;
        this.formats = formats;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return ScanBoundary.guard(NAME, ThreatType.METADATA_THREAT, target, policy, access, log, () -> {
            ScanResult.Builder result = ScanResult.builder(NAME);
            DetectedType type = formats.identify(target.path(), policy);
            String mediaType = type.mediaType();
            if (!MediaTypes.isRasterImage(mediaType)) {
                return result.finding(ThreatType.METADATA_THREAT, "Not a valid image file").build();
            }

            byte[] bytes = access.readAll(target.path(), policy.access());
            if (PARSEABLE.contains(mediaType)) {
                ImageInfo info = readInfo(bytes);
                if (info == null) {
                    return result.finding(ThreatType.METADATA_THREAT, "Not a valid image file").build();
                }
                result.detail("image.format", info.getFormatName())
                        .detail("image.width", info.getWidth())
                        .detail("image.height", info.getHeight());
            }

            Map<String, String> fields = readFields(bytes);
            result.merge(scanFields(fields, policy.metadata()));

            scanEmbeddedCode(bytes, result);
            scanTrailingBytes(bytes, mediaType, policy.metadata(), result);
            return result.build();
        });
    }

    /**
     * Checks already extracted metadata fields (keyword to text). Keywords are matched case-insensitively.
     */
    public ScanResult scanFields(Map<String, String> fields, MetadataPolicy policy) {
        ScanResult.Builder result = ScanResult.builder(NAME);
        List<String> scanned = (policy.scannedFields().isEmpty() ? DEFAULT_FIELDS : policy.scannedFields())
                .stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();

        boolean gps = false;
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String keyword = field.getKey();
            String text = field.getValue() == null ? "" : field.getValue();
            if (GPS_FIELDS.stream().anyMatch(keyword::equalsIgnoreCase)) {
                gps = true;
            }
            if (!scanned.contains(keyword.toLowerCase(Locale.ROOT))) continue;

            if (SERVER_CODE.matcher(text).find()) {
                result.finding(ThreatType.METADATA_THREAT, "PHP code detected in metadata field: " + keyword);
            }
            if (CLIENT_SCRIPT.matcher(text).find()) {
                result.finding(ThreatType.METADATA_THREAT, "Script tag detected in metadata field: " + keyword);
            }
            if (SHELL.matcher(text).find()) {
                result.finding(ThreatType.METADATA_THREAT, "Shell command detected in metadata field: " + keyword);
            }
            if (URI_SCHEME.matcher(text).find()) {
                result.finding(ThreatType.METADATA_THREAT, "Dangerous URL protocol detected in metadata field: " + keyword);
            }
        }

        if (gps && policy.checkGps()) {
            result.flag(ScanFlag.HAS_GPS);
            if (policy.blockGps()) {
                result.finding(ThreatType.GPS_DETECTED, "Image contains GPS location data");
            }
        }
        return result.build();
    }

    static void scanTrailingBytes(byte[] bytes, String mediaType, MetadataPolicy policy, ScanResult.Builder result) {
        int end = endOfImage(bytes, mediaType);
        if (end < 0 || end >= bytes.length) return;

        int trailing = bytes.length - end;
        result.detail("image.trailingBytes", trailing);
        if (trailing > policy.trailingBytesThreshold()) {
            result.finding(ThreatType.METADATA_THREAT,
                    "Suspicious trailing data found after image end marker (" + trailing + " bytes)");
        }
        String tail = new String(bytes, end, trailing, StandardCharsets.ISO_8859_1);
        if (TRAILING_SCRIPT.matcher(tail).find()) {
            result.finding(ThreatType.METADATA_THREAT, "Script code detected after image end marker");
        }
    }

    /** Server-side code anywhere in the image bytes, headers and pixel data included. */
    static void scanEmbeddedCode(byte[] bytes, ScanResult.Builder result) {
        String content = new String(bytes, StandardCharsets.ISO_8859_1);
        if (PHP_OPEN_TAG.matcher(content).find()) {
            result.finding(ThreatType.METADATA_THREAT, "PHP opening tag (<?php) found in image data");
        }
        if (content.contains("<?=")) {
            result.finding(ThreatType.METADATA_THREAT, "PHP short echo tag (<?=) found in image data");
        }
        for (Map.Entry<String, Pattern> call : EMBEDDED_CALLS.entrySet()) {
            if (call.getValue().matcher(content).find()) {
                result.finding(ThreatType.METADATA_THREAT, "Suspicious PHP function (" + call.getKey() + ") found in image data");
            }
        }
    }

    /** Offset just past the format's end marker, or -1 when the format has none or its structure is broken. */
    static int endOfImage(byte[] bytes, String mediaType) {
        return switch (MediaTypes.normalize(mediaType)) {
            case "image/jpeg" -> jpegEnd(bytes);
            case "image/png" -> pngEnd(bytes);
            case "image/gif" -> gifEnd(bytes);
            default -> -1;
        };
    }

    /** Skips marker segments by their length fields and entropy-coded data up to the next real marker. */
    static int jpegEnd(byte[] b) {
        if (b.length < 4 || u8(b, 0) != 0xFF || u8(b, 1) != 0xD8) return -1;
        int pos = 2;
        while (pos + 1 < b.length) {
            if (u8(b, pos) != 0xFF) return -1;
            int marker = u8(b, pos + 1);
            if (marker == 0xFF) {
                pos++;
                continue;
            }
            pos += 2;
            if (marker == 0xD9) return pos;
            if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) continue;
            if (pos + 1 >= b.length) return -1;
            int length = (u8(b, pos) << 8) | u8(b, pos + 1);
            if (length < 2 || length > b.length - pos) return -1;
            pos += length;
            if (marker == 0xDA) {
                pos = nextJpegMarker(b, pos);
                if (pos < 0) return -1;
            }
        }
        return -1;
    }

    private static int nextJpegMarker(byte[] b, int from) {
        for (int i = from; i + 1 < b.length; i++) {
            if (u8(b, i) != 0xFF) continue;
            int next = u8(b, i + 1);
            if (next == 0x00 || (next >= 0xD0 && next <= 0xD7)) {
                i++;
            } else if (next != 0xFF) {
                return i;
            }
        }
        return -1;
    }

    /** Walks length-prefixed chunks from the signature to the first IEND. */
    static int pngEnd(byte[] b) {
        int pos = 8;
        while (pos + 8 <= b.length) {
            long length = ((long) u8(b, pos) << 24) | (u8(b, pos + 1) << 16) | (u8(b, pos + 2) << 8) | u8(b, pos + 3);
            if (length > b.length - pos - 12L) return -1;
            boolean iend = b[pos + 4] == 'I' && b[pos + 5] == 'E' && b[pos + 6] == 'N' && b[pos + 7] == 'D';
            pos += 12 + (int) length;
            if (iend) return pos;
        }
        return -1;
    }

    /** Walks color tables, extensions and image blocks to the trailer byte. */
    static int gifEnd(byte[] b) {
        if (b.length < 13) return -1;
        int pos = 13 + colorTableSize(u8(b, 10));
        while (pos >= 0 && pos < b.length) {
            int block = u8(b, pos);
            if (block == 0x3B) {
                return pos + 1;
            } else if (block == 0x21) {
                pos = skipSubBlocks(b, pos + 2);
            } else if (block == 0x2C) {
                if (pos + 10 > b.length) return -1;
                pos += 10 + colorTableSize(u8(b, pos + 9));
                // LZW minimum code size precedes the data sub-blocks
                pos = skipSubBlocks(b, pos + 1);
            } else {
                return -1;
            }
        }
        return -1;
    }

    private static int colorTableSize(int packed) {
        return (packed & 0x80) == 0 ? 0 : 3 << ((packed & 0x07) + 1);
    }

    private static int skipSubBlocks(byte[] b, int pos) {
        while (pos < b.length) {
            int size = u8(b, pos);
            pos++;
            if (size == 0) return pos;
            pos += size;
        }
        return -1;
    }

    private static int u8(byte[] b, int i) {
        return b[i] & 0xFF;
    }

    /**
     * Rewrites a JPEG in place without its EXIF block.
     *
     * @return true when the file was rewritten; other formats are left untouched
     */
    public boolean stripMetadata(Path path, ScanPolicy policy) throws IOException {
        DetectedType type = formats.identify(path, policy);
        if (!"image/jpeg".equals(type.mediaType())) {
            return false;
        }
        byte[] original = access.readAll(path, policy.access());
        Path parent = path.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(parent, ".strip-", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                new ExifRewriter().removeExifMetadata(original, out);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (ImagingException e) {
            throw new IOException("Unable to strip metadata: " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static ImageInfo readInfo(byte[] bytes) {
        try {
            return Imaging.getImageInfo(bytes);
        } catch (ImagingException e) {
            log.debug("Image structure rejected: {}", e.toString());
            return null;
        } catch (IOException | RuntimeException e) {
            log.debug("Image structure unreadable: {}", e.toString());
            return null;
        }
    }

    private static Map<String, String> readFields(byte[] bytes) throws IOException {
        ImageMetadata metadata;
        try {
            metadata = Imaging.getMetadata(bytes);
        } catch (ImagingException e) {
            log.debug("Metadata unreadable, continuing without it: {}", e.toString());
            return Map.of();
        }
        if (metadata == null) return Map.of();

        Map<String, String> fields = new LinkedHashMap<>();
        List<String> lines = new ArrayList<>();
        metadata.getItems().forEach(item -> lines.add(item.toString()));
        for (String line : lines) {
            int sep = line.indexOf(": ");
            if (sep <= 0) continue;
            String keyword = line.substring(0, sep).trim();
            String text = line.substring(sep + 2);
            fields.merge(keyword, text, (a, b) -> a + "\n" + b);
        }
        return fields;
    }

    private static Map<String, Pattern> embeddedCalls(String... functions) {
        Map<String, Pattern> calls = new LinkedHashMap<>();
        for (String f : functions) {
            calls.put(f, Pattern.compile("\\b" + f + "\\s*\\(", Pattern.CASE_INSENSITIVE));
        }
        return calls;
    }
}
