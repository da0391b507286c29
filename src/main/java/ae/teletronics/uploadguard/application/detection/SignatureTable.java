package ae.teletronics.uploadguard.application.detection;

import ae.teletronics.uploadguard.domain.model.SignatureEntry;
import ae.teletronics.uploadguard.domain.model.SignatureEntry.Refinement;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static ae.teletronics.uploadguard.domain.model.SignatureEntry.ascii;
import static ae.teletronics.uploadguard.domain.model.SignatureEntry.of;

/**
 * Built-in magic-byte table. Entries are walked longest match first, so a specific signature always wins
 * over a shorter one it extends (DOS stub over bare "MZ", RAR 1.5 over the generic marker).
 */
public final class SignatureTable {
    private SignatureTable() {}

    private static final List<SignatureEntry> BUILT_INS = sortedBySpecificity(List.of(
            // images
            of("image/jpeg", 0xFF, 0xD8, 0xFF),
            of("image/png", 0x89, 0x50, 0x4E, 0x47),
            ascii("image/gif", "GIF87a"),
            ascii("image/gif", "GIF89a"),
            of("image/bmp", 0x42, 0x4D),
            of("image/tiff", 0x49, 0x49, 0x2A, 0x00),
            of("image/tiff", 0x4D, 0x4D, 0x00, 0x2A),
            ascii("image/webp", "RIFF").refinedBy(Refinement.RIFF_CONTAINER),
            of("image/x-icon", 0x00, 0x00, 0x01, 0x00),
            of("image/x-icon", 0x00, 0x00, 0x02, 0x00),

            // documents
            ascii("application/pdf", "%PDF"),
            of("application/zip", 0x50, 0x4B, 0x03, 0x04).refinedBy(Refinement.ZIP_CONTAINER),
            of("application/zip", 0x50, 0x4B, 0x05, 0x06),
            of("application/zip", 0x50, 0x4B, 0x07, 0x08),
            of("application/msword", 0xD0, 0xCF, 0x11, 0xE0, 0xA1, 0xB1, 0x1A, 0xE1),
            of("application/msword", 0x0D, 0x44, 0x4F, 0x43),

            // text byte-order marks
            of("text/plain", 0xEF, 0xBB, 0xBF),
            of("text/plain", 0xFF, 0xFE),
            of("text/plain", 0xFE, 0xFF),

            // archives
            of("application/gzip", 0x1F, 0x8B),
            of("application/x-compress", 0x1F, 0x9D),
            of("application/x-lzh-compressed", 0x1F, 0xA0),
            of("application/x-rar-compressed", 0x52, 0x61, 0x72, 0x21, 0x1A, 0x07),
            of("application/x-7z-compressed", 0x37, 0x7A, 0xBC, 0xAF, 0x27, 0x1C),
            ascii("application/x-archive", "!<arch>\n"),
            ascii("application/x-bzip2", "BZh"),
            of("application/x-xz", 0xFD, 0x37, 0x7A, 0x58, 0x5A, 0x00),
            ascii("application/x-iso9660-image", "CD001"),

            // video
            of("video/mpeg", 0x00, 0x00, 0x01, 0xBA),
            of("video/mpeg", 0x00, 0x00, 0x01, 0xB3),
            new SignatureEntry(4, "ftyp".getBytes(StandardCharsets.ISO_8859_1), "video/mp4", Refinement.ISO_BMFF),
            of("video/webm", 0x1A, 0x45, 0xDF, 0xA3),
            of("video/x-ms-asf", 0x30, 0x26, 0xB2, 0x75, 0x8E, 0x66, 0xCF, 0x11),
            of("video/x-flv", 0x46, 0x4C, 0x56, 0x01),
            ascii("video/ogg", "OggS"),

            // audio
            ascii("audio/mpeg", "ID3"),
            of("audio/mpeg", 0xFF, 0xF3),
            of("audio/mpeg", 0xFF, 0xFB),
            ascii("audio/flac", "fLaC"),
            ascii("audio/midi", "MThd"),
            ascii("audio/amr", "#!AMR"),

            // executables
            of("application/x-msdownload", 0x4D, 0x5A),
            of("application/x-dosexec", 0x4D, 0x5A, 0x90, 0x00),
            of("application/x-executable", 0x7F, 0x45, 0x4C, 0x46),
            of("application/x-mach-binary", 0xFE, 0xED, 0xFA, 0xCE),
            of("application/x-mach-binary", 0xFE, 0xED, 0xFA, 0xCF),
            of("application/java-archive", 0xCA, 0xFE, 0xBA, 0xBE),
            ascii("text/x-shellscript", "#!/"),

            // server-side scripts
            ascii("application/x-php", "<?php"),
            ascii("application/x-php", "<?="),
            ascii("text/x-jsp", "<%"),

            // markup
            ascii("text/xml", "<?xml").refinedBy(Refinement.XML_ROOT),
            ascii("text/html", "<html"),
            ascii("text/html", "<!DOCTYPE"),
            ascii("text/html", "<!doctype"),
            ascii("text/html", "<head>"),
            ascii("text/html", "<body>")
    ));

    /** Longest window any built-in needs. */
    public static final int MAX_SIGNATURE_LENGTH = BUILT_INS.stream().mapToInt(SignatureEntry::length).max().orElse(0);

    public static List<SignatureEntry> builtIns() {
        return BUILT_INS;
    }

    /**
     * Parses configured custom signatures (hex prefix to media type). Invalid hex is a wiring error.
     */
    public static List<SignatureEntry> parseCustom(Map<String, String> hexToType) {
        List<SignatureEntry> out = new ArrayList<>(hexToType.size());
        hexToType.forEach((hex, type) -> {
            String clean = hex.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            if (clean.isEmpty() || clean.length() % 2 != 0) {
                throw new IllegalArgumentException("Invalid custom signature: " + hex);
            }
            out.add(new SignatureEntry(0, HexFormat.of().parseHex(clean), type, Refinement.NONE));
        });
        return List.copyOf(out);
    }

    private static List<SignatureEntry> sortedBySpecificity(List<SignatureEntry> entries) {
        List<SignatureEntry> sorted = new ArrayList<>(entries);
        // stable: equal lengths keep table order
        sorted.sort(Comparator.comparingInt(SignatureEntry::length).reversed());
        return List.copyOf(sorted);
    }
}
