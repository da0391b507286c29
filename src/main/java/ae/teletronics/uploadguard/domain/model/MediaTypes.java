package ae.teletronics.uploadguard.domain.model;

import java.util.Locale;
import java.util.Set;

public final class MediaTypes {
    private MediaTypes() {}

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String ZIP = "application/zip";
    public static final String PDF = "application/pdf";
    public static final String SVG = "image/svg+xml";
    public static final String MSWORD = "application/msword";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    public static final String PPTX = "application/vnd.openxmlformats-officedocument.presentationml.presentation";

    public static final Set<String> OOXML = Set.of(DOCX, XLSX, PPTX);

    public static final Set<String> LEGACY_OFFICE = Set.of(
            MSWORD, "application/vnd.ms-excel", "application/vnd.ms-powerpoint", "application/x-tika-msoffice");

    public static final Set<String> ARCHIVES = Set.of(
            ZIP, "application/gzip", "application/x-gzip", "application/x-bzip2", "application/x-xz",
            "application/x-7z-compressed", "application/x-rar-compressed", "application/vnd.rar",
            "application/x-tar", "application/x-compress", "application/x-lzh-compressed",
            "application/x-debian-package", "application/x-iso9660-image");

    public static boolean isOffice(String type) {
        String t = normalize(type);
        return OOXML.contains(t) || LEGACY_OFFICE.contains(t);
    }

    public static boolean isArchive(String type) {
        return ARCHIVES.contains(normalize(type));
    }

    public static boolean isRasterImage(String type) {
        String t = normalize(type);
        return t.startsWith("image/") && !SVG.equals(t);
    }

    /**
     * Types whose content is never interpreted as text: raster images, audio, video, archives, PDF and
     * office documents. The latter two have their own scanners.
     */
    public static boolean isBinaryMedia(String type) {
        String t = normalize(type);
        return isRasterImage(t) || t.startsWith("video/") || t.startsWith("audio/") || isArchive(t)
                || PDF.equals(t) || isOffice(t);
    }

    public static String normalize(String type) {
        if (type == null) return OCTET_STREAM;
        int semi = type.indexOf(';');
        String base = semi >= 0 ? type.substring(0, semi) : type;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
