package ae.teletronics.uploadguard.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Media types each known extension may legitimately carry. Besides the registered type, an extension also
 * accepts the types content detection reports for it, e.g. application/zip for an Open XML document or
 * text/plain for JSON.
 */
public final class ExtensionMimeMap {
    private ExtensionMimeMap() {}

    private static final List<String> TEXTUAL = List.of(
            "text/plain", "text/html", "text/xml", "text/csv", "text/css", "text/javascript",
            "application/json", "application/xml", "application/javascript");

    private static final Map<String, Set<String>> VALID = build();

    private static Map<String, Set<String>> build() {
        Map<String, Set<String>> m = new LinkedHashMap<>();
        // images
        put(m, List.of("jpg", "jpeg", "jpe"), "image/jpeg");
        put(m, List.of("png"), "image/png");
        put(m, List.of("gif"), "image/gif");
        put(m, List.of("bmp"), "image/bmp", "image/x-ms-bmp");
        put(m, List.of("ico"), "image/x-icon", "image/vnd.microsoft.icon");
        put(m, List.of("tif", "tiff"), "image/tiff");
        put(m, List.of("svg", "svgz"), MediaTypes.SVG, "text/xml", "application/xml", "application/gzip");
        put(m, List.of("webp"), "image/webp");
        put(m, List.of("avif"), "image/avif");
        put(m, List.of("heic"), "image/heic", "image/heif");
        put(m, List.of("heif"), "image/heif", "image/heic");

        put(m, List.of("pdf"), MediaTypes.PDF);

        // legacy office: every OLE2 file looks alike to a signature check
        String[] ole = {MediaTypes.MSWORD, "application/vnd.ms-excel", "application/vnd.ms-powerpoint",
                "application/x-tika-msoffice"};
        put(m, List.of("doc", "dot", "xls", "xlt", "ppt", "pot", "pps"), ole);

        // open xml, including macro-enabled and template variants
        String[] ooxml = {MediaTypes.ZIP, MediaTypes.DOCX, MediaTypes.XLSX, MediaTypes.PPTX};
        put(m, List.of("docx", "docm", "dotx", "dotm", "xlsx", "xlsm", "xltx", "xltm",
                "pptx", "pptm", "potx", "potm", "ppsx", "ppsm"), ooxml);

        put(m, List.of("odt", "ods", "odp", "odg"), MediaTypes.ZIP);

        put(m, List.of("txt", "csv", "json", "css", "js", "xml", "html", "htm"), TEXTUAL.toArray(String[]::new));
        put(m, List.of("rtf"), "application/rtf", "text/rtf", "text/plain");

        // archives
        put(m, List.of("zip"), MediaTypes.ZIP, "application/x-zip-compressed");
        put(m, List.of("rar"), "application/vnd.rar", "application/x-rar-compressed");
        put(m, List.of("7z"), "application/x-7z-compressed");
        put(m, List.of("tar"), "application/x-tar");
        put(m, List.of("gz", "tgz"), "application/gzip", "application/x-gzip");
        put(m, List.of("bz2", "tbz2"), "application/x-bzip2");
        put(m, List.of("xz", "txz"), "application/x-xz");

        // audio
        put(m, List.of("mp3"), "audio/mpeg", "audio/mp3");
        put(m, List.of("wav"), "audio/wav", "audio/x-wav");
        put(m, List.of("ogg", "oga"), "audio/ogg", "application/ogg", "video/ogg");
        put(m, List.of("flac"), "audio/flac");
        put(m, List.of("aac"), "audio/aac");
        put(m, List.of("m4a"), "audio/mp4", "audio/x-m4a");
        put(m, List.of("wma"), "audio/x-ms-wma", "video/x-ms-asf");
        put(m, List.of("mid", "midi"), "audio/midi");
        put(m, List.of("amr"), "audio/amr");

        // video
        put(m, List.of("mp4"), "video/mp4");
        put(m, List.of("m4v"), "video/x-m4v", "video/mp4");
        put(m, List.of("avi"), "video/x-msvideo");
        put(m, List.of("wmv"), "video/x-ms-wmv", "video/x-ms-asf");
        put(m, List.of("mov"), "video/quicktime");
        put(m, List.of("mkv"), "video/x-matroska", "video/webm");
        put(m, List.of("webm"), "video/webm");
        put(m, List.of("flv"), "video/x-flv");
        put(m, List.of("mpeg", "mpg"), "video/mpeg");
        put(m, List.of("ogv"), "video/ogg");

        // fonts
        put(m, List.of("ttf"), "font/ttf", "application/x-font-ttf");
        put(m, List.of("otf"), "font/otf", "application/x-font-otf");
        put(m, List.of("woff"), "font/woff", "application/font-woff");
        put(m, List.of("woff2"), "font/woff2");
        put(m, List.of("eot"), "application/vnd.ms-fontobject");
        return Map.copyOf(m);
    }

    private static void put(Map<String, Set<String>> m, List<String> extensions, String... types) {
        Set<String> valid = Set.of(types);
        extensions.forEach(e -> m.put(e, valid));
    }

    public static boolean isKnownExtension(String extension) {
        return VALID.containsKey(clean(extension));
    }

    /** Valid media types for an extension; empty when the extension is unknown. */
    public static Set<String> mediaTypes(String extension) {
        return VALID.getOrDefault(clean(extension), Set.of());
    }

    public static boolean isValid(String extension, String mediaType) {
        return mediaTypes(extension).contains(MediaTypes.normalize(mediaType));
    }

    private static String clean(String extension) {
        if (extension == null) return "";
        String e = extension.startsWith(".") ? extension.substring(1) : extension;
        return e.toLowerCase(Locale.ROOT);
    }
}
