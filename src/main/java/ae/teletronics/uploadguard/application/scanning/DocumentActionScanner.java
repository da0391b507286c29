package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.DocumentPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans PDF documents for active content: launch and script actions, remote destinations, form
 * submission, embedded files, and obfuscation indicators. The raw bytes are scanned; no object model is
 * built.
 *
 * <p>Script and external references are tracked as flags independently of the verdict:
 * {@link ScanFlag#HAS_JAVASCRIPT} and {@link ScanFlag#HAS_EXTERNAL_REFERENCE}.</p>
 */
public class DocumentActionScanner implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(DocumentActionScanner.class);

    public static final String NAME = "document";

    static final List<String> DANGEROUS_ACTIONS = List.of(
            "Launch", "JavaScript", "JS", "URI", "SubmitForm", "ImportData", "GoToR", "GoToE",
            "Sound", "Movie", "RichMedia", "EmbeddedFile", "FileAttachment");

    static final List<String> SCRIPT_FUNCTIONS = List.of(
            "app.alert", "app.launchURL", "app.openDoc", "app.execMenuItem", "util.printf", "getURL",
            "submitForm", "importDataObject", "exportDataObject", "this.exportDataObject", "this.submitForm",
            "eval(", "unescape(", "String.fromCharCode");

    static final List<String> DANGEROUS_SCHEMES = List.of("javascript:", "file://", "vbscript:", "data:");

    static final int MAX_COMPRESSED_STREAMS = 50;
    static final int MAX_HEX_RUN = 500;

    private static final String HEADER = "%PDF-";
    private static final Pattern SCRIPT_ACTION = Pattern.compile("/JavaScript|/JS\\s*<<|/JS\\s*\\[|/JS\\s*\\(");
    private static final Pattern EXTERNAL_URI = Pattern.compile("/URI\\s*\\(");
    private static final Pattern SUBMIT_EXTERNAL = Pattern.compile("/SubmitForm.{0,512}?https?:", Pattern.DOTALL);
    private static final Pattern FLATE = Pattern.compile("/Filter\\s*/FlateDecode");
    private static final Pattern HEX_RUN = Pattern.compile("<[0-9a-fA-F\\s]{" + (MAX_HEX_RUN - 1) + ",}>");
    private static final Pattern ENCRYPT = Pattern.compile("/Encrypt\\b");
    private static final Pattern EMBEDDED_FILE = Pattern.compile("/EmbeddedFile\\b");
    private static final Pattern FILE_ATTACHMENT = Pattern.compile("/FileAttachment\\b");
    private static final Pattern EMBEDDED_EXECUTABLE = Pattern.compile("\\([^()]*\\.(exe|bat|cmd|scr|vbs)\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION = Pattern.compile("%PDF-([\\d.]+)");

    private final AccessValidator access;

    public DocumentActionScanner(AccessValidator access) {
        this.access = access;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return ScanBoundary.guard(NAME, ThreatType.DOCUMENT_THREAT, target, policy, access, log, () -> {
            byte[] bytes = access.readAll(target.path(), policy.access());
            return scanContent(new String(bytes, StandardCharsets.ISO_8859_1), policy.document());
        });
    }

    public ScanResult scanContent(String content, DocumentPolicy policy) {
        ScanResult.Builder result = ScanResult.builder(NAME);
        if (!content.startsWith(HEADER)) {
            return result.finding(ThreatType.DOCUMENT_THREAT, "Not a valid PDF file").build();
        }

        for (String action : effectiveActions(policy)) {
            Pattern p = Pattern.compile("/" + Pattern.quote(action) + "(?![A-Za-z0-9])");
            if (p.matcher(content).find()) {
                result.finding(ThreatType.DOCUMENT_THREAT, "Dangerous PDF action detected: " + action);
            }
        }

        scanScript(content, policy, result);
        scanLinks(content, policy, result);
        scanObfuscation(content, result);
        scanEmbedded(content, result);
        return result.build();
    }

    private static void scanScript(String content, DocumentPolicy policy, ScanResult.Builder result) {
        if (!SCRIPT_ACTION.matcher(content).find()) return;
        result.flag(ScanFlag.HAS_JAVASCRIPT);
        if (!policy.blockJavaScript()) return;

        result.finding(ThreatType.DOCUMENT_THREAT, "JavaScript code detected in PDF");
        for (String fn : SCRIPT_FUNCTIONS) {
            if (Pattern.compile(Pattern.quote(fn), Pattern.CASE_INSENSITIVE).matcher(content).find()) {
                result.finding(ThreatType.DOCUMENT_THREAT, "Suspicious JavaScript function detected: " + fn);
            }
        }
    }

    private static void scanLinks(String content, DocumentPolicy policy, ScanResult.Builder result) {
        for (String scheme : DANGEROUS_SCHEMES) {
            Pattern p = Pattern.compile("/(?:URI|URL|F|UF|S)\\s*\\(\\s*" + Pattern.quote(scheme), Pattern.CASE_INSENSITIVE);
            if (p.matcher(content).find()) {
                result.flag(ScanFlag.HAS_EXTERNAL_REFERENCE);
                result.finding(ThreatType.DOCUMENT_THREAT, "Dangerous URL protocol detected: " + scheme);
            }
        }

        boolean uri = EXTERNAL_URI.matcher(content).find();
        boolean submit = SUBMIT_EXTERNAL.matcher(content).find();
        if (uri || submit) {
            result.flag(ScanFlag.HAS_EXTERNAL_REFERENCE);
        }
        if (policy.blockExternalLinks()) {
            if (uri) result.finding(ThreatType.DOCUMENT_THREAT, "External URL link detected in PDF");
            if (submit) result.finding(ThreatType.DOCUMENT_THREAT, "Form submission to external URL detected");
        }
    }

    private static void scanObfuscation(String content, ScanResult.Builder result) {
        int streams = count(FLATE, content);
        if (streams > MAX_COMPRESSED_STREAMS) {
            result.finding(ThreatType.DOCUMENT_THREAT, "Suspicious amount of compressed streams detected (" + streams + ")");
        }
        if (HEX_RUN.matcher(content).find()) {
            result.finding(ThreatType.DOCUMENT_THREAT, "Suspicious hex-encoded content detected");
        }
        if (count(ENCRYPT, content) > 1) {
            result.finding(ThreatType.DOCUMENT_THREAT, "Multiple encryption layers detected");
        }
    }

    private static void scanEmbedded(String content, ScanResult.Builder result) {
        if (EMBEDDED_FILE.matcher(content).find()) {
            result.finding(ThreatType.DOCUMENT_THREAT, "Embedded file detected in PDF");
            if (EMBEDDED_EXECUTABLE.matcher(content).find()) {
                result.finding(ThreatType.DOCUMENT_THREAT, "Suspicious executable file embedded in PDF");
            }
        }
        if (FILE_ATTACHMENT.matcher(content).find()) {
            result.finding(ThreatType.DOCUMENT_THREAT, "File attachment detected in PDF");
        }
    }

    /**
     * Reads the document information strings and header version, for logging context. Empty when the file
     * is not a PDF.
     */
    public Map<String, String> extractInfo(Path path, ScanPolicy policy) throws IOException {
        String content = new String(access.readAll(path, policy.access()), StandardCharsets.ISO_8859_1);
        Map<String, String> info = new LinkedHashMap<>();
        if (!content.startsWith(HEADER)) return info;
        for (String key : List.of("Title", "Author", "Creator", "Producer")) {
            Matcher m = Pattern.compile("/" + key + "\\s*\\(").matcher(content);
            if (m.find()) {
                // no ')' after the first key means none after the later ones either
                int close = content.indexOf(')', m.end());
                if (close >= 0) {
                    info.put(key.toLowerCase(Locale.ROOT), content.substring(m.end(), close).trim());
                }
            }
        }
        Matcher v = VERSION.matcher(content);
        if (v.find()) {
            info.put("version", v.group(1));
        }
        return info;
    }

    private static List<String> effectiveActions(DocumentPolicy policy) {
        Set<String> actions = new LinkedHashSet<>(DANGEROUS_ACTIONS);
        policy.customActions().forEach(a -> actions.add(stripSlash(a)));
        policy.excludeActions().forEach(a -> actions.remove(stripSlash(a)));
        return new ArrayList<>(actions);
    }

    private static String stripSlash(String action) {
        String a = action.trim();
        return a.startsWith("/") ? a.substring(1) : a;
    }

    private static int count(Pattern p, String content) {
        Matcher m = p.matcher(content);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
