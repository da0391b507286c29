package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.MarkupPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Scans SVG and other XML-based vector markup for script injection and XML entity attacks.
 *
 * <p>The document-type declaration is checked before anything else. External or parameter entities
 * reject the file outright; internal-only declarations are tolerated. Content is never handed to an XML
 * parser, so no entity is ever resolved.</p>
 */
public class MarkupInjectionScanner implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(MarkupInjectionScanner.class);

    public static final String NAME = "markup";

    /** Upper bound for a gzip-compressed (.svgz) document once inflated. */
    static final int MAX_INFLATED_SIZE = 16 * 1024 * 1024;

    static final List<String> DANGEROUS_TAGS = List.of(
            "script", "iframe", "embed", "object", "use", "foreignObject",
            "animate", "animateTransform", "set");

    static final List<String> EVENT_ATTRIBUTES = List.of(
            "onload", "onclick", "onmouseover", "onmouseout", "onmousemove", "onmouseenter", "onmouseleave",
            "onfocus", "onblur", "onchange", "oninput", "onsubmit", "onkeydown", "onkeyup", "onkeypress",
            "onerror", "onabort", "onresize", "onscroll", "onbegin", "onend", "onrepeat");

    static final List<String> DANGEROUS_SCHEMES = List.of("javascript:", "data:text/html", "vbscript:");

    private static final Pattern ROOT = Pattern.compile("<svg[^<>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOCTYPE = Pattern.compile("<!DOCTYPE", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXTERNAL_ID = Pattern.compile("\\b(SYSTEM|PUBLIC)\\b");
    private static final Pattern PARAMETER_ENTITY = Pattern.compile("<!ENTITY\\s+%", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_ENTITY = Pattern.compile("<!ENTITY\\s", Pattern.CASE_INSENSITIVE);

    private static final Pattern BASE64_SVG = Pattern.compile("data:image/svg\\+xml;base64,", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERCENT_ENCODED = Pattern.compile("%6F%6E|%3Cscript", Pattern.CASE_INSENSITIVE);
    // first entity on a line, then "script" later on that line; one attempt per line
    private static final Pattern ENTITY_ENCODED = Pattern.compile("^(?>.*?&#x?[0-9a-f]+;).*script",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    // a section ends at its terminator or at the next opener, so sections are scanned once each
    private static final Pattern CDATA_SCRIPT = Pattern.compile("<!\\[CDATA\\[(?:(?!]]>|<!\\[CDATA\\[).)*script",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final AccessValidator access;

    public MarkupInjectionScanner(AccessValidator access) {
        this.access = access;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return ScanBoundary.guard(NAME, ThreatType.MARKUP_INJECTION, target, policy, access, log, () -> {
            byte[] bytes = access.readAll(target.path(), policy.access());
            if (isGzip(bytes)) {
                bytes = inflate(bytes);
                if (bytes == null) {
                    return ScanResult.rejected(NAME, ThreatType.MARKUP_INJECTION,
                            "Compressed SVG expands beyond the allowed size");
                }
            }
            return scanContent(new String(bytes, StandardCharsets.UTF_8), policy.markup());
        });
    }

    public ScanResult scanContent(String content, MarkupPolicy policy) {
        ScanResult.Builder result = ScanResult.builder(NAME);

        if (checkEntities(content, result)) {
            return result.build();
        }

        if (!ROOT.matcher(content).find()) {
            return result.finding(ThreatType.MARKUP_INJECTION, "Not a valid SVG file").build();
        }

        for (String tag : effective(DANGEROUS_TAGS, policy.customTags(), policy.excludeTags())) {
            Pattern p = Pattern.compile("<" + Pattern.quote(tag) + "[\\s>/]", Pattern.CASE_INSENSITIVE);
            if (p.matcher(content).find()) {
                result.finding(ThreatType.MARKUP_INJECTION, "Dangerous tag detected: <" + tag + ">");
            }
        }

        for (String attr : effective(EVENT_ATTRIBUTES, policy.customAttributes(), policy.excludeAttributes())) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(attr) + "\\s*=\\s*[\"'][^\"']*[\"']", Pattern.CASE_INSENSITIVE);
            if (p.matcher(content).find()) {
                result.finding(ThreatType.MARKUP_INJECTION, "Event handler detected: " + attr);
            }
        }

        for (String scheme : DANGEROUS_SCHEMES) {
            Pattern p = Pattern.compile("(href|xlink:href)\\s*=\\s*[\"']\\s*" + Pattern.quote(scheme), Pattern.CASE_INSENSITIVE);
            if (p.matcher(content).find()) {
                result.finding(ThreatType.MARKUP_INJECTION, "Dangerous protocol detected: " + scheme);
            }
        }

        if (BASE64_SVG.matcher(content).find()) {
            result.finding(ThreatType.MARKUP_INJECTION, "Base64 encoded SVG content detected");
        }
        if (PERCENT_ENCODED.matcher(content).find()) {
            result.finding(ThreatType.MARKUP_INJECTION, "URL encoded suspicious content detected");
        }
        if (ENTITY_ENCODED.matcher(content).find()) {
            result.finding(ThreatType.MARKUP_INJECTION, "HTML entity obfuscation detected");
        }
        if (CDATA_SCRIPT.matcher(content).find()) {
            result.finding(ThreatType.MARKUP_INJECTION, "CDATA section with script detected");
        }
        return result.build();
    }

    /**
     * @return true when the document must be rejected without further inspection
     */
    private static boolean checkEntities(String content, ScanResult.Builder result) {
        Matcher m = DOCTYPE.matcher(content);
        boolean rejected = false;
        int from = 0;
        while (from < content.length() && m.find(from)) {
            String declaration = declarationAt(content, m.start());
            from = m.start() + declaration.length();
            if (ANY_ENTITY.matcher(declaration).find()) {
                result.flag(ScanFlag.HAS_ENTITY_DECLARATION);
            }
            if (EXTERNAL_ID.matcher(declaration).find()) {
                result.finding(ThreatType.ENTITY_ATTACK, "External entity reference detected in DOCTYPE");
                rejected = true;
            }
            if (PARAMETER_ENTITY.matcher(declaration).find()) {
                result.finding(ThreatType.ENTITY_ATTACK, "Parameter entity declaration detected in DOCTYPE");
                rejected = true;
            }
        }
        return rejected;
    }

    /** The DOCTYPE text from {@code start}, including an internal subset when present. */
    static String declarationAt(String content, int start) {
        int close = content.indexOf('>', start);
        int subset = content.indexOf('[', start);
        if (subset >= 0 && (close < 0 || subset < close)) {
            int end = content.indexOf("]", subset);
            while (end >= 0) {
                int k = end + 1;
                while (k < content.length() && Character.isWhitespace(content.charAt(k))) k++;
                if (k < content.length() && content.charAt(k) == '>') {
                    return content.substring(start, k + 1);
                }
                end = content.indexOf("]", end + 1);
            }
            return content.substring(start);
        }
        return close < 0 ? content.substring(start) : content.substring(start, close + 1);
    }

    private static List<String> effective(List<String> builtIn, List<String> additions, List<String> exclusions) {
        Set<String> out = new LinkedHashSet<>(builtIn);
        out.addAll(additions);
        Set<String> excluded = new LinkedHashSet<>();
        exclusions.forEach(e -> excluded.add(e.toLowerCase(Locale.ROOT)));
        out.removeIf(e -> excluded.contains(e.toLowerCase(Locale.ROOT)));
        return new ArrayList<>(out);
    }

    private static boolean isGzip(byte[] bytes) {
        return bytes.length >= 2 && (bytes[0] & 0xFF) == 0x1F && (bytes[1] & 0xFF) == 0x8B;
    }

    private static byte[] inflate(byte[] gz) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(gz))) {
            byte[] out = in.readNBytes(MAX_INFLATED_SIZE + 1);
            return out.length > MAX_INFLATED_SIZE ? null : out;
        }
    }
}
