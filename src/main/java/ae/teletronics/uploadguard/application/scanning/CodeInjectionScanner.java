package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.detection.FormatIdentifier;
import ae.teletronics.uploadguard.domain.model.DetectedType;
import ae.teletronics.uploadguard.domain.model.MediaTypes;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.CodePolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Finds server-side script in uploads: script open tags, calls to dangerous functions, known web-shell
 * markers and obfuscation idioms. Files identified as binary media are skipped.
 */
public class CodeInjectionScanner implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(CodeInjectionScanner.class);

    public static final String NAME = "code";

    static final List<String> DANGEROUS_FUNCTIONS = List.of(
            "eval", "assert", "create_function", "call_user_func", "call_user_func_array",
            "exec", "shell_exec", "system", "passthru", "popen", "proc_open", "pcntl_exec",
            "file_put_contents", "file_get_contents", "fopen", "fwrite", "fputs",
            "base64_decode", "gzinflate", "gzuncompress", "str_rot13", "convert_uudecode",
            "include", "include_once", "require", "require_once",
            "extract", "parse_str", "preg_replace", "mb_ereg_replace",
            "move_uploaded_file", "copy", "rename", "unlink", "chmod", "chown", "chgrp");

    static final List<String> STRICT_FUNCTIONS = List.of(
            "eval", "assert", "exec", "shell_exec", "system", "passthru", "proc_open");

    private static final Pattern OPEN_TAG = Pattern.compile("<\\?php\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern ECHO_TAG = Pattern.compile("<\\?=\\s*[a-zA-Z$_]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHORT_TAG = Pattern.compile("<\\?(?!xml\\s|xml\\?)(?:\\s+[a-zA-Z$_])", Pattern.CASE_INSENSITIVE);

    /** Built-in suspicious patterns, keyed by the label reported when they match. */
    private static final Map<String, List<String>> SUSPICIOUS = builtInPatterns();

    private final AccessValidator access;
    private final FormatIdentifier formats;
    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public CodeInjectionScanner(AccessValidator access, FormatIdentifier formats) {
        this.access = access;
        this.formats = formats;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return ScanBoundary.guard(NAME, ThreatType.CODE_INJECTION, target, policy, access, log, () -> {
            DetectedType type = formats.identify(target.path(), policy);
            if (MediaTypes.isBinaryMedia(type.mediaType())) {
                log.debug("Skipping code scan of binary {} ({})", target.declaredName(), type.mediaType());
                return ScanResult.builder(NAME).flag(ScanFlag.BINARY_SKIPPED).build();
            }
            byte[] bytes = access.readAll(target.path(), policy.access());
            return scanContent(new String(bytes, StandardCharsets.ISO_8859_1), policy.code());
        });
    }

    /** Runs every detection pass over already-loaded content. */
    public ScanResult scanContent(String content, CodePolicy policy) {
        ScanResult.Builder result = ScanResult.builder(NAME);

        if (OPEN_TAG.matcher(content).find()) {
            result.finding(ThreatType.CODE_INJECTION, "PHP opening tag (<?php) detected");
        }
        if (ECHO_TAG.matcher(content).find()) {
            result.finding(ThreatType.CODE_INJECTION, "PHP short echo tag (<?=) detected");
        }
        if (SHORT_TAG.matcher(content).find()) {
            result.finding(ThreatType.CODE_INJECTION, "PHP short tag (<?) detected");
        }

        for (String function : effectiveFunctions(policy)) {
            Pattern p = compiled.computeIfAbsent("fn:" + function,
                    k -> Pattern.compile("\\b" + Pattern.quote(function) + "\\s*\\(", Pattern.CASE_INSENSITIVE));
            if (p.matcher(content).find()) {
                result.finding(ThreatType.CODE_INJECTION, "Dangerous function detected: " + function + "()");
            }
        }

        effectivePatterns(policy).forEach((regex, label) -> {
            if (compile(regex).matcher(content).find()) {
                result.finding(ThreatType.CODE_INJECTION, "Suspicious code pattern detected: " + label);
            }
        });

        return result.build();
    }

    static List<String> effectiveFunctions(CodePolicy policy) {
        Set<String> functions = new LinkedHashSet<>();
        switch (policy.mode()) {
            case STRICT -> functions.addAll(STRICT_FUNCTIONS);
            case CUSTOM -> functions.addAll(normalized(policy.scanFunctions()));
            case DEFAULT -> {
                functions.addAll(DANGEROUS_FUNCTIONS);
                functions.addAll(normalized(policy.scanFunctions()));
            }
        }
        functions.removeAll(normalized(policy.excludeFunctions()));
        return new ArrayList<>(functions);
    }

    private static Map<String, String> effectivePatterns(CodePolicy policy) {
        Map<String, String> out = new LinkedHashMap<>();
        SUSPICIOUS.forEach((label, regexes) -> regexes.forEach(r -> out.put(r, label)));
        policy.customPatterns().forEach(r -> out.putIfAbsent(r, "custom rule"));
        policy.excludePatterns().forEach(out::remove);
        return out;
    }

    private Pattern compile(String regex) {
        return compiled.computeIfAbsent("re:" + regex, k -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    private static List<String> normalized(List<String> names) {
        return names.stream().map(s -> s.trim().toLowerCase(Locale.ROOT)).filter(s -> !s.isEmpty()).toList();
    }

    // Built-in patterns must fail in one pass: spans stop at the next delimiter, are bounded, or follow an
    // anchored atomic prefix so an unterminated opener is not re-scanned from every later one.
    private static Map<String, List<String>> builtInPatterns() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("script tag with server-side language", List.of("<script[^<>]*language\\s*=\\s*[\"']?php[\"']?[^<>]*>"));
        m.put("server-side template block", List.of("(?s)\\A(?>.*?<%).*?%>"));
        m.put("web shell signature", List.of(
                "\\bc99\\s+shell\\b", "\\br57\\s+shell\\b", "\\bb374k\\b", "\\bwso\\s+shell\\b",
                "\\bFilesMan\\b", "\\bSafe0ver\\b", "\\bTryag\\s+File\\s+Manager\\b", "\\bAngel\\s+Shell\\b"));
        m.put("evaluation of decoded payload", List.of(
                "eval\\s*\\(\\s*base64_decode", "eval\\s*\\(\\s*gzinflate",
                "assert\\s*\\(\\s*base64_decode", "assert\\s*\\(\\s*gzinflate"));
        m.put("regex replacement with eval modifier", List.of("preg_replace\\s*\\([^)]{0,512}/[a-z]*e[a-z]*[\"')]"));
        m.put("hex-encoded script tag", List.of("\\\\x3c\\\\x3f"));
        return m;
    }
}
