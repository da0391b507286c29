package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.MacroPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.poi.poifs.filesystem.DirectoryEntry;
import org.apache.poi.poifs.filesystem.Entry;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects VBA macros and embedded legacy controls in office documents.
 *
 * <p>Open XML containers are read through their zip directory; only the content-types manifest is
 * decompressed. Legacy OLE2 compound documents (.doc, .xls, .ppt) are walked with Apache POI's POIFS for
 * macro storages. A macro found under a non-macro extension such as .docx is reported as a disguise.</p>
 */
public class MacroScanner implements ThreatScanner {

    private static final Logger log = LoggerFactory.getLogger(MacroScanner.class);

    public static final String NAME = "macro";

    static final List<String> VBA_LOCATIONS = List.of(
            "word/vbaProject.bin", "xl/vbaProject.bin", "ppt/vbaProject.bin", "vbaProject.bin");

    static final List<String> MACRO_CONTENT_TYPES = List.of(
            "application/vnd.ms-office.vbaProject",
            "application/vnd.ms-word.document.macroEnabled",
            "application/vnd.ms-excel.sheet.macroEnabled",
            "application/vnd.ms-powerpoint.presentation.macroEnabled",
            "application/vnd.ms-excel.sheet.macroEnabled.main+xml",
            "application/vnd.ms-word.document.macroEnabled.main+xml",
            "application/vnd.ms-powerpoint.presentation.macroEnabled.main+xml");

    static final List<String> NON_MACRO_EXTENSIONS = List.of("docx", "xlsx", "pptx", "dotx", "xltx", "potx");

    static final Set<String> OLE_MACRO_STORAGES = Set.of("Macros", "_VBA_PROJECT_CUR", "VBA");

    private static final String CONTENT_TYPES = "[Content_Types].xml";
    private static final List<String> PART_FOLDERS = List.of("word/", "xl/", "ppt/");
    private static final Pattern ACTIVEX = Pattern.compile("activex[/\\\\]activex\\d*\\.(xml|bin)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTENT_TYPE_ATTR = Pattern.compile("ContentType\\s*=\\s*[\"']([^\"']*)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern OLE_OBJECT = Pattern.compile("embeddings[/\\\\]oleObject\\d*\\.bin", Pattern.CASE_INSENSITIVE);
    private static final byte[] OLE_HEADER = {
            (byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1};
    private static final int MAX_MANIFEST_BYTES = 1024 * 1024;
    private static final int MAX_OLE_DEPTH = 8;

    private final AccessValidator access;

    public MacroScanner(AccessValidator access) {
        this.access = access;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScanResult scan(ScanTarget target, ScanPolicy policy) {
        return ScanBoundary.guard(NAME, ThreatType.MACRO_DETECTED, target, policy, access, log, () -> {
            byte[] header = access.readPrefix(target.path(), OLE_HEADER.length, policy.access());
            ScanResult.Builder result = ScanResult.builder(NAME);
            boolean hasMacros = isOle(header)
                    ? scanCompoundDocument(target, policy, result)
                    : scanOpenXml(target, policy, result);

            String extension = target.extension();
            if (hasMacros && nonMacroExtensions(policy.macro()).contains(extension)) {
                result.finding(ThreatType.MACRO_DETECTED, "Macro-enabled document disguised as ." + extension);
            }
            return result.build();
        });
    }

    private boolean scanOpenXml(ScanTarget target, ScanPolicy scanPolicy, ScanResult.Builder result) throws IOException {
        MacroPolicy policy = scanPolicy.macro();
        try (SeekableByteChannel channel = access.openChannel(target.path(), scanPolicy.access());
             ZipFile zip = ZipFile.builder().setSeekableByteChannel(channel).setCharset(StandardCharsets.UTF_8).get()) {
            List<String> names = Collections.list(zip.getEntries()).stream().map(ZipArchiveEntry::getName).toList();
            if (!isOpenXml(names)) {
                result.finding(ThreatType.MACRO_DETECTED, "File is not a valid Office document");
                return false;
            }

            boolean hasMacros = false;
            String vba = locateVbaProject(names);
            if (vba != null) {
                hasMacros = true;
                if (policy.blockMacros()) {
                    result.finding(ThreatType.MACRO_DETECTED, "VBA macro detected: " + vba);
                }
            }

            List<String> macroTypes = declaredMacroTypes(zip);
            if (!macroTypes.isEmpty()) {
                hasMacros = true;
                if (policy.blockMacros()) {
                    macroTypes.forEach(t -> result.finding(ThreatType.MACRO_DETECTED, "Macro content type detected: " + t));
                }
            }
            if (hasMacros) {
                result.flag(ScanFlag.HAS_MACROS);
            }

            long controls = names.stream().filter(n -> ACTIVEX.matcher(n).find() || OLE_OBJECT.matcher(n).find()).count();
            if (controls > 0) {
                result.flag(ScanFlag.HAS_LEGACY_CONTROLS);
                if (policy.blockLegacyControls()) {
                    result.finding(ThreatType.MACRO_DETECTED, "ActiveX control detected: " + controls + " control(s)");
                }
            }
            return hasMacros;
        }
    }

    private boolean scanCompoundDocument(ScanTarget target, ScanPolicy scanPolicy, ScanResult.Builder result) throws IOException {
        MacroPolicy policy = scanPolicy.macro();
        try (InputStream in = access.open(target.path(), scanPolicy.access());
             POIFSFileSystem fs = new POIFSFileSystem(in)) {
            DirectoryEntry root = fs.getRoot();
            List<String> storages = new ArrayList<>();
            findMacroStorages(root, "", 0, storages);

            boolean hasMacros = !storages.isEmpty();
            if (hasMacros) {
                result.flag(ScanFlag.HAS_MACROS);
                if (policy.blockMacros()) {
                    storages.forEach(s -> result.finding(ThreatType.MACRO_DETECTED, "VBA macro detected: " + s));
                }
            }

            if (root.hasEntry("ObjectPool")
                    && root.getEntry("ObjectPool") instanceof DirectoryEntry pool
                    && pool.getEntryCount() > 0) {
                result.flag(ScanFlag.HAS_LEGACY_CONTROLS);
                if (policy.blockLegacyControls()) {
                    result.finding(ThreatType.MACRO_DETECTED,
                            "Embedded OLE object detected: " + pool.getEntryCount() + " object(s)");
                }
            }
            return hasMacros;
        }
    }

    private static void findMacroStorages(DirectoryEntry dir, String prefix, int depth, List<String> out) {
        if (depth > MAX_OLE_DEPTH) return;
        for (Entry entry : dir) {
            if (entry instanceof DirectoryEntry child) {
                String path = prefix + entry.getName();
                if (OLE_MACRO_STORAGES.contains(entry.getName())) {
                    out.add(path);
                } else {
                    findMacroStorages(child, path + "/", depth + 1, out);
                }
            }
        }
    }

    static boolean isOpenXml(List<String> names) {
        if (!names.contains(CONTENT_TYPES)) return false;
        return names.stream().anyMatch(n -> PART_FOLDERS.stream().anyMatch(n::startsWith));
    }

    static String locateVbaProject(List<String> names) {
        for (String location : VBA_LOCATIONS) {
            if (names.contains(location)) return location;
        }
        for (String name : names) {
            if (name.toLowerCase(Locale.ROOT).endsWith("vbaproject.bin")) return name;
        }
        return null;
    }

    private static List<String> declaredMacroTypes(ZipFile zip) throws IOException {
        ZipArchiveEntry manifest = zip.getEntry(CONTENT_TYPES);
        if (manifest == null) return List.of();
        String xml;
        try (InputStream in = zip.getInputStream(manifest)) {
            xml = new String(in.readNBytes(MAX_MANIFEST_BYTES), StandardCharsets.UTF_8);
        }
        return macroTypes(xml);
    }

    /** One entry per declaration: the most specific listed type its ContentType contains. */
    static List<String> macroTypes(String manifest) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = CONTENT_TYPE_ATTR.matcher(manifest);
        while (m.find()) {
            String declared = m.group(1).toLowerCase(Locale.ROOT);
            MACRO_CONTENT_TYPES.stream()
                    .filter(t -> declared.contains(t.toLowerCase(Locale.ROOT)))
                    .max(Comparator.comparingInt(String::length))
                    .ifPresent(found::add);
        }
        return List.copyOf(found);
    }

    private static Set<String> nonMacroExtensions(MacroPolicy policy) {
        Set<String> out = new LinkedHashSet<>(NON_MACRO_EXTENSIONS);
        policy.allowedMacroExtensions().forEach(e -> out.remove(e.toLowerCase(Locale.ROOT)));
        return out;
    }

    private static boolean isOle(byte[] header) {
        if (header.length < OLE_HEADER.length) return false;
        for (int i = 0; i < OLE_HEADER.length; i++) {
            if (header[i] != OLE_HEADER[i]) return false;
        }
        return true;
    }
}
