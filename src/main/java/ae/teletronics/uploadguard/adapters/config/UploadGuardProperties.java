package ae.teletronics.uploadguard.adapters.config;

import ae.teletronics.uploadguard.application.detection.SignatureTable;
import ae.teletronics.uploadguard.domain.policy.AccessPolicy;
import ae.teletronics.uploadguard.domain.policy.ArchivePolicy;
import ae.teletronics.uploadguard.domain.policy.CodePolicy;
import ae.teletronics.uploadguard.domain.policy.CodeScanMode;
import ae.teletronics.uploadguard.domain.policy.DetectionPolicy;
import ae.teletronics.uploadguard.domain.policy.DocumentPolicy;
import ae.teletronics.uploadguard.domain.policy.MacroPolicy;
import ae.teletronics.uploadguard.domain.policy.MarkupPolicy;
import ae.teletronics.uploadguard.domain.policy.MetadataPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Binds the {@code uploadguard.*} settings. {@link #toPolicy()} turns them into the immutable
 * {@link ScanPolicy} used for every scan and rejects malformed signatures or patterns.
 */
@ConfigurationProperties(prefix = "uploadguard")
public class UploadGuardProperties {

    private final Access access = new Access();
    private final Detection detection = new Detection();
    private final Code code = new Code();
    private final Markup markup = new Markup();
    private final Document document = new Document();
    private final Macro macro = new Macro();
    private final Metadata metadata = new Metadata();
    private final Archive archive = new Archive();
    private final Logging logging = new Logging();

    public ScanPolicy toPolicy() {
        SignatureTable.parseCustom(detection.customSignatures);
        code.customPatterns.forEach(Pattern::compile);

        List<Path> roots = access.allowedRoots.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> Paths.get(s).toAbsolutePath().normalize())
                .toList();

        return new ScanPolicy(
                new AccessPolicy(access.checkSymlinks, roots),
                new DetectionPolicy(detection.blockDangerousTypes, detection.strictExtensionMatching,
                        detection.dangerousTypes.isEmpty() ? null : lowercase(detection.dangerousTypes),
                        detection.customSignatures),
                new CodePolicy(code.enabled, code.mode, code.scanFunctions, code.excludeFunctions,
                        code.customPatterns, code.excludePatterns),
                new MarkupPolicy(markup.enabled, markup.customTags, markup.excludeTags,
                        markup.customAttributes, markup.excludeAttributes),
                new DocumentPolicy(document.enabled, document.blockJavascript, document.blockExternalLinks,
                        document.customActions, document.excludeActions),
                new MacroPolicy(macro.enabled, macro.blockMacros, macro.blockLegacyControls,
                        macro.allowedMacroExtensions),
                new MetadataPolicy(metadata.enabled, metadata.checkGps, metadata.blockGps, metadata.stripMetadata,
                        metadata.trailingBytesThreshold, metadata.scannedFields),
                new ArchivePolicy(archive.enabled, archive.maxCompressionRatio, archive.maxUncompressedSize,
                        archive.maxFiles, archive.maxDepth, archive.failOpenWhenBackendMissing,
                        archive.blockedExtensions, archive.excludeExtensions));
    }

    private static Set<String> lowercase(List<String> types) {
        Set<String> out = new LinkedHashSet<>();
        types.forEach(t -> out.add(t.trim().toLowerCase(Locale.ROOT)));
        return out;
    }

    public Access getAccess() { return access; }
    public Detection getDetection() { return detection; }
    public Code getCode() { return code; }
    public Markup getMarkup() { return markup; }
    public Document getDocument() { return document; }
    public Macro getMacro() { return macro; }
    public Metadata getMetadata() { return metadata; }
    public Archive getArchive() { return archive; }
    public Logging getLogging() { return logging; }

    public static class Access {
        private boolean checkSymlinks = true;
        private List<String> allowedRoots = new ArrayList<>();
        /** Added to the system temp directory as an implicit root when no roots are configured. */
        private String storageRoot;

        public boolean isCheckSymlinks() { return checkSymlinks; }
        public void setCheckSymlinks(boolean checkSymlinks) { this.checkSymlinks = checkSymlinks; }
        public List<String> getAllowedRoots() { return allowedRoots; }
        public void setAllowedRoots(List<String> allowedRoots) { this.allowedRoots = allowedRoots; }
        public String getStorageRoot() { return storageRoot; }
        public void setStorageRoot(String storageRoot) { this.storageRoot = storageRoot; }
    }

    public static class Detection {
        private boolean blockDangerousTypes = true;
        private boolean strictExtensionMatching = true;
        private List<String> dangerousTypes = new ArrayList<>();
        /** Hex prefix to media type, tried before the built-in signatures. */
        private Map<String, String> customSignatures = new LinkedHashMap<>();

        public boolean isBlockDangerousTypes() { return blockDangerousTypes; }
        public void setBlockDangerousTypes(boolean v) { this.blockDangerousTypes = v; }
        public boolean isStrictExtensionMatching() { return strictExtensionMatching; }
        public void setStrictExtensionMatching(boolean v) { this.strictExtensionMatching = v; }
        public List<String> getDangerousTypes() { return dangerousTypes; }
        public void setDangerousTypes(List<String> dangerousTypes) { this.dangerousTypes = dangerousTypes; }
        public Map<String, String> getCustomSignatures() { return customSignatures; }
        public void setCustomSignatures(Map<String, String> customSignatures) { this.customSignatures = customSignatures; }
    }

    public static class Code {
        private boolean enabled = true;
        private CodeScanMode mode = CodeScanMode.DEFAULT;
        private List<String> scanFunctions = new ArrayList<>();
        private List<String> excludeFunctions = new ArrayList<>();
        private List<String> customPatterns = new ArrayList<>();
        private List<String> excludePatterns = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public CodeScanMode getMode() { return mode; }
        public void setMode(CodeScanMode mode) { this.mode = mode; }
        public List<String> getScanFunctions() { return scanFunctions; }
        public void setScanFunctions(List<String> v) { this.scanFunctions = v; }
        public List<String> getExcludeFunctions() { return excludeFunctions; }
        public void setExcludeFunctions(List<String> v) { this.excludeFunctions = v; }
        public List<String> getCustomPatterns() { return customPatterns; }
        public void setCustomPatterns(List<String> v) { this.customPatterns = v; }
        public List<String> getExcludePatterns() { return excludePatterns; }
        public void setExcludePatterns(List<String> v) { this.excludePatterns = v; }
    }

    public static class Markup {
        private boolean enabled = true;
        private List<String> customTags = new ArrayList<>();
        private List<String> excludeTags = new ArrayList<>();
        private List<String> customAttributes = new ArrayList<>();
        private List<String> excludeAttributes = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getCustomTags() { return customTags; }
        public void setCustomTags(List<String> v) { this.customTags = v; }
        public List<String> getExcludeTags() { return excludeTags; }
        public void setExcludeTags(List<String> v) { this.excludeTags = v; }
        public List<String> getCustomAttributes() { return customAttributes; }
        public void setCustomAttributes(List<String> v) { this.customAttributes = v; }
        public List<String> getExcludeAttributes() { return excludeAttributes; }
        public void setExcludeAttributes(List<String> v) { this.excludeAttributes = v; }
    }

    public static class Document {
        private boolean enabled = true;
        private boolean blockJavascript = true;
        private boolean blockExternalLinks = false;
        private List<String> customActions = new ArrayList<>();
        private List<String> excludeActions = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isBlockJavascript() { return blockJavascript; }
        public void setBlockJavascript(boolean v) { this.blockJavascript = v; }
        public boolean isBlockExternalLinks() { return blockExternalLinks; }
        public void setBlockExternalLinks(boolean v) { this.blockExternalLinks = v; }
        public List<String> getCustomActions() { return customActions; }
        public void setCustomActions(List<String> v) { this.customActions = v; }
        public List<String> getExcludeActions() { return excludeActions; }
        public void setExcludeActions(List<String> v) { this.excludeActions = v; }
    }

    public static class Macro {
        private boolean enabled = true;
        private boolean blockMacros = true;
        private boolean blockLegacyControls = true;
        private List<String> allowedMacroExtensions = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isBlockMacros() { return blockMacros; }
        public void setBlockMacros(boolean v) { this.blockMacros = v; }
        public boolean isBlockLegacyControls() { return blockLegacyControls; }
        public void setBlockLegacyControls(boolean v) { this.blockLegacyControls = v; }
        public List<String> getAllowedMacroExtensions() { return allowedMacroExtensions; }
        public void setAllowedMacroExtensions(List<String> v) { this.allowedMacroExtensions = v; }
    }

    public static class Metadata {
        private boolean enabled = true;
        private boolean checkGps = true;
        private boolean blockGps = false;
        private boolean stripMetadata = false;
        private int trailingBytesThreshold = MetadataPolicy.DEFAULT_TRAILING_BYTES_THRESHOLD;
        private List<String> scannedFields = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isCheckGps() { return checkGps; }
        public void setCheckGps(boolean v) { this.checkGps = v; }
        public boolean isBlockGps() { return blockGps; }
        public void setBlockGps(boolean v) { this.blockGps = v; }
        public boolean isStripMetadata() { return stripMetadata; }
        public void setStripMetadata(boolean v) { this.stripMetadata = v; }
        public int getTrailingBytesThreshold() { return trailingBytesThreshold; }
        public void setTrailingBytesThreshold(int v) { this.trailingBytesThreshold = v; }
        public List<String> getScannedFields() { return scannedFields; }
        public void setScannedFields(List<String> v) { this.scannedFields = v; }
    }

    public static class Archive {
        private boolean enabled = true;
        private long maxCompressionRatio = ArchivePolicy.DEFAULT_MAX_RATIO;
        private long maxUncompressedSize = ArchivePolicy.DEFAULT_MAX_UNCOMPRESSED;
        private int maxFiles = ArchivePolicy.DEFAULT_MAX_FILES;
        private int maxDepth = ArchivePolicy.DEFAULT_MAX_DEPTH;
        private boolean failOpenWhenBackendMissing = false;
        private List<String> blockedExtensions = new ArrayList<>();
        private List<String> excludeExtensions = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getMaxCompressionRatio() { return maxCompressionRatio; }
        public void setMaxCompressionRatio(long v) { this.maxCompressionRatio = v; }
        public long getMaxUncompressedSize() { return maxUncompressedSize; }
        public void setMaxUncompressedSize(long v) { this.maxUncompressedSize = v; }
        public int getMaxFiles() { return maxFiles; }
        public void setMaxFiles(int v) { this.maxFiles = v; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int v) { this.maxDepth = v; }
        public boolean isFailOpenWhenBackendMissing() { return failOpenWhenBackendMissing; }
        public void setFailOpenWhenBackendMissing(boolean v) { this.failOpenWhenBackendMissing = v; }
        public List<String> getBlockedExtensions() { return blockedExtensions; }
        public void setBlockedExtensions(List<String> v) { this.blockedExtensions = v; }
        public List<String> getExcludeExtensions() { return excludeExtensions; }
        public void setExcludeExtensions(List<String> v) { this.excludeExtensions = v; }
    }

    public static class Logging {
        private boolean enabled = true;
        /** Include the file context bundle in security log lines. */
        private boolean detailed = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isDetailed() { return detailed; }
        public void setDetailed(boolean detailed) { this.detailed = detailed; }
    }
}
