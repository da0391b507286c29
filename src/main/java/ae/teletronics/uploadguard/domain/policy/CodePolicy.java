package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

public record CodePolicy(boolean enabled,
                         CodeScanMode mode,
                         List<String> scanFunctions,
                         List<String> excludeFunctions,
                         List<String> customPatterns,
                         List<String> excludePatterns) {

    public CodePolicy {
        mode = mode == null ? CodeScanMode.DEFAULT : mode;
        scanFunctions = copy(scanFunctions);
        excludeFunctions = copy(excludeFunctions);
        customPatterns = copy(customPatterns);
        excludePatterns = copy(excludePatterns);
    }

    public static CodePolicy defaults() {
        return new CodePolicy(true, CodeScanMode.DEFAULT, List.of(), List.of(), List.of(), List.of());
    }

    public CodePolicy withMode(CodeScanMode m, List<String> functions) {
        return new CodePolicy(enabled, m, functions, excludeFunctions, customPatterns, excludePatterns);
    }

    public CodePolicy withExcludeFunctions(List<String> functions) {
        return new CodePolicy(enabled, mode, scanFunctions, functions, customPatterns, excludePatterns);
    }

    public CodePolicy withPatterns(List<String> custom, List<String> exclude) {
        return new CodePolicy(enabled, mode, scanFunctions, excludeFunctions, custom, exclude);
    }

    static List<String> copy(List<String> in) {
        return in == null ? List.of() : List.copyOf(in);
    }
}
