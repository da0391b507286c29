package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

import static ae.teletronics.uploadguard.domain.policy.CodePolicy.copy;

/**
 * @param allowedMacroExtensions extensions removed from the non-macro list, so macros under them are not
 *                               reported as a disguise
 */
public record MacroPolicy(boolean enabled,
                          boolean blockMacros,
                          boolean blockLegacyControls,
                          List<String> allowedMacroExtensions) {

    public MacroPolicy {
        allowedMacroExtensions = copy(allowedMacroExtensions);
    }

    public static MacroPolicy defaults() {
        return new MacroPolicy(true, true, true, List.of());
    }

    public MacroPolicy withBlocking(boolean macros, boolean legacyControls) {
        return new MacroPolicy(enabled, macros, legacyControls, allowedMacroExtensions);
    }

    public MacroPolicy withAllowedMacroExtensions(List<String> extensions) {
        return new MacroPolicy(enabled, blockMacros, blockLegacyControls, extensions);
    }
}
