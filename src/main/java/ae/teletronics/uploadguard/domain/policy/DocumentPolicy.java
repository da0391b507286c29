package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

import static ae.teletronics.uploadguard.domain.policy.CodePolicy.copy;

/**
 * @param blockJavaScript    report embedded script even when its action names were excluded
 * @param blockExternalLinks report external references as findings rather than only flagging them
 */
public record DocumentPolicy(boolean enabled,
                             boolean blockJavaScript,
                             boolean blockExternalLinks,
                             List<String> customActions,
                             List<String> excludeActions) {

    public DocumentPolicy {
        customActions = copy(customActions);
        excludeActions = copy(excludeActions);
    }

    public static DocumentPolicy defaults() {
        return new DocumentPolicy(true, true, false, List.of(), List.of());
    }

    public DocumentPolicy withActions(List<String> custom, List<String> exclude) {
        return new DocumentPolicy(enabled, blockJavaScript, blockExternalLinks, custom, exclude);
    }

    public DocumentPolicy withBlocking(boolean javaScript, boolean externalLinks) {
        return new DocumentPolicy(enabled, javaScript, externalLinks, customActions, excludeActions);
    }
}
