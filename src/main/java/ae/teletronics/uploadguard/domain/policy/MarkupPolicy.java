package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

import static ae.teletronics.uploadguard.domain.policy.CodePolicy.copy;

public record MarkupPolicy(boolean enabled,
                           List<String> customTags,
                           List<String> excludeTags,
                           List<String> customAttributes,
                           List<String> excludeAttributes) {

    public MarkupPolicy {
        customTags = copy(customTags);
        excludeTags = copy(excludeTags);
        customAttributes = copy(customAttributes);
        excludeAttributes = copy(excludeAttributes);
    }

    public static MarkupPolicy defaults() {
        return new MarkupPolicy(true, List.of(), List.of(), List.of(), List.of());
    }

    public MarkupPolicy withTags(List<String> custom, List<String> exclude) {
        return new MarkupPolicy(enabled, custom, exclude, customAttributes, excludeAttributes);
    }

    public MarkupPolicy withAttributes(List<String> custom, List<String> exclude) {
        return new MarkupPolicy(enabled, customTags, excludeTags, custom, exclude);
    }
}
