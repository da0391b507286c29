package ae.teletronics.uploadguard.domain.model;

public record DetectedType(String mediaType, Source source) {

    public enum Source { CUSTOM_SIGNATURE, SIGNATURE, FALLBACK, UNKNOWN }

    public static final DetectedType UNKNOWN = new DetectedType(MediaTypes.OCTET_STREAM, Source.UNKNOWN);

    public boolean isKnown() {
        return source != Source.UNKNOWN;
    }
}
