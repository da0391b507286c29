package ae.teletronics.uploadguard.adapters.web.dto;

import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.MediaTypes;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public record ScanResponse(
        String filename,
        String detectedType,
        boolean safe,
        List<String> threats,
        List<String> flags,
        Map<String, String> details
) {
    public static ScanResponse from(String filename, ScanResult r) {
        return new ScanResponse(
                filename,
                r.details().getOrDefault("detectedType", MediaTypes.OCTET_STREAM),
                r.safe(),
                r.threats(),
                r.flags().stream().map(ScanFlag::name).map(s -> s.toLowerCase(Locale.ROOT)).toList(),
                r.details()
        );
    }
}
