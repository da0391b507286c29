package ae.teletronics.uploadguard.adapters.logging;

import ae.teletronics.uploadguard.domain.model.SecurityEvent;
import ae.teletronics.uploadguard.domain.model.Severity;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class Slf4jSecurityEventSinkTest {

    @Mock
    Logger log;

    private static final Map<String, Object> CONTEXT = Map.of("filename", "a.php");

    @Test
    void severity_selects_log_level() {
        Slf4jSecurityEventSink sink = new Slf4jSecurityEventSink(log, true, false);

        sink.record(new SecurityEvent(ThreatType.CODE_INJECTION, null, "PHP opening tag (<?php) detected", CONTEXT));
        sink.record(new SecurityEvent(ThreatType.MIME_MISMATCH, null, "File extension .jpg does not match", CONTEXT));
        sink.record(new SecurityEvent(ThreatType.GPS_DETECTED, null, "Image contains GPS location data", CONTEXT));

        verify(log).error("[{}] {}", "code_injection", "PHP opening tag (<?php) detected");
        verify(log).warn("[{}] {}", "mime_mismatch", "File extension .jpg does not match");
        verify(log).info("[{}] {}", "gps_detected", "Image contains GPS location data");
    }

    @Test
    void explicit_severity_overrides_the_default() {
        Slf4jSecurityEventSink sink = new Slf4jSecurityEventSink(log, true, false);

        sink.record(new SecurityEvent(ThreatType.ARCHIVE_THREAT, Severity.LOW, "Nested archive", CONTEXT));

        verify(log).info("[{}] {}", "archive_threat", "Nested archive");
    }

    @Test
    void detailed_mode_appends_context() {
        Slf4jSecurityEventSink sink = new Slf4jSecurityEventSink(log, true, true);

        sink.record(new SecurityEvent(ThreatType.DECOMPRESSION_BOMB, null, "Potential zip bomb detected", CONTEXT));

        verify(log).error("[{}] {} {}", "decompression_bomb", "Potential zip bomb detected", CONTEXT);
    }

    @Test
    void disabled_sink_logs_nothing() {
        Slf4jSecurityEventSink sink = new Slf4jSecurityEventSink(log, false, true);

        sink.record(new SecurityEvent(ThreatType.CODE_INJECTION, null, "x", CONTEXT));

        verifyNoInteractions(log);
    }
}
