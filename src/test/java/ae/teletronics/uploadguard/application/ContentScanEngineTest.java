package ae.teletronics.uploadguard.application;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.archive.ArchiveInspector;
import ae.teletronics.uploadguard.application.detection.FormatIdentifier;
import ae.teletronics.uploadguard.application.scanning.CodeInjectionScanner;
import ae.teletronics.uploadguard.application.scanning.DocumentActionScanner;
import ae.teletronics.uploadguard.application.scanning.MacroScanner;
import ae.teletronics.uploadguard.application.scanning.MarkupInjectionScanner;
import ae.teletronics.uploadguard.application.scanning.MetadataScanner;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.SecurityEvent;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.MetadataPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.SecurityEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ContentScanEngineTest {

    @TempDir
    Path root;

    @Mock
    SecurityEventSink sink;

    private Path uploads;
    private ContentScanEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        uploads = Files.createDirectory(root.resolve("uploads"));
        AccessValidator access = new AccessValidator(List.of(uploads));
        engine = ContentScanEngine.create(access, new FormatIdentifier(null, access), sink);
    }

    @Test
    void clean_text_passes_without_events() throws IOException {
        Path f = write("notes.txt", "Meeting at noon.\n".getBytes(StandardCharsets.UTF_8));

        ScanResult r = engine.scanFile(new ScanTarget(f, "notes.txt"), ScanPolicy.defaults());

        assertThat(r.safe()).isTrue();
        assertThat(r.details()).containsEntry("detectionSource", "unknown");
        verify(sink, never()).record(any());
    }

    @Test
    void executable_disguised_as_pdf_is_rejected_and_reported() throws IOException {
        byte[] pe = new byte[64];
        pe[0] = 'M';
        pe[1] = 'Z';
        Path f = write("invoice.pdf", pe);

        ScanResult r = engine.scanFile(new ScanTarget(f, "invoice.pdf"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly(
                "Dangerous file type detected: application/x-msdownload",
                "File extension .pdf does not match detected type application/x-msdownload",
                "Not a valid PDF file");
        assertThat(r.details()).containsEntry("detectedType", "application/x-msdownload");

        ArgumentCaptor<SecurityEvent> events = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(sink, times(3)).record(events.capture());
        SecurityEvent first = events.getAllValues().get(0);
        assertThat(first.type()).isEqualTo(ThreatType.DANGEROUS_FILE);
        assertThat(first.severity()).isEqualTo(ThreatType.DANGEROUS_FILE.defaultSeverity());
        assertThat(first.context())
                .containsEntry("filename", "invoice.pdf")
                .containsEntry("size", 64L)
                .containsEntry("detectedType", "application/x-msdownload")
                .containsEntry("threats", r.threats());
        assertThat((String) first.context().get("sha256")).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void php_renamed_to_jpg_is_caught_by_content() throws IOException {
        Path f = write("avatar.jpg", "<?php system($_GET['c']); ?>".getBytes(StandardCharsets.US_ASCII));

        ScanResult r = engine.scanFile(new ScanTarget(f, "avatar.jpg"), ScanPolicy.defaults());

        assertThat(r.threats()).contains(
                "Dangerous file type detected: application/x-php",
                "File extension .jpg does not match detected type application/x-php",
                "PHP opening tag (<?php) detected",
                "Dangerous function detected: system()");
    }

    @Test
    void archive_members_are_inspected() throws IOException {
        Path f = uploads.resolve("tools.zip");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(f))) {
            zip.putNextEntry(new ZipEntry("readme.txt"));
            zip.write("read me".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("setup.exe"));
            zip.write("MZ".getBytes(StandardCharsets.US_ASCII));
            zip.closeEntry();
        }

        ScanResult r = engine.scanFile(new ScanTarget(f, "tools.zip"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly("Dangerous file detected in archive: setup.exe");
        assertThat(r.details()).containsEntry("archive.format", "zip");
    }

    @Test
    void office_document_goes_to_macro_scanner_not_archive_scanner() throws IOException {
        Path f = uploads.resolve("report.docx");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(f))) {
            zip.putNextEntry(new ZipEntry("[Content_Types].xml"));
            zip.write("<Types/>".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("word/document.xml"));
            zip.write("<w:document/>".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("word/vbaProject.bin"));
            zip.write(new byte[]{1, 2, 3});
            zip.closeEntry();
        }

        ScanResult r = engine.scanFile(new ScanTarget(f, "report.docx"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly(
                "VBA macro detected: word/vbaProject.bin",
                "Macro-enabled document disguised as .docx");
        assertThat(r.details()).doesNotContainKey("archive.format");
    }

    @Test
    void file_outside_allowed_roots_is_denied_and_not_hashed() throws IOException {
        Path outside = Files.writeString(root.resolve("elsewhere.txt"), "hello");

        ScanResult r = engine.scanFile(new ScanTarget(outside, "elsewhere.txt"), ScanPolicy.defaults());

        assertThat(r.safe()).isFalse();
        ArgumentCaptor<SecurityEvent> events = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(sink).record(events.capture());
        assertThat(events.getValue().context())
                .containsKey("filename")
                .doesNotContainKeys("sha256", "size");
    }

    @Test
    void failing_sink_does_not_change_the_verdict() throws IOException {
        doThrow(new IllegalStateException("sink down")).when(sink).record(any());
        Path f = write("run.sh", "#!/bin/sh\nrm -rf /\n".getBytes(StandardCharsets.US_ASCII));

        ScanResult r = engine.scanFile(new ScanTarget(f, "run.sh"), ScanPolicy.defaults());

        assertThat(r.threats()).contains("Dangerous file type detected: text/x-shellscript");
    }

    @Test
    void clean_jpeg_is_stripped_when_requested() throws IOException {
        BufferedImage img = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        Path f = uploads.resolve("photo.jpg");
        ImageIO.write(img, "jpg", f.toFile());
        ScanPolicy policy = ScanPolicy.defaults().withMetadata(MetadataPolicy.defaults().withStripMetadata(true));

        ScanResult r = engine.scanFile(new ScanTarget(f, "photo.jpg"), policy);

        assertThat(r.safe()).isTrue();
        assertThat(r.hasFlag(ScanFlag.METADATA_STRIPPED)).isTrue();
        assertThat(r.details()).containsEntry("detectedType", "image/jpeg");
    }

    @Test
    void jpeg_with_payload_before_a_fake_end_marker_is_rejected() throws IOException {
        BufferedImage img = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ImageIO.write(img, "jpg", bytes);
        bytes.write("<?php system($_GET['c']); ?>".getBytes(StandardCharsets.US_ASCII));
        bytes.write(new byte[]{(byte) 0xFF, (byte) 0xD9});
        Path f = write("avatar.jpg", bytes.toByteArray());

        ScanResult r = engine.scanFile(new ScanTarget(f, "avatar.jpg"), ScanPolicy.defaults());

        assertThat(r.safe()).isFalse();
        assertThat(r.details()).containsEntry("detectedType", "image/jpeg");
        assertThat(r.threats()).contains(
                "PHP opening tag (<?php) found in image data",
                "Script code detected after image end marker");
    }

    @Test
    void scanning_the_same_archive_twice_gives_the_same_result() throws IOException {
        Path f = uploads.resolve("bundle.zip");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(f))) {
            for (String name : List.of("../../etc/passwd", "setup.exe", "invoice.pdf.exe", "docs/readme.txt")) {
                zip.putNextEntry(new ZipEntry(name));
                zip.write(name.getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        ScanTarget target = new ScanTarget(f, "bundle.zip");

        ScanResult first = engine.scanFile(target, ScanPolicy.defaults());
        ScanResult second = engine.scanFile(target, ScanPolicy.defaults());

        assertThat(first.threats()).hasSizeGreaterThanOrEqualTo(3);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void unreadable_pdf_info_keeps_the_findings() throws IOException {
        AccessValidator access = new AccessValidator(List.of(uploads));
        FormatIdentifier formats = new FormatIdentifier(null, access);
        DocumentActionScanner document = spy(new DocumentActionScanner(access));
        doThrow(new IOException("read interrupted")).when(document).extractInfo(any(), any());
        ContentScanEngine engine = new ContentScanEngine(access, formats,
                new CodeInjectionScanner(access, formats),
                new MarkupInjectionScanner(access),
                new MetadataScanner(access, formats),
                document,
                new MacroScanner(access),
                new ArchiveInspector(access),
                sink);
        Path f = write("report.pdf", ("%PDF-1.4\n1 0 obj << /OpenAction << /S /JavaScript /JS (app.alert('x');) >> >> endobj\n"
                + "2 0 obj << /Title (Quarterly) >> endobj\n%%EOF").getBytes(StandardCharsets.US_ASCII));

        ScanResult r = engine.scanFile(new ScanTarget(f, "report.pdf"), ScanPolicy.defaults());

        assertThat(r.threats())
                .contains("JavaScript code detected in PDF")
                .noneMatch(t -> t.startsWith("Scan failed"));
        assertThat(r.details().keySet()).noneMatch(k -> k.startsWith("pdf."));
    }

    private Path write(String name, byte[] content) throws IOException {
        return Files.write(uploads.resolve(name), content);
    }
}
