package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.AccessDecision;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.policy.AccessPolicy;
import ae.teletronics.uploadguard.domain.policy.MacroPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.apache.poi.poifs.filesystem.DirectoryEntry;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class MacroScannerTest {

    private static final String PLAIN_TYPES = "<Types><Override PartName=\"/word/document.xml\" "
            + "ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/></Types>";
    private static final String MACRO_TYPES = "<Types><Override PartName=\"/word/document.xml\" "
            + "ContentType=\"application/vnd.ms-word.document.macroEnabled.main+xml\"/></Types>";

    @TempDir
    Path root;

    private MacroScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new MacroScanner(new AccessValidator(List.of(root)));
    }

    @Test
    void plain_docx_is_safe() throws IOException {
        Path f = ooxml("report.docx", PLAIN_TYPES, Map.of("word/document.xml", "<w:document/>"));

        ScanResult r = scanner.scan(new ScanTarget(f, "report.docx"), ScanPolicy.defaults());

        assertThat(r.safe()).isTrue();
        assertThat(r.flags()).isEmpty();
    }

    @Test
    void vba_project_in_docm_is_reported() throws IOException {
        Path f = ooxml("report.docm", MACRO_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/vbaProject.bin", "VBA"));

        ScanResult r = scanner.scan(new ScanTarget(f, "report.docm"), ScanPolicy.defaults());

        assertThat(r.threats()).contains(
                "VBA macro detected: word/vbaProject.bin",
                "Macro content type detected: application/vnd.ms-word.document.macroEnabled.main+xml");
        assertThat(r.threats()).noneMatch(t -> t.startsWith("Macro-enabled document disguised"));
        assertThat(r.hasFlag(ScanFlag.HAS_MACROS)).isTrue();
    }

    @Test
    void macros_under_docx_name_are_a_disguise() throws IOException {
        Path f = ooxml("invoice.docx", PLAIN_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/vbaProject.bin", "VBA"));

        ScanResult r = scanner.scan(new ScanTarget(f, "invoice.docx"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly(
                "VBA macro detected: word/vbaProject.bin",
                "Macro-enabled document disguised as .docx");
    }

    @Test
    void vba_project_in_unusual_location_is_found() throws IOException {
        Path f = ooxml("book.xlsm", PLAIN_TYPES, Map.of(
                "xl/workbook.xml", "<workbook/>",
                "custom/hidden/VbaProject.bin", "VBA"));

        assertThat(scanner.scan(new ScanTarget(f, "book.xlsm"), ScanPolicy.defaults()).threats())
                .containsExactly("VBA macro detected: custom/hidden/VbaProject.bin");
    }

    @Test
    void macros_are_flagged_but_allowed_when_not_blocked() throws IOException {
        Path f = ooxml("report.docm", MACRO_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/vbaProject.bin", "VBA"));
        ScanPolicy policy = ScanPolicy.defaults().withMacro(MacroPolicy.defaults().withBlocking(false, true));

        ScanResult r = scanner.scan(new ScanTarget(f, "report.docm"), policy);

        assertThat(r.safe()).isTrue();
        assertThat(r.hasFlag(ScanFlag.HAS_MACROS)).isTrue();
    }

    @Test
    void disguise_check_respects_allowed_extensions() throws IOException {
        Path f = ooxml("invoice.docx", PLAIN_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/vbaProject.bin", "VBA"));
        ScanPolicy policy = ScanPolicy.defaults().withMacro(MacroPolicy.defaults()
                .withBlocking(false, true)
                .withAllowedMacroExtensions(List.of("docx")));

        assertThat(scanner.scan(new ScanTarget(f, "invoice.docx"), policy).safe()).isTrue();
    }

    @Test
    void activex_and_ole_objects_are_legacy_controls() throws IOException {
        Path f = ooxml("form.docx", PLAIN_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/activeX/activeX1.xml", "<ax/>",
                "word/embeddings/oleObject1.bin", "OLE"));

        ScanResult r = scanner.scan(new ScanTarget(f, "form.docx"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly("ActiveX control detected: 2 control(s)");
        assertThat(r.hasFlag(ScanFlag.HAS_LEGACY_CONTROLS)).isTrue();

        ScanPolicy relaxed = ScanPolicy.defaults().withMacro(MacroPolicy.defaults().withBlocking(true, false));
        assertThat(scanner.scan(new ScanTarget(f, "form.docx"), relaxed).safe()).isTrue();
    }

    @Test
    void each_manifest_declaration_is_reported_once() throws IOException {
        String types = "<Types>"
                + "<Default Extension=\"bin\" ContentType=\"application/vnd.ms-office.vbaProject\"/>"
                + "<Override PartName=\"/xl/workbook.xml\" "
                + "ContentType=\"application/vnd.ms-excel.sheet.macroEnabled.main+xml\"/></Types>";
        Path f = ooxml("book.xlsm", types, Map.of(
                "xl/workbook.xml", "<workbook/>",
                "xl/vbaProject.bin", "VBA"));

        assertThat(scanner.scan(new ScanTarget(f, "book.xlsm"), ScanPolicy.defaults()).threats()).containsExactly(
                "VBA macro detected: xl/vbaProject.bin",
                "Macro content type detected: application/vnd.ms-office.vbaProject",
                "Macro content type detected: application/vnd.ms-excel.sheet.macroEnabled.main+xml");
    }

    @Test
    void macro_types_pick_the_most_specific_match() {
        assertThat(MacroScanner.macroTypes(MACRO_TYPES))
                .containsExactly("application/vnd.ms-word.document.macroEnabled.main+xml");
        assertThat(MacroScanner.macroTypes("<Override ContentType='application/vnd.ms-word.document.macroEnabled.12'/>"))
                .containsExactly("application/vnd.ms-word.document.macroEnabled");
        assertThat(MacroScanner.macroTypes(PLAIN_TYPES)).isEmpty();
    }

    @Test
    void link_swapped_in_after_validation_is_not_followed() throws IOException {
        Path real = ooxml("real.docm", MACRO_TYPES, Map.of(
                "word/document.xml", "<w:document/>",
                "word/vbaProject.bin", "VBA"));
        Path link = Files.createSymbolicLink(root.resolve("report.docm"), real);
        AccessValidator access = spy(new AccessValidator(List.of(root)));
        // the upload passed validation and was then replaced by a link
        doReturn(AccessDecision.allow()).when(access).validate(any(Path.class), any(AccessPolicy.class));
        doReturn(Files.readAllBytes(real)).when(access).readPrefix(any(), anyInt(), any());

        ScanResult r = new MacroScanner(access).scan(new ScanTarget(link, "report.docm"), ScanPolicy.defaults());

        assertThat(r.safe()).isFalse();
        assertThat(r.threats()).singleElement().asString().startsWith("Scan failed: ");
    }

    @Test
    void zip_without_office_structure_is_rejected() throws IOException {
        Path f = ooxml("fake.docx", null, Map.of("readme.txt", "hi"));

        assertThat(scanner.scan(new ScanTarget(f, "fake.docx"), ScanPolicy.defaults()).threats())
                .containsExactly("File is not a valid Office document");
    }

    @Test
    void legacy_compound_document_with_macro_storage() throws IOException {
        Path f = root.resolve("old.doc");
        try (POIFSFileSystem fs = new POIFSFileSystem()) {
            fs.createDocument(new ByteArrayInputStream(new byte[]{1, 2, 3}), "WordDocument");
            DirectoryEntry macros = fs.getRoot().createDirectory("Macros");
            macros.createDirectory("VBA").createDocument("dir", new ByteArrayInputStream(new byte[]{4}));
            DirectoryEntry pool = fs.getRoot().createDirectory("ObjectPool");
            pool.createDirectory("_1234").createDocument("Ole", new ByteArrayInputStream(new byte[]{5}));
            try (OutputStream out = Files.newOutputStream(f)) {
                fs.writeFilesystem(out);
            }
        }

        ScanResult r = scanner.scan(new ScanTarget(f, "old.doc"), ScanPolicy.defaults());

        assertThat(r.threats()).containsExactly(
                "VBA macro detected: Macros",
                "Embedded OLE object detected: 1 object(s)");
        assertThat(r.hasFlag(ScanFlag.HAS_MACROS)).isTrue();
        assertThat(r.hasFlag(ScanFlag.HAS_LEGACY_CONTROLS)).isTrue();
    }

    @Test
    void clean_legacy_document_is_safe() throws IOException {
        Path f = root.resolve("clean.doc");
        try (POIFSFileSystem fs = new POIFSFileSystem()) {
            fs.createDocument(new ByteArrayInputStream(new byte[]{1, 2, 3}), "WordDocument");
            try (OutputStream out = Files.newOutputStream(f)) {
                fs.writeFilesystem(out);
            }
        }

        assertThat(scanner.scan(new ScanTarget(f, "clean.doc"), ScanPolicy.defaults()).safe()).isTrue();
    }

    private Path ooxml(String name, String contentTypes, Map<String, String> parts) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        if (contentTypes != null) entries.put("[Content_Types].xml", contentTypes);
        entries.putAll(parts);
        Path f = root.resolve(name);
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(f))) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return f;
    }
}
