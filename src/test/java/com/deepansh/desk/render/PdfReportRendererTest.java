package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.support.DeskFixtures;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PdfReportRendererTest {

    private static final String BUNDLED_FONT = "/org/apache/pdfbox/resources/ttf/LiberationSans-Regular.ttf";

    @TempDir
    Path tempDir;

    @Test
    void render_travelReport_listsRoutesAndTotal() throws Exception {
        PdfReportRenderer renderer = new PdfReportRenderer(tempDir, DeskFixtures.CLOCK);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("routes", List.of(
                Map.of("departure", "Tokyo", "destination", "Yokohama", "date", "2026-10-10",
                        "transportType", "train", "cost", 490L),
                Map.of("departure", "Yokohama", "destination", "Tokyo", "date", "2026-10-13",
                        "transportType", "train", "cost", 490L)));
        params.put("purpose", "Client visit");
        params.put("totalAmount", 980L);

        RenderResult result = renderer.render(new RenderRequest("travel_expense_report", params,
                ContextBag.of(ContextKeys.REQUESTER_ID, "Sato")));

        assertThat(result.success()).isTrue();
        String text = extractText(Path.of(result.artifactLocation()));
        assertThat(text).contains("Travel Expense Report")
                .contains("Applicant: Sato")
                .contains("Route 2: Yokohama - Tokyo")
                .contains("Total: 980 yen");
    }

    @Test
    void render_withTrueTypeFont_keepsTextOutsideWinAnsi() throws Exception {
        Path font = copyBundledFont();
        PdfReportRenderer renderer = new PdfReportRenderer(tempDir, DeskFixtures.CLOCK, List.of(font));

        RenderResult result = renderer.render(new RenderRequest("receipt_expense_report",
                Map.of("storeName", "Дом книги", "items", "Ωmega notebook", "totalAmount", 1800L),
                ContextBag.of(ContextKeys.REQUESTER_ID, "Łukasz")));

        assertThat(result.success()).isTrue();
        assertThat(extractText(Path.of(result.artifactLocation())))
                .contains("Applicant: Łukasz")
                .contains("Store: Дом книги")
                .contains("Items: Ωmega notebook");
    }

    @Test
    void render_withTrueTypeFont_replacesOnlyGlyphsTheFontLacks() throws Exception {
        Path font = copyBundledFont();
        PdfReportRenderer renderer = new PdfReportRenderer(tempDir, DeskFixtures.CLOCK, List.of(font));

        RenderResult result = renderer.render(new RenderRequest("receipt_expense_report",
                Map.of("storeName", "丸善 Books", "totalAmount", 1800L), ContextBag.empty()));

        assertThat(result.success()).isTrue();
        assertThat(extractText(Path.of(result.artifactLocation()))).contains("Store: ?? Books");
    }

    @Test
    void render_unreadableFontCandidates_fallBackToHelvetica() throws Exception {
        PdfReportRenderer renderer = new PdfReportRenderer(tempDir, DeskFixtures.CLOCK,
                List.of(tempDir.resolve("missing.ttf")));

        RenderResult result = renderer.render(new RenderRequest("receipt_expense_report",
                Map.of("storeName", "Caf\u00e9 丸善", "totalAmount", 1800L), ContextBag.empty()));

        assertThat(result.success()).isTrue();
        assertThat(extractText(Path.of(result.artifactLocation()))).contains("Store: Caf\u00e9 ??");
    }

    @Test
    void render_longReport_spansPages() throws Exception {
        PdfReportRenderer renderer = new PdfReportRenderer(tempDir, DeskFixtures.CLOCK);
        List<Map<String, Object>> routes = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            routes.add(Map.of("departure", "Tokyo", "destination", "Shinagawa", "date", "2026-10-10",
                    "transportType", "train", "cost", 170L));
        }

        RenderResult result = renderer.render(new RenderRequest("travel_expense_report",
                Map.of("routes", routes, "totalAmount", 6800L), ContextBag.empty()));

        try (PDDocument document = Loader.loadPDF(Path.of(result.artifactLocation()).toFile())) {
            assertThat(document.getNumberOfPages()).isGreaterThan(1);
        }
    }

    /** Liberation Sans ships inside the PDFBox jar; it covers Latin, Greek and Cyrillic but no CJK. */
    private Path copyBundledFont() throws Exception {
        try (InputStream in = PDDocument.class.getResourceAsStream(BUNDLED_FONT)) {
            assumeTrue(in != null, "PDFBox bundled font not on the classpath");
            Path font = tempDir.resolve("fonts").resolve("LiberationSans-Regular.ttf");
            Files.createDirectories(font.getParent());
            Files.copy(in, font);
            return font;
        }
    }

    private static String extractText(Path file) throws Exception {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }
}
