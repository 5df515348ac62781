package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.support.DeskFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportRendererTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = DeskFixtures.objectMapper();

    @Test
    void render_writesApplicantFromContextAndDetails() throws Exception {
        JsonReportRenderer renderer = new JsonReportRenderer(tempDir, DeskFixtures.CLOCK, mapper);
        ContextBag context = ContextBag.of(Map.of(
                ContextKeys.REQUESTER_ID, "Sato",
                ContextKeys.SESSION_ID, "s1",
                ContextKeys.APPLICATION_DATE, "2026-10-19"));

        RenderResult result = renderer.render(new RenderRequest("receipt_expense_report",
                Map.of("storeName", "Maruzen", "totalAmount", 1800L), context));

        assertThat(result.success()).isTrue();
        Path file = Path.of(result.artifactLocation());
        assertThat(file.getFileName().toString()).isEqualTo("receipt_expense_report_20261019_100000.json");

        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.get("title").asText()).isEqualTo("Receipt Expense Report");
        assertThat(json.get("applicant").asText()).isEqualTo("Sato");
        assertThat(json.get("sessionId").asText()).isEqualTo("s1");
        assertThat(json.get("details").get("totalAmount").asLong()).isEqualTo(1800L);
    }

    @Test
    void render_withoutRequester_usesPlaceholder() throws Exception {
        JsonReportRenderer renderer = new JsonReportRenderer(tempDir, DeskFixtures.CLOCK, mapper);

        RenderResult result = renderer.render(new RenderRequest("receipt_expense_report", Map.of(), ContextBag.empty()));

        JsonNode json = mapper.readTree(Path.of(result.artifactLocation()).toFile());
        assertThat(json.get("applicant").asText()).isEqualTo(FileReportRenderer.UNKNOWN_APPLICANT);
    }

    @Test
    void render_sameSecondTwice_doesNotOverwrite() {
        JsonReportRenderer renderer = new JsonReportRenderer(tempDir, DeskFixtures.CLOCK, mapper);
        RenderRequest request = new RenderRequest("travel_expense_report", Map.of(), ContextBag.empty());

        RenderResult first = renderer.render(request);
        RenderResult second = renderer.render(request);

        assertThat(second.artifactLocation()).isNotEqualTo(first.artifactLocation())
                .endsWith("travel_expense_report_20261019_100000_2.json");
    }

    @Test
    void render_unwritableDirectory_reportsFailure() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("occupied"), "x");
        JsonReportRenderer renderer = new JsonReportRenderer(notADirectory, DeskFixtures.CLOCK, mapper);

        RenderResult result = renderer.render(new RenderRequest("travel_expense_report", Map.of(), ContextBag.empty()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorMessage()).contains("could not be written");
    }
}
