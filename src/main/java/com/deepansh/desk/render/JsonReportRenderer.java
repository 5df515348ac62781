package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the approved action as a pretty-printed JSON document.
 */
public class JsonReportRenderer extends FileReportRenderer {

    private final ObjectMapper objectMapper;

    public JsonReportRenderer(Path outputDirectory, Clock clock, ObjectMapper objectMapper) {
        super(outputDirectory, clock);
        this.objectMapper = objectMapper;
    }

    @Override
    protected String extension() {
        return "json";
    }

    @Override
    protected void write(Path target, RenderRequest request, String applicant) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", ReportLines.title(request.actionName()));
        document.put("action", request.actionName());
        document.put("applicant", applicant);
        document.put("applicationDate", ContextPropagator.valueOf(
                request.context(), ContextKeys.APPLICATION_DATE, null));
        document.put("sessionId", ContextPropagator.valueOf(
                request.context(), ContextKeys.SESSION_ID, null));
        document.put("generatedAt", clock.instant().toString());
        document.put("details", request.parameters());

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
    }
}
