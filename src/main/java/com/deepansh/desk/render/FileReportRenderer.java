package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Base for renderers that write one file per approved action into an output
 * directory, named {@code <action>_<yyyyMMdd_HHmmss>.<ext>}.
 */
@Slf4j
public abstract class FileReportRenderer implements DocumentRenderer {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    protected static final String UNKNOWN_APPLICANT = "(not provided)";

    private final Path outputDirectory;
    protected final Clock clock;

    protected FileReportRenderer(Path outputDirectory, Clock clock) {
        this.outputDirectory = outputDirectory;
        this.clock = clock;
    }

    @Override
    public RenderResult render(RenderRequest request) {
        String applicant = ContextPropagator.valueOf(request.context(), ContextKeys.REQUESTER_ID, UNKNOWN_APPLICANT);
        try {
            Files.createDirectories(outputDirectory);
            Path target = nextTarget(request.actionName());
            write(target, request, applicant);
            log.info("Rendered {} to {} [session={}]", request.actionName(), target,
                    ContextPropagator.valueOf(request.context(), ContextKeys.SESSION_ID, "-"));
            return RenderResult.success(target.toAbsolutePath().toString());
        } catch (IOException | RuntimeException e) {
            log.error("Rendering {} failed", request.actionName(), e);
            return RenderResult.failure("The report could not be written (" + e.getClass().getSimpleName() + ").");
        }
    }

    protected abstract String extension();

    protected abstract void write(Path target, RenderRequest request, String applicant) throws IOException;

    private Path nextTarget(String actionName) {
        String stem = actionName + "_" + LocalDateTime.now(clock).format(FILE_STAMP);
        Path candidate = outputDirectory.resolve(stem + "." + extension());
        int n = 2;
        while (Files.exists(candidate)) {
            candidate = outputDirectory.resolve(stem + "_" + n++ + "." + extension());
        }
        return candidate;
    }
}
