package com.deepansh.desk.render;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Writes a single-column A4 report with Apache PDFBox.
 *
 * Text is set in the first readable TrueType font from the configured
 * candidates, embedded as a subset, so Japanese names and items survive.
 * Without one, standard Helvetica is used; it only covers WinAnsi and any
 * other character is printed as '?'.
 */
@Slf4j
public class PdfReportRenderer extends FileReportRenderer {

    private static final float MARGIN = 56f;
    private static final float LEADING = 16f;
    private static final float BODY_SIZE = 11f;
    private static final float TITLE_SIZE = 16f;

    private final Path fontFile;

    public PdfReportRenderer(Path outputDirectory, Clock clock) {
        this(outputDirectory, clock, List.of());
    }

    public PdfReportRenderer(Path outputDirectory, Clock clock, List<Path> fontCandidates) {
        super(outputDirectory, clock);
        this.fontFile = firstReadable(fontCandidates).orElse(null);
        if (fontFile != null) {
            log.info("PDF reports use font {}", fontFile);
        } else if (!fontCandidates.isEmpty()) {
            log.warn("None of the PDF fonts {} is readable; falling back to Helvetica", fontCandidates);
        }
    }

    @Override
    protected String extension() {
        return "pdf";
    }

    @Override
    protected void write(Path target, RenderRequest request, String applicant) throws IOException {
        List<String> lines = ReportLines.lines(request, applicant);

        try (PDDocument document = new PDDocument()) {
            PDFont regular;
            PDFont title;
            if (fontFile != null) {
                regular = PDType0Font.load(document, fontFile.toFile());
                title = regular;
            } else {
                regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
                title = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            }

            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            float top = page.getMediaBox().getHeight() - MARGIN;
            int linesPerPage = (int) ((top - MARGIN) / LEADING) - 2;

            PDPageContentStream content = new PDPageContentStream(document, page);
            content.beginText();
            content.setFont(title, TITLE_SIZE);
            content.newLineAtOffset(MARGIN, top);
            content.showText(printable(ReportLines.title(request.actionName()), title));
            content.setFont(regular, BODY_SIZE);
            content.newLineAtOffset(0, -2 * LEADING);

            int written = 0;
            for (String line : lines) {
                if (written == linesPerPage) {
                    content.endText();
                    content.close();
                    page = new PDPage(PDRectangle.A4);
                    document.addPage(page);
                    content = new PDPageContentStream(document, page);
                    content.beginText();
                    content.setFont(regular, BODY_SIZE);
                    content.newLineAtOffset(MARGIN, top);
                    written = 0;
                }
                content.showText(printable(line, regular));
                content.newLineAtOffset(0, -LEADING);
                written++;
            }
            content.endText();
            content.close();

            document.save(target.toFile());
        }
    }

    /** Replaces control characters, and characters the font has no glyph for, with '?'. */
    static String printable(String text, PDFont font) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            sb.append(!Character.isISOControl(cp) && canEncode(font, ch) ? ch : "?");
        });
        return sb.toString();
    }

    private static boolean canEncode(PDFont font, String ch) {
        try {
            font.encode(ch);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private static Optional<Path> firstReadable(List<Path> candidates) {
        return candidates.stream()
                .filter(Files::isRegularFile)
                .filter(Files::isReadable)
                .findFirst();
    }
}
