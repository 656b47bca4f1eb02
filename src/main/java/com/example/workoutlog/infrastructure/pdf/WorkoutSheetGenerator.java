package com.example.workoutlog.infrastructure.pdf;

import com.example.workoutlog.domain.model.ExerciseSlot;
import com.example.workoutlog.domain.model.SheetLayout;
import com.example.workoutlog.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Infrastructure adapter that draws a blank workout sheet with PDFBox: the title, then each exercise
 * line followed by an empty box spanning the margins for handwriting.
 */
@Component
public class WorkoutSheetGenerator {

    private static final Logger log = LoggerFactory.getLogger(WorkoutSheetGenerator.class);
    private static final float TITLE_FONT_SIZE = 18f;
    private static final float LABEL_FONT_SIZE = 12f;

    /**
     * Renders the sheet. The caller guarantees that the lines fit the layout.
     *
     * @param layout        page geometry
     * @param title         title printed at the top
     * @param exerciseLines one printed line per box, top to bottom
     * @return PDF bytes
     * @throws PdfProcessingException when PDFBox cannot render or save the document
     */
    public byte[] generate(SheetLayout layout, String title, List<String> exerciseLines) {
        List<ExerciseSlot> slots = layout.slots();
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(new PDRectangle(layout.pageWidth(), layout.pageHeight()));
            document.addPage(page);
            document.getDocumentInformation().setTitle(title);

            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                writeLine(contentStream, new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), TITLE_FONT_SIZE,
                        layout.margin(), layout.titleBaseline(), title);

                PDType1Font labelFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
                for (int i = 0; i < exerciseLines.size(); i++) {
                    ExerciseSlot slot = slots.get(i);
                    writeLine(contentStream, labelFont, LABEL_FONT_SIZE, slot.left(), slot.labelBaseline(), exerciseLines.get(i));
                    contentStream.addRect(slot.left(), slot.boxBottom(), slot.width(), slot.boxHeight());
                    contentStream.stroke();
                }
            }

            document.save(outputStream);
            log.info("Generated workout sheet '{}' with {} exercise(s)", title, exerciseLines.size());
            return outputStream.toByteArray();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to render the workout sheet.", e);
        } catch (IllegalArgumentException e) {
            // thrown by PDFBox for glyphs the standard fonts cannot encode
            throw new PdfProcessingException("The workout sheet contains characters that cannot be printed.", e);
        }
    }

    private void writeLine(PDPageContentStream contentStream, PDType1Font font, float size,
                           float x, float y, String text) throws IOException {
        contentStream.beginText();
        contentStream.setFont(font, size);
        contentStream.newLineAtOffset(x, y);
        contentStream.showText(text);
        contentStream.endText();
    }
}
