package com.example.workoutlog.infrastructure.pdf;

import com.example.workoutlog.domain.model.ExerciseSlot;
import com.example.workoutlog.domain.model.PrintedSheet;
import com.example.workoutlog.domain.model.SheetLayout;
import com.example.workoutlog.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that reads the printed text of a filled workout sheet with PDFBox.
 * Label bands and box interiors are cropped with the same {@link SheetLayout} the generator draws with.
 */
@Component
public class WorkoutSheetReader {

    private static final Logger log = LoggerFactory.getLogger(WorkoutSheetReader.class);
    /** Space kept above a label baseline for ascenders. */
    private static final float LABEL_ASCENT = 14f;
    /** Space kept below a label baseline for descenders. */
    private static final float LABEL_DESCENT = 4f;

    /**
     * Reads the first page of the sheet.
     *
     * @param bytes PDF bytes
     * @return title, label lines and box texts in sheet order
     * @throws PdfProcessingException when PDFBox cannot read the document
     */
    public PrintedSheet read(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            if (document.getNumberOfPages() == 0) {
                return new PrintedSheet(null, List.of(), List.of(), 0);
            }
            PDPage page = document.getPage(0);
            PDRectangle mediaBox = page.getMediaBox();
            SheetLayout layout = SheetLayout.a4().withPageSize(mediaBox.getWidth(), mediaBox.getHeight());

            String title = readTitle(document);
            List<ExerciseSlot> slots = layout.slots();
            PDFTextStripperByArea stripper = new PDFTextStripperByArea();
            stripper.setSortByPosition(true);
            for (ExerciseSlot slot : slots) {
                stripper.addRegion(labelRegion(slot), labelBand(slot, layout.pageHeight()));
                stripper.addRegion(boxRegion(slot), boxInterior(slot, layout.pageHeight()));
            }
            stripper.extractRegions(page);

            List<String> labels = new ArrayList<>();
            List<String> boxTexts = new ArrayList<>();
            for (ExerciseSlot slot : slots) {
                String label = singleLine(stripper.getTextForRegion(labelRegion(slot)));
                if (label.isEmpty()) {
                    break;
                }
                labels.add(label);
                boxTexts.add(singleLine(stripper.getTextForRegion(boxRegion(slot))));
            }
            log.debug("Read {} exercise line(s) from sheet '{}'", labels.size(), title);
            return new PrintedSheet(title, labels, boxTexts, document.getNumberOfPages());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the workout sheet PDF.", e);
        }
    }

    /**
     * The title is the first non-blank line of the first page.
     */
    private String readTitle(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        stripper.setStartPage(1);
        stripper.setEndPage(1);
        return stripper.getText(document).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse(null);
    }

    // PDFTextStripperByArea regions are measured from the top of the page.
    private Rectangle2D labelBand(ExerciseSlot slot, float pageHeight) {
        float top = pageHeight - (slot.labelBaseline() + LABEL_ASCENT);
        return new Rectangle2D.Float(slot.left(), top, slot.width(), LABEL_ASCENT + LABEL_DESCENT);
    }

    private Rectangle2D boxInterior(ExerciseSlot slot, float pageHeight) {
        return new Rectangle2D.Float(slot.left(), pageHeight - slot.boxTop(), slot.width(), slot.boxHeight());
    }

    private String labelRegion(ExerciseSlot slot) {
        return "label-" + slot.index();
    }

    private String boxRegion(ExerciseSlot slot) {
        return "box-" + slot.index();
    }

    private String singleLine(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").strip();
    }
}
