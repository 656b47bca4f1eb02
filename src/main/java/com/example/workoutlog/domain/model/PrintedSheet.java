package com.example.workoutlog.domain.model;

import java.util.List;

/**
 * Text read from a filled sheet PDF, before any handwriting is interpreted.
 *
 * @param titleLine  first printed line of the sheet, or {@code null} for a blank page
 * @param labelLines printed exercise lines in sheet order
 * @param boxTexts   text found inside each exercise box, index-aligned with {@code labelLines}
 * @param pageCount  number of pages in the document
 */
public record PrintedSheet(String titleLine, List<String> labelLines, List<String> boxTexts, int pageCount) {

    public PrintedSheet {
        labelLines = labelLines == null ? List.of() : List.copyOf(labelLines);
        boxTexts = boxTexts == null ? List.of() : List.copyOf(boxTexts);
    }
}
