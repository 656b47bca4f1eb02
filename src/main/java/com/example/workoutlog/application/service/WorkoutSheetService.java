package com.example.workoutlog.application.service;

import com.example.workoutlog.application.parser.NameResolver;
import com.example.workoutlog.domain.exception.PdfFileRequiredException;
import com.example.workoutlog.domain.exception.UnsupportedPdfFormatException;
import com.example.workoutlog.domain.model.ParseReport;
import com.example.workoutlog.domain.model.PrintedSheet;
import com.example.workoutlog.domain.model.SheetExtractionResult;
import com.example.workoutlog.domain.model.SheetTitle;
import com.example.workoutlog.infrastructure.exception.PdfProcessingException;
import com.example.workoutlog.infrastructure.pdf.WorkoutSheetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that reads a filled workout sheet.
 * It validates the upload, delegates PDFBox work to the infrastructure reader, resolves exercise
 * names from the printed lines and parses each box.
 */
@Service
public class WorkoutSheetService {

    private static final Logger log = LoggerFactory.getLogger(WorkoutSheetService.class);
    private static final String LABEL_DELIMITER = " - ";

    private final WorkoutSheetReader sheetReader;
    private final NameResolver nameResolver;
    private final AnnotationParsingService parsingService;

    public WorkoutSheetService(WorkoutSheetReader sheetReader,
                               NameResolver nameResolver,
                               AnnotationParsingService parsingService) {
        this.sheetReader = sheetReader;
        this.nameResolver = nameResolver;
        this.parsingService = parsingService;
    }

    /**
     * Extracts the records of a filled sheet.
     *
     * @param file     uploaded sheet PDF
     * @param boxTexts recognized box texts from an external OCR step, in sheet order; when
     *                 {@code null} or empty the text found inside the PDF boxes is used
     * @return extraction result with records and warnings
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when the bytes cannot be read
     */
    public SheetExtractionResult extract(MultipartFile file, List<String> boxTexts) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded workout sheet.", e);
        }

        PrintedSheet sheet = sheetReader.read(bytes);
        List<String> names = resolveNames(sheet.labelLines());
        boolean externalText = boxTexts != null && !boxTexts.isEmpty();
        log.info("Reading sheet '{}' with {} exercise(s) using {} box text",
                sheet.titleLine(), names.size(), externalText ? "supplied" : "embedded");
        ParseReport report = parsingService.parse(names, externalText ? boxTexts : sheet.boxTexts());

        return new SheetExtractionResult(resolveFileName(file), sheet.pageCount(),
                SheetTitle.parse(sheet.titleLine()), report);
    }

    /**
     * Resolves the exercise name of every printed label. Labels are printed by this service, so a
     * label the resolver cuts down to nothing (e.g. {@code "1-Arm Row - 3x10"} or
     * {@code "90/90 Hip Switch"}) falls back to the text before its first {@code " - "}, or to the
     * whole label.
     *
     * @param labels printed label lines in sheet order
     * @return non-blank exercise names in the same order
     */
    List<String> resolveNames(List<String> labels) {
        List<String> resolved = nameResolver.resolveAll(labels);
        List<String> names = new ArrayList<>(resolved.size());
        for (int i = 0; i < resolved.size(); i++) {
            String name = resolved.get(i);
            if (name.isBlank()) {
                name = fallbackName(labels.get(i));
                log.warn("Label '{}' starts with a number; using '{}' as the exercise name", labels.get(i), name);
            }
            names.add(name);
        }
        return names;
    }

    private String fallbackName(String label) {
        String text = label.strip();
        int delimiter = text.indexOf(LABEL_DELIMITER);
        if (delimiter > 0) {
            return text.substring(0, delimiter).strip();
        }
        return text;
    }

    /**
     * Light-weight content-type/extension check to reject non-PDF uploads early.
     *
     * @param file uploaded file
     * @return {@code true} when the file looks like a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        String name = file.getOriginalFilename();
        return "application/pdf".equalsIgnoreCase(contentType)
                || (name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf"));
    }

    private String resolveFileName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "sheet.pdf" : name;
    }
}
