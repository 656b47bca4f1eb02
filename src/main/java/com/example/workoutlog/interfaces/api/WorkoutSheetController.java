package com.example.workoutlog.interfaces.api;

import com.example.workoutlog.application.service.AnnotationParsingService;
import com.example.workoutlog.application.service.CsvExportService;
import com.example.workoutlog.application.service.ExerciseRecordSerializer;
import com.example.workoutlog.application.service.SheetGenerationService;
import com.example.workoutlog.application.service.WorkoutSheetService;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.ParseReport;
import com.example.workoutlog.domain.model.RawBox;
import com.example.workoutlog.domain.model.SheetExtractionResult;
import com.example.workoutlog.interfaces.api.dto.ExportRequest;
import com.example.workoutlog.interfaces.api.dto.ParseRequest;
import com.example.workoutlog.interfaces.api.dto.ParseResponse;
import com.example.workoutlog.interfaces.api.dto.SheetExtractionResponse;
import com.example.workoutlog.interfaces.api.dto.SheetRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer REST controller for printing blank sheets, reading filled ones and exporting the
 * parsed exercises.
 */
@RestController
@RequestMapping("/api")
public class WorkoutSheetController {

    private final AnnotationParsingService parsingService;
    private final WorkoutSheetService workoutSheetService;
    private final SheetGenerationService sheetGenerationService;
    private final CsvExportService csvExportService;
    private final ExerciseRecordSerializer serializer;

    /**
     * Creates the controller with the required application services.
     */
    public WorkoutSheetController(AnnotationParsingService parsingService,
                                  WorkoutSheetService workoutSheetService,
                                  SheetGenerationService sheetGenerationService,
                                  CsvExportService csvExportService,
                                  ExerciseRecordSerializer serializer) {
        this.parsingService = parsingService;
        this.workoutSheetService = workoutSheetService;
        this.sheetGenerationService = sheetGenerationService;
        this.csvExportService = csvExportService;
        this.serializer = serializer;
    }

    /**
     * Parses already-recognized box texts.
     *
     * @param request boxes in sheet order
     * @return serialized records and warnings
     */
    @PostMapping(value = "/annotations/parse", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ParseResponse> parseAnnotations(@RequestBody ParseRequest request) {
        List<RawBox> boxes = request.boxes() == null ? List.of() : request.boxes().stream()
                .map(box -> new RawBox(box.exerciseName(), box.text()))
                .toList();
        ParseReport report = parsingService.parse(boxes);
        return ResponseEntity.ok(new ParseResponse(serializer.serialize(report.records()), report.warnings()));
    }

    /**
     * Reads a filled sheet PDF.
     *
     * @param file     uploaded sheet
     * @param boxTexts optional OCR output, one entry per box in sheet order
     * @return serialized records, warnings and sheet details
     */
    @PostMapping(value = "/sheets/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SheetExtractionResponse> extractSheet(@RequestParam("file") MultipartFile file,
                                                                @RequestParam(value = "boxTexts", required = false) List<String> boxTexts) {
        SheetExtractionResult result = workoutSheetService.extract(file, boxTexts);
        return ResponseEntity.ok(new SheetExtractionResponse(
                result.fileName(),
                result.pageCount(),
                result.title().rawTitle(),
                result.title().workoutDate(),
                serializer.serialize(result.report().records()),
                result.report().warnings()
        ));
    }

    /**
     * Prints a blank sheet.
     *
     * @param request title and exercise lines
     * @return PDF download
     */
    @PostMapping(value = "/sheets", produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> generateSheet(@RequestBody SheetRequest request) {
        byte[] pdf = sheetGenerationService.generate(request.title(), request.exercises());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"workout-sheet.pdf\"")
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    /**
     * Streams reviewed exercises as a CSV download for the storage importer.
     *
     * @param request workout date and exercises
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/sheets/export")
    public ResponseEntity<byte[]> exportCsv(@RequestBody ExportRequest request) {
        List<ExerciseRecord> records = request.exercises() == null ? List.of() : request.exercises().stream()
                .map(serializer::toRecord)
                .toList();
        String csv = csvExportService.export(records, request.workoutDate());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"workout-export.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
