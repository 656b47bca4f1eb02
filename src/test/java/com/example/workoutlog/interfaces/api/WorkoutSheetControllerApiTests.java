package com.example.workoutlog.interfaces.api;

import com.example.workoutlog.application.exception.CsvExportValidationException;
import com.example.workoutlog.application.exception.SheetGenerationValidationException;
import com.example.workoutlog.application.service.AnnotationParsingService;
import com.example.workoutlog.application.service.CsvExportService;
import com.example.workoutlog.application.service.ExerciseRecordSerializer;
import com.example.workoutlog.application.service.SheetGenerationService;
import com.example.workoutlog.application.service.WorkoutSheetService;
import com.example.workoutlog.domain.exception.PdfFileRequiredException;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.ParseReport;
import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.SideResult;
import com.example.workoutlog.domain.model.WeightRepPair;
import com.example.workoutlog.infrastructure.exception.PdfProcessingException;
import com.example.workoutlog.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = WorkoutSheetController.class)
@Import({GlobalExceptionHandler.class, ExerciseRecordSerializer.class})
class WorkoutSheetControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnnotationParsingService parsingService;

    @MockBean
    private WorkoutSheetService workoutSheetService;

    @MockBean
    private SheetGenerationService sheetGenerationService;

    @MockBean
    private CsvExportService csvExportService;

    /**
     * Verifies the snake_case record shape, including nulls for absent sequences.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void parseReturnsSerializedRecordsAndWarnings() throws Exception {
        ExerciseRecord bench = ExerciseRecord.unilateral("Bench Press",
                SideResult.of(List.of(new WeightRepPair(90, 10), new WeightRepPair(90, 8)), null), null);
        ParseWarning warning = ParseWarning.digitsTooLong("1000# x 5", "1000");
        BDDMockito.given(parsingService.parse(anyList()))
                .willReturn(new ParseReport(List.of(bench), List.of(warning)));

        mockMvc.perform(post("/api/annotations/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"boxes\":[{\"exercise_name\":\"Bench Press\",\"text\":\"90# x 10, 8\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exercises[0].exercise_name").value("Bench Press"))
                .andExpect(jsonPath("$.exercises[0].laterality").value("unilateral"))
                .andExpect(jsonPath("$.exercises[0].sets").value(2))
                .andExpect(jsonPath("$.exercises[0].weight_left").value("90,90"))
                .andExpect(jsonPath("$.exercises[0].reps_left").value("10,8"))
                .andExpect(jsonPath("$.exercises[0].reps_right").value(nullValue()))
                .andExpect(jsonPath("$.exercises[0].extra_text").doesNotExist())
                .andExpect(jsonPath("$.warnings[0].reason").value("digits_too_long"))
                .andExpect(jsonPath("$.warnings[0].box_text").value("1000# x 5"));
    }

    /**
     * Verifies that a box without an exercise name is rejected as a domain error.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingExerciseNameMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/annotations/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"boxes\":[{\"exercise_name\":\" \",\"text\":\"10, 8\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/annotations/parse"));
    }

    @Test
    void malformedJsonMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/annotations/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"boxes\":["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sheet.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(workoutSheetService.extract(BDDMockito.any(MultipartFile.class), BDDMockito.any()))
                .willThrow(new PdfFileRequiredException());

        mockMvc.perform(multipart("/api/sheets/extract").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sheet.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(workoutSheetService.extract(BDDMockito.any(MultipartFile.class), BDDMockito.any()))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/sheets/extract").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void generatedSheetIsServedAsPdfAttachment() throws Exception {
        BDDMockito.given(sheetGenerationService.generate("Legs", List.of("Squat - 5x5")))
                .willReturn(new byte[]{'%', 'P', 'D', 'F'});

        mockMvc.perform(post("/api/sheets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Legs\",\"exercises\":[\"Squat - 5x5\"]}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"workout-sheet.pdf\""))
                .andExpect(content().bytes(new byte[]{'%', 'P', 'D', 'F'}));
    }

    @Test
    void sheetValidationMappedToBadRequest() throws Exception {
        BDDMockito.given(sheetGenerationService.generate(BDDMockito.any(), BDDMockito.any()))
                .willThrow(new SheetGenerationValidationException("Please list at least one exercise for the sheet."));

        mockMvc.perform(post("/api/sheets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Legs\",\"exercises\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * Verifies that CSV export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void csvExportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(csvExportService.export(BDDMockito.any(), BDDMockito.any()))
                .willThrow(new CsvExportValidationException("No parsed exercises available for export."));

        mockMvc.perform(post("/api/sheets/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workout_date\":\"2024-05-01\",\"exercises\":[]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CSV_EXPORT_VALIDATION_ERROR"));
    }

    @Test
    void unknownLateralityOnExportMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/sheets/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workout_date\":\"2024-05-01\",\"exercises\":[{\"exercise_name\":\"Squat\","
                                + "\"laterality\":\"sideways\",\"sets\":1,\"reps_left\":\"5\",\"weight_left\":\"100\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }
}
