package com.example.workoutlog.application.service;

import com.example.workoutlog.application.parser.RecordAssembler;
import com.example.workoutlog.domain.model.BoxParseResult;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.ParseReport;
import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.RawBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that parses every box of a sheet and gathers the warnings for review.
 * Boxes are independent; the only ordering kept is the sheet's top-to-bottom sequence.
 */
@Service
public class AnnotationParsingService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationParsingService.class);

    private final RecordAssembler recordAssembler;

    public AnnotationParsingService(RecordAssembler recordAssembler) {
        this.recordAssembler = recordAssembler;
    }

    /**
     * Parses boxes in sheet order.
     *
     * @param boxes boxes in top-to-bottom order
     * @return records in the same order plus all warnings
     */
    public ParseReport parse(List<RawBox> boxes) {
        List<ExerciseRecord> records = new ArrayList<>(boxes.size());
        List<ParseWarning> warnings = new ArrayList<>();
        for (RawBox box : boxes) {
            BoxParseResult result = recordAssembler.assemble(box);
            records.add(result.record());
            for (ParseWarning warning : result.warnings()) {
                log.warn("{} for '{}': token '{}' in box '{}'",
                        warning.reason().wireName(), box.exerciseName(), warning.token(), warning.boxText());
                warnings.add(warning);
            }
        }
        log.info("Parsed {} exercise box(es) with {} warning(s)", records.size(), warnings.size());
        return new ParseReport(records, warnings);
    }

    /**
     * Pairs printed names with box texts positionally and parses them.
     * A name without text yields an empty record; texts beyond the last name are dropped.
     *
     * @param exerciseNames printed names in sheet order
     * @param boxTexts      recognized box texts in sheet order
     * @return parse report
     */
    public ParseReport parse(List<String> exerciseNames, List<String> boxTexts) {
        if (boxTexts.size() > exerciseNames.size()) {
            log.warn("Ignoring {} box text(s) without a printed exercise name",
                    boxTexts.size() - exerciseNames.size());
        }
        List<RawBox> boxes = new ArrayList<>(exerciseNames.size());
        for (int i = 0; i < exerciseNames.size(); i++) {
            String text = i < boxTexts.size() ? boxTexts.get(i) : "";
            boxes.add(new RawBox(exerciseNames.get(i), text));
        }
        return parse(boxes);
    }
}
