package com.example.workoutlog.application.service;

import com.example.workoutlog.application.exception.UseCaseValidationException;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.Laterality;
import com.example.workoutlog.domain.model.SerializedExercise;
import com.example.workoutlog.infrastructure.exception.RecordSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps exercise records to and from the portable form shared with the storage importer.
 */
@Component
public class ExerciseRecordSerializer {

    private static final String SEQUENCE_SEPARATOR = ",";
    private static final TypeReference<List<SerializedExercise>> EXERCISE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper Jackson mapper configured by Spring Boot
     */
    public ExerciseRecordSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Converts records in order, keeping the sheet's top-to-bottom sequence.
     *
     * @param records parsed records
     * @return portable records
     */
    public List<SerializedExercise> serialize(List<ExerciseRecord> records) {
        return records.stream().map(this::toSerialized).toList();
    }

    /**
     * Renders one record. Sequences become comma-joined digit strings; empty sequences and the right
     * side of unilateral records become {@code null}.
     *
     * @param record parsed record
     * @return portable record
     */
    public SerializedExercise toSerialized(ExerciseRecord record) {
        return new SerializedExercise(
                record.exerciseName(),
                record.laterality().wireName(),
                join(record.repsLeft()),
                join(record.repsRight()),
                record.sets(),
                join(record.weightLeft()),
                join(record.weightRight()),
                record.extraText()
        );
    }

    /**
     * Reverses {@link #toSerialized(ExerciseRecord)}.
     *
     * @param serialized portable record
     * @return domain record
     * @throws UseCaseValidationException when the laterality or a sequence cannot be read
     */
    public ExerciseRecord toRecord(SerializedExercise serialized) {
        try {
            Laterality laterality = Laterality.fromWireName(serialized.laterality());
            boolean bilateral = laterality == Laterality.BILATERAL;
            return new ExerciseRecord(
                    serialized.exerciseName(),
                    laterality,
                    serialized.sets(),
                    split(serialized.weightLeft()),
                    bilateral ? split(serialized.weightRight()) : null,
                    split(serialized.repsLeft()),
                    bilateral ? split(serialized.repsRight()) : null,
                    serialized.extraText()
            );
        } catch (IllegalArgumentException ex) {
            throw new UseCaseValidationException(
                    "Invalid exercise record '" + serialized.exerciseName() + "': " + ex.getMessage());
        }
    }

    /**
     * @param records parsed records
     * @return pretty-printed JSON array
     * @throws RecordSerializationException when Jackson cannot write the records
     */
    public String toJson(List<ExerciseRecord> records) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(serialize(records));
        } catch (JsonProcessingException ex) {
            throw new RecordSerializationException("Unable to write exercise records as JSON.", ex);
        }
    }

    /**
     * @param json JSON array previously written by {@link #toJson(List)}
     * @return domain records in file order
     * @throws RecordSerializationException when the JSON cannot be read
     */
    public List<ExerciseRecord> fromJson(String json) {
        try {
            return objectMapper.readValue(json, EXERCISE_LIST).stream().map(this::toRecord).toList();
        } catch (JsonProcessingException ex) {
            throw new RecordSerializationException("Unable to read exercise records from JSON.", ex);
        }
    }

    static String join(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.stream().map(String::valueOf).collect(Collectors.joining(SEQUENCE_SEPARATOR));
    }

    static List<Integer> split(String values) {
        if (values == null || values.isBlank()) {
            return List.of();
        }
        return Arrays.stream(values.split(SEQUENCE_SEPARATOR))
                .map(String::strip)
                .map(Integer::valueOf)
                .toList();
    }
}
