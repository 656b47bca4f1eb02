package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.BoxParseResult;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.RawBox;
import com.example.workoutlog.domain.model.SideResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns the text of one exercise box into an {@link ExerciseRecord}.
 * <p>
 * A box holding the left marker followed later by the right marker is bilateral and each section is
 * parsed on its own; anything else is parsed as a single unilateral side. Malformed handwriting never
 * throws: the worst case is an empty record whose extra text holds the whole box.
 * <p>
 * Notes written before the left marker of a bilateral box, such as {@code warmup} in
 * {@code "warmup L - 20# x 10 R - 20# x 10"}, are kept at the front of the extra text rather than
 * discarded, so a reviewer still sees them next to the side residues.
 */
@Component
public class RecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(RecordAssembler.class);

    private final AnnotationParserProperties properties;
    private final SideParser sideParser;

    public RecordAssembler(AnnotationParserProperties properties, SideParser sideParser) {
        this.properties = properties;
        this.sideParser = sideParser;
    }

    /**
     * @param box printed exercise name and recognized box text
     * @return record plus warnings raised while reading the box
     */
    public BoxParseResult assemble(RawBox box) {
        String boxText = box.text();
        String text = normalize(boxText);
        List<ParseWarning> warnings = new ArrayList<>();

        String leftMarker = properties.getLeftMarker();
        String rightMarker = properties.getRightMarker();
        int leftStart = text.indexOf(leftMarker);
        int rightStart = leftStart < 0 ? -1 : text.indexOf(rightMarker, leftStart + leftMarker.length());

        ExerciseRecord record;
        if (rightStart >= 0) {
            String preamble = text.substring(0, leftStart).strip();
            SideResult left = sideParser.parse(text.substring(leftStart + leftMarker.length(), rightStart), boxText, warnings);
            SideResult right = sideParser.parse(text.substring(rightStart + rightMarker.length()), boxText, warnings);
            if (left.setCount() != right.setCount()) {
                warnings.add(ParseWarning.sideCountMismatch(boxText, left.setCount(), right.setCount()));
            }
            record = ExerciseRecord.bilateral(box.exerciseName(), left, right,
                    joinResidue(preamble, left.residue(), right.residue()));
        } else {
            SideResult side = sideParser.parse(text, boxText, warnings);
            record = ExerciseRecord.unilateral(box.exerciseName(), side, side.residue());
        }

        log.debug("Parsed '{}' as {} with {} set(s) from box text '{}'",
                record.exerciseName(), record.laterality().wireName(), record.sets(), boxText);
        return new BoxParseResult(record, warnings);
    }

    /**
     * Maps the alternate separator glyph to {@code x} and collapses line breaks and repeated spaces.
     *
     * @param text raw box text
     * @return normalized single-line text
     */
    String normalize(String text) {
        return text.replace('×', 'x').replaceAll("\\s+", " ").strip();
    }

    private String joinResidue(String... parts) {
        String joined = Stream.of(parts)
                .filter(Objects::nonNull)
                .filter(part -> !part.isBlank())
                .collect(Collectors.joining(" "));
        return joined.isEmpty() ? null : joined;
    }
}
