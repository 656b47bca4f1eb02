package com.example.workoutlog.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Geometry of a printed workout sheet. The generator draws with it and the reader crops with it,
 * so both sides always agree on where a box is.
 */
public record SheetLayout(
        float pageWidth,
        float pageHeight,
        float margin,
        float topMargin,
        float titleToFirstLabel,
        float labelToBoxGap,
        float boxHeight,
        float boxToNextLabelGap,
        float bottomLimit
) {

    /** A4 portrait, in points. */
    public static final float A4_WIDTH = 595.2756f;
    public static final float A4_HEIGHT = 841.8898f;

    public static SheetLayout a4() {
        return new SheetLayout(A4_WIDTH, A4_HEIGHT, 72f, 36f, 28f, 8f, 37f, 18f, 36f);
    }

    /**
     * Same spacing on a page of a different size, e.g. a sheet printed on Letter paper.
     */
    public SheetLayout withPageSize(float width, float height) {
        return new SheetLayout(width, height, margin, topMargin, titleToFirstLabel, labelToBoxGap,
                boxHeight, boxToNextLabelGap, bottomLimit);
    }

    public float titleBaseline() {
        return pageHeight - topMargin;
    }

    /**
     * Lays out every slot that fits on one page, top to bottom.
     *
     * @return ordered slots
     */
    public List<ExerciseSlot> slots() {
        List<ExerciseSlot> slots = new ArrayList<>();
        float y = titleBaseline() - titleToFirstLabel;
        int index = 0;
        while (true) {
            float boxTop = y - labelToBoxGap;
            float boxBottom = boxTop - boxHeight;
            if (boxBottom < bottomLimit) {
                break;
            }
            slots.add(new ExerciseSlot(index++, y, boxTop, boxBottom, margin, pageWidth - margin));
            y = boxBottom - boxToNextLabelGap;
        }
        return slots;
    }

    public int capacity() {
        return slots().size();
    }
}
