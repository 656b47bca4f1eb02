package com.example.workoutlog.domain.exception;

/**
 * Raised when a box reaches the parser without the printed exercise name it belongs to.
 * This is the one input the parser refuses to guess: handwriting noise never throws, a missing name does.
 */
public class ExerciseNameRequiredException extends DomainException {

	/**
	 * Creates the exception and records the orphaned box text for diagnosis.
	 *
	 * @param boxText text of the box without a name (may be {@code null})
	 */
    public ExerciseNameRequiredException(String boxText) {
        super("Exercise name is required for every box" + (boxText != null && !boxText.isBlank() ? ": " + boxText : "."));
    }
}
