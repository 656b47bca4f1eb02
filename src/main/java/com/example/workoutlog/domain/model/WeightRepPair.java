package com.example.workoutlog.domain.model;

/**
 * One performed set: the load and the number of repetitions done with it.
 */
public record WeightRepPair(int weight, int reps) {

    public WeightRepPair {
        if (weight < 0 || reps < 0) {
            throw new IllegalArgumentException("Weight and reps must be non-negative: " + weight + "/" + reps);
        }
    }
}
