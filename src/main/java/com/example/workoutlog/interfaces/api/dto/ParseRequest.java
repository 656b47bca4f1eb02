package com.example.workoutlog.interfaces.api.dto;

import java.util.List;

/**
 * Boxes of one sheet in top-to-bottom order.
 */
public record ParseRequest(List<BoxRequest> boxes) {
}
