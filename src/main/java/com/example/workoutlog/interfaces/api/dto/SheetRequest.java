package com.example.workoutlog.interfaces.api.dto;

import java.util.List;

/**
 * Title and exercise lines of a blank sheet to print.
 */
public record SheetRequest(String title, List<String> exercises) {
}
