package com.example.highlight_planner.engine;

public class SemanticAssessmentException extends RuntimeException {
    public SemanticAssessmentException(String message) {
        super(message);
    }

    public SemanticAssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
