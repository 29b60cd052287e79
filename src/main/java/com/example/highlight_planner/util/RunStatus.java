package com.example.highlight_planner.util;

public enum RunStatus {
    COMPLETED,
    NO_CANDIDATES,
    CANCELLED
}
