package com.example.highlight_planner.dto;

public record SemanticItem(String id, String transcript) {
}
