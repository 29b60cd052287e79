package com.example.highlight_planner.dto.web;

public record KeywordInput(String token, Double weight) {
}
