package com.example.fieldkb.router.model;

public record Citation(String itemId, String sourceRef, double relevance) {
}
