package com.example.fieldkb.router.model;

public enum CoverageLevel {
  NONE,
  THIN,
  MODERATE,
  STRONG
}
