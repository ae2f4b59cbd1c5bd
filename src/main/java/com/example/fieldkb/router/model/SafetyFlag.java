package com.example.fieldkb.router.model;

/** Hazard/urgency classification supplied by the upstream request classifier. */
public enum SafetyFlag {
  NONE,
  SAFETY,
  URGENT;

  public boolean isRaised() {
    return this != NONE;
  }
}
