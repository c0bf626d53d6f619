package com.dynop.fairway.validation;

/**
 * Outcome of a validation check. Findings never fail the run.
 */
public enum ValidationStatus {
    PASS,
    WARNING
}
