package com.calor.analysis.diagnostics;

/**
 * Codes reported by the verification passes.
 */
public final class DiagnosticCode {

    private DiagnosticCode() {}

    public static final String FORBIDDEN_EFFECT = "Calor0410";
    public static final String UNKNOWN_EXTERNAL_CALL = "Calor0411";
    public static final String AMBIGUOUS_STUB = "Calor0412";
    public static final String UNRECOGNIZED_EFFECT_CODE = "Calor0413";
    public static final String EFFECT_FIXPOINT_DIVERGED = "Calor0600";
    public static final String USE_WITHOUT_DEFINITION = "Calor0700";
    public static final String DEAD_ASSIGNMENT = "Calor0701";
    public static final String CONTRACT_DISPROVEN = "Calor0800";
    public static final String CONTRACT_UNVERIFIED = "Calor0801";
}
