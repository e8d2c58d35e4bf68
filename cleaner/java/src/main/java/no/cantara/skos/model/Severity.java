package no.cantara.skos.model;

/**
 * How serious a finding is. Only violations make a vocabulary invalid.
 */
public enum Severity {
    VIOLATION,
    WARNING,
    /** Advisory only; never counts toward failure. */
    INFO
}
