package com.mdn.converter.models;

/**
 * A decoded workbook together with the validator's advisory report.
 */
public class DecodeResult {
    private final Workbook workbook;
    private final ValidationReport report;

    public DecodeResult(Workbook workbook, ValidationReport report) {
        this.workbook = workbook;
        this.report = report;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public ValidationReport getReport() {
        return report;
    }
}
