package com.eainde.atc.exception;

public class ReportNotFoundException extends RuntimeException {
    public ReportNotFoundException(String shiftId) {
        super("Report not found for shift: " + shiftId);
    }
}
