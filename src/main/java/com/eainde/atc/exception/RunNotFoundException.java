package com.eainde.atc.exception;

public class RunNotFoundException extends RuntimeException {
    public RunNotFoundException(String shiftId) {
        super("No analysis in progress for shift: " + shiftId);
    }
}
