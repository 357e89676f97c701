package com.eainde.atc.exception;

public class ShiftNotFoundException extends RuntimeException {
    public ShiftNotFoundException(String shiftId) {
        super("Shift not found: " + shiftId);
    }
}
