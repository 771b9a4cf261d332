package com.chanakya.littleyears.exception;

public class KidNotFoundException extends RuntimeException {
    public KidNotFoundException(String kidId) {
        super("Kid not found: " + kidId);
    }
}
