package com.chanakya.littleyears.exception;

public class SeedingDisabledException extends RuntimeException {
    public SeedingDisabledException() {
        super("Demo seeding is disabled");
    }
}
