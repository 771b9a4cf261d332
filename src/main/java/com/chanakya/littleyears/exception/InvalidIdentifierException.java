package com.chanakya.littleyears.exception;

public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String identifier) {
        super("Invalid id: " + identifier);
    }
}
