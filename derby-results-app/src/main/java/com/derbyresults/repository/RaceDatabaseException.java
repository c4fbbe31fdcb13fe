package com.derbyresults.repository;

public class RaceDatabaseException extends RuntimeException {

    public RaceDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
