package com.derbyresults.model;

public enum Severity {
    ERROR,      // blocks the correctness guarantee
    WARNING,
    INFO
}
