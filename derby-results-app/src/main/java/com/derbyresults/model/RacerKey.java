package com.derbyresults.model;

/**
 * Identity of a racer across classes and source files: first name, last name and car number.
 * Source-assigned racer ids are never used, they differ between files.
 */
public record RacerKey(String firstName, String lastName, String carNumber) {

    public static RacerKey of(String firstName, String lastName, String carNumber) {
        return new RacerKey(
            firstName != null ? firstName : "",
            lastName != null ? lastName : "",
            carNumber != null ? carNumber : ""
        );
    }

    public String displayName() {
        String full = (firstName + " " + lastName).trim();
        return full.isEmpty() ? "Unknown" : full;
    }

    @Override
    public String toString() {
        return firstName + "|" + lastName + "|" + carNumber;
    }
}
