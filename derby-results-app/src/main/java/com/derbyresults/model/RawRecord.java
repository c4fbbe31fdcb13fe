package com.derbyresults.model;

/**
 * One heat attempt as exported by a race database, before class mapping.
 * A null or non-positive {@code finishTime} means the racer did not finish the heat.
 */
public record RawRecord(
    Integer year,
    String firstName,
    String lastName,
    String carNumber,
    String carName,
    String classLabel,
    Integer roundId,
    Integer heat,
    Integer lane,
    Boolean completed,
    Double finishTime,
    Integer finishPlace
) {
    public boolean hasFinishTime() {
        return finishTime != null && finishTime > 0 && !finishTime.isNaN();
    }

    /** Class label with null read as the empty label, which must be mapped like any other. */
    public String classLabelOrEmpty() {
        return classLabel != null ? classLabel : "";
    }

    public RacerKey racerKey() {
        return RacerKey.of(firstName, lastName, carNumber);
    }
}
