package com.derbyresults.model;

/**
 * A heat attempt after class mapping. One row per raw heat row that survived the mapping.
 */
public record CanonicalRecord(
    Integer year,
    String firstName,
    String lastName,
    String carNumber,
    String carName,
    String standardClassName,
    String originalClassLabel,
    Integer roundId,
    Integer heat,
    Integer lane,
    Boolean completed,
    Double finishTime,
    Integer finishPlace,
    RacerKey racerKey
) {
    public static CanonicalRecord from(RawRecord raw, String standardClassName, Integer year) {
        return new CanonicalRecord(
            year != null ? year : raw.year(),
            raw.firstName(),
            raw.lastName(),
            raw.carNumber(),
            raw.carName(),
            standardClassName,
            raw.classLabel(),
            raw.roundId(),
            raw.heat(),
            raw.lane(),
            raw.completed(),
            raw.finishTime(),
            raw.finishPlace(),
            raw.racerKey()
        );
    }

    public boolean hasFinishTime() {
        return finishTime != null && finishTime > 0 && !finishTime.isNaN();
    }

    public String fullName() {
        return racerKey.displayName();
    }

    /** Racer identity qualified by season and class, e.g. {@code Ann|Lee|12|2024|Wolf}. */
    public String racerClassId() {
        return racerKey + "|" + (year != null ? year : "") + "|" + standardClassName;
    }
}
