package com.derbyresults.model;

/**
 * A racer's row in a class ranking.
 *
 * @param position        zero-based index in the sorted class list
 * @param place           trophy place (1, 2, 3, ...) or null when the row gets no place label
 * @param finalist        top racer of a den class
 * @param wildcard        fastest non-finalist filling the finals field
 * @param finalsWinner    excluded from den places because of a top finals result
 */
public record RankedEntry(
    RacerClassStats stats,
    double score,
    int position,
    Integer place,
    boolean finalist,
    boolean wildcard,
    boolean finalsWinner
) {
    public RacerKey racerKey() {
        return stats.racerKey();
    }
}
