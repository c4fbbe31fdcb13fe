package com.derbyresults.repository;

import com.derbyresults.model.RawRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Reads one GrandPrix Race Manager database through a handle owned by the caller.
 * Unfinished heats are included; filtering for statistics happens downstream.
 */
public class RaceDatabaseReader {

    private final JdbcTemplate jdbc;
    private final String sourceName;

    public RaceDatabaseReader(JdbcTemplate jdbc, String sourceName) {
        this.jdbc = jdbc;
        this.sourceName = sourceName;
    }

    /**
     * Every heat row of every non-excluded registrant, tagged with {@code year}.
     */
    public List<RawRecord> readRawRecords(Integer year) {
        String sql = """
            SELECT r.FirstName, r.LastName, r.CarNumber, r.CarName,
                   c.Class, rc.RoundID, rc.Heat, rc.Lane,
                   rc.Completed, rc.FinishTime, rc.FinishPlace
            FROM RegistrationInfo r
            JOIN RaceChart rc ON r.RacerID = rc.RacerID
            JOIN Classes c ON rc.ClassID = c.ClassID
            WHERE r.Exclude = 0
            ORDER BY c.ClassID, rc.Heat, rc.Lane
            """;
        try {
            return jdbc.query(sql, (rs, rowNum) -> new RawRecord(
                year,
                rs.getString("FirstName"),
                rs.getString("LastName"),
                rs.getString("CarNumber"),
                rs.getString("CarName"),
                rs.getString("Class"),
                getInteger(rs, "RoundID"),
                getInteger(rs, "Heat"),
                getInteger(rs, "Lane"),
                readCompleted(rs.getObject("Completed")),
                rs.getObject("FinishTime") != null ? rs.getDouble("FinishTime") : null,
                getInteger(rs, "FinishPlace")
            ));
        } catch (DataAccessException e) {
            throw new RaceDatabaseException("Cannot read race results from " + sourceName, e);
        }
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column) != null ? rs.getInt(column) : null;
    }

    // Completed is a timestamp in some schema versions and a flag in others
    static Boolean readCompleted(Object value) {
        if (value == null) return false;
        if (value instanceof Number n) return n.intValue() != 0;
        String s = value.toString().trim();
        return !s.isEmpty() && !s.equals("0") && !s.equalsIgnoreCase("false");
    }
}
