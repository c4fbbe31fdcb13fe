package com.derbyresults.repository;

import com.derbyresults.model.RawRecord;
import com.derbyresults.model.SourceBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteSourceLoaderTest {

    @TempDir
    Path tempDir;

    private Path database;
    private final SqliteSourceLoader loader = new SqliteSourceLoader();

    @BeforeEach
    void createDatabase() {
        database = tempDir.resolve("pack-2024.sqlite");
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl("jdbc:sqlite:" + database.toAbsolutePath());
        JdbcTemplate jdbc = new JdbcTemplate(ds);

        jdbc.execute("CREATE TABLE Classes (ClassID INTEGER PRIMARY KEY, Class TEXT)");
        jdbc.execute("""
            CREATE TABLE RegistrationInfo (
                RacerID INTEGER PRIMARY KEY, CarNumber INTEGER, CarName TEXT,
                LastName TEXT, FirstName TEXT, ClassID INTEGER, Exclude INTEGER DEFAULT 0)
            """);
        jdbc.execute("""
            CREATE TABLE RaceChart (
                ResultID INTEGER PRIMARY KEY, ClassID INTEGER, RoundID INTEGER, Heat INTEGER,
                Lane INTEGER, RacerID INTEGER, FinishTime REAL, FinishPlace INTEGER, Completed TEXT)
            """);

        jdbc.update("INSERT INTO Classes VALUES (1, 'Wolves'), (2, 'Bears')");
        jdbc.update("INSERT INTO RegistrationInfo VALUES (1, 101, 'Zoom', 'Lee', 'Ann', 1, 0)");
        jdbc.update("INSERT INTO RegistrationInfo VALUES (2, 202, 'Bolt', 'Ray', 'Bo', 2, 0)");
        jdbc.update("INSERT INTO RegistrationInfo VALUES (3, 303, 'Gone', 'Out', 'Cy', 2, 1)");
        jdbc.update("INSERT INTO RaceChart VALUES (1, 2, 1, 1, 1, 2, 3.25, 1, '2024-01-20 10:00')");
        jdbc.update("INSERT INTO RaceChart VALUES (2, 1, 1, 1, 2, 1, 3.10, 1, '2024-01-20 09:00')");
        jdbc.update("INSERT INTO RaceChart VALUES (3, 1, 1, 2, 1, 1, NULL, NULL, NULL)");
        jdbc.update("INSERT INTO RaceChart VALUES (4, 2, 1, 2, 1, 3, 2.90, 1, '2024-01-20 10:05')");
    }

    @Test
    void loadsHeatRowsTaggedWithYear() {
        SourceBundle bundle = loader.load(database, 2024, "pack-2024.sqlite");

        assertThat(bundle.sourceName()).isEqualTo("pack-2024.sqlite");
        assertThat(bundle.year()).isEqualTo(2024);
        assertThat(bundle.rawRecords()).extracting(RawRecord::firstName).containsExactly("Ann", "Ann", "Bo");

        RawRecord first = bundle.rawRecords().get(0);
        assertThat(first.year()).isEqualTo(2024);
        assertThat(first.carNumber()).isEqualTo("101");
        assertThat(first.classLabel()).isEqualTo("Wolves");
        assertThat(first.completed()).isTrue();
        assertThat(first.finishTime()).isEqualTo(3.10);
    }

    @Test
    void keepsUnfinishedHeats() {
        RawRecord unfinished = loader.load(database, 2024, "pack-2024.sqlite").rawRecords().get(1);

        assertThat(unfinished.heat()).isEqualTo(2);
        assertThat(unfinished.completed()).isFalse();
        assertThat(unfinished.finishTime()).isNull();
        assertThat(unfinished.hasFinishTime()).isFalse();
    }

    @Test
    void excludedRegistrantsAreLeftOut() {
        SourceBundle bundle = loader.load(database, 2024, "pack-2024.sqlite");

        assertThat(bundle.rawRecords()).extracting(RawRecord::firstName).doesNotContain("Cy");
        assertThat(bundle.classLabels()).containsExactly("Wolves", "Bears");
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.sqlite"), 2024, "nope.sqlite"))
            .isInstanceOf(RaceDatabaseException.class)
            .hasMessageContaining("nope.sqlite");
    }

    @Test
    void fileWithoutRaceTablesFails() {
        Path empty = tempDir.resolve("empty.sqlite");
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl("jdbc:sqlite:" + empty.toAbsolutePath());
        new JdbcTemplate(ds).execute("CREATE TABLE Other (id INTEGER)");

        assertThatThrownBy(() -> loader.load(empty, 2024, "empty.sqlite"))
            .isInstanceOf(RaceDatabaseException.class)
            .hasMessageContaining("empty.sqlite");
    }

    @Test
    void completedAcceptsFlagsAndTimestamps() {
        assertThat(RaceDatabaseReader.readCompleted(null)).isFalse();
        assertThat(RaceDatabaseReader.readCompleted(0)).isFalse();
        assertThat(RaceDatabaseReader.readCompleted(1)).isTrue();
        assertThat(RaceDatabaseReader.readCompleted("")).isFalse();
        assertThat(RaceDatabaseReader.readCompleted("false")).isFalse();
        assertThat(RaceDatabaseReader.readCompleted("2024-01-20 09:00")).isTrue();
    }
}
