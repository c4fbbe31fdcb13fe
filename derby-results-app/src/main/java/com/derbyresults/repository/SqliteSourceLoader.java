package com.derbyresults.repository;

import com.derbyresults.model.SourceBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens race database files read-only, one data source per file and per call.
 */
@Repository
public class SqliteSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(SqliteSourceLoader.class);

    public SourceBundle load(Path file, Integer year, String sourceName) {
        if (!Files.isRegularFile(file)) {
            throw new RaceDatabaseException("Race database not found: " + file, null);
        }
        RaceDatabaseReader reader = new RaceDatabaseReader(new JdbcTemplate(openReadOnly(file)), sourceName);
        SourceBundle bundle = new SourceBundle(sourceName, year, reader.readRawRecords(year));
        log.info("Loaded {} heat row(s) and {} class label(s) from {}",
                 bundle.rawRecords().size(), bundle.classLabels().size(), sourceName);
        return bundle;
    }

    private static SQLiteDataSource openReadOnly(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
        return ds;
    }
}
