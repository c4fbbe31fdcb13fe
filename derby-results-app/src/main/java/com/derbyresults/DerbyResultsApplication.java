package com.derbyresults;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// Race databases are opened per request from caller-supplied files, there is no application DataSource
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class DerbyResultsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DerbyResultsApplication.class, args);
    }
}
