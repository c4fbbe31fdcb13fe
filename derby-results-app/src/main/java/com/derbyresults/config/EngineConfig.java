package com.derbyresults.config;

import com.derbyresults.model.StandardClassSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public StandardClassSet standardClassSet(DerbyResultsConfig config) {
        StandardClassSet classes = config.toStandardClassSet();
        // Fails startup on a bad scoring block rather than on the first request
        config.toDefaultPolicy();
        log.info("Standard classes {} (finals: {})", classes.names(), classes.finalsClass());
        return classes;
    }
}
