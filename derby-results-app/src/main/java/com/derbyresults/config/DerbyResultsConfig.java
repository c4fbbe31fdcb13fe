package com.derbyresults.config;

import com.derbyresults.model.RankingPolicy;
import com.derbyresults.model.ScoringMethod;
import com.derbyresults.model.StandardClassSet;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standard classes, mapping keywords and default scoring policy.
 * Defined in application.yml under 'derby'.
 */
@Configuration
@ConfigurationProperties(prefix = "derby")
public class DerbyResultsConfig {

    private List<String> standardClasses = new ArrayList<>(List.of(
        "Lion", "Tiger", "Wolf", "Bear", "Webelos", "Arrow of Light", "Grand Finals"
    ));
    private String finalsClass = "Grand Finals";
    private Map<String, List<String>> keywords = new LinkedHashMap<>();
    private List<String> skipKeywords = new ArrayList<>(List.of("sibling"));
    private Scoring scoring = new Scoring();

    public StandardClassSet toStandardClassSet() {
        return new StandardClassSet(standardClasses, finalsClass);
    }

    public RankingPolicy toDefaultPolicy() {
        return scoring.toPolicy();
    }

    // Getters and setters for Spring Boot binding
    public List<String> getStandardClasses() { return standardClasses; }
    public void setStandardClasses(List<String> standardClasses) { this.standardClasses = standardClasses; }

    public String getFinalsClass() { return finalsClass; }
    public void setFinalsClass(String finalsClass) { this.finalsClass = finalsClass; }

    public Map<String, List<String>> getKeywords() { return keywords; }
    public void setKeywords(Map<String, List<String>> keywords) { this.keywords = keywords; }

    public List<String> getSkipKeywords() { return skipKeywords; }
    public void setSkipKeywords(List<String> skipKeywords) { this.skipKeywords = skipKeywords; }

    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class Scoring {
        private ScoringMethod method = ScoringMethod.DROP_SLOWEST;
        private int finalsFieldSize = RankingPolicy.DEFAULT_FINALS_FIELD_SIZE;
        private boolean excludeFinalsWinners = true;
        private int finalsWinnerCount = RankingPolicy.DEFAULT_FINALS_WINNER_COUNT;

        public RankingPolicy toPolicy() {
            return new RankingPolicy(method, finalsFieldSize, excludeFinalsWinners, finalsWinnerCount);
        }

        public ScoringMethod getMethod() { return method; }
        public void setMethod(ScoringMethod method) { this.method = method; }

        public int getFinalsFieldSize() { return finalsFieldSize; }
        public void setFinalsFieldSize(int finalsFieldSize) { this.finalsFieldSize = finalsFieldSize; }

        public boolean isExcludeFinalsWinners() { return excludeFinalsWinners; }
        public void setExcludeFinalsWinners(boolean excludeFinalsWinners) { this.excludeFinalsWinners = excludeFinalsWinners; }

        public int getFinalsWinnerCount() { return finalsWinnerCount; }
        public void setFinalsWinnerCount(int finalsWinnerCount) { this.finalsWinnerCount = finalsWinnerCount; }
    }
}
