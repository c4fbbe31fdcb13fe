package com.derbyresults.controller;

import com.derbyresults.model.PolicyOverrides;
import com.derbyresults.model.RaceResultsRequest;
import com.derbyresults.model.RawRecord;
import com.derbyresults.model.ScoringMethod;
import com.derbyresults.model.SourceBundle;
import com.derbyresults.service.RaceResultsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;

@SpringBootTest
@AutoConfigureMockMvc
class RaceResultsApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @SpyBean
    private RaceResultsService raceResultsService;

    private static SourceBundle source() {
        return new SourceBundle("pack.sqlite", 2024, List.of(
            new RawRecord(null, "Ann", "Lee", "12", "Zoom", "Wolves", 1, 1, 1, true, 3.10, 1),
            new RawRecord(null, "Bo", "Ray", "14", "Bolt", "Wolves", 1, 1, 2, true, 3.30, 2),
            new RawRecord(null, "Cy", "Fox", "20", "Dash", "Bear Den", 1, 2, 1, true, 3.20, 1)
        ));
    }

    private static SourceBundle siblingsSource() {
        return new SourceBundle("siblings.sqlite", 2024, List.of(
            new RawRecord(null, "Dee", "Ray", "40", "Tiny", "Siblings", 1, 1, 1, true, 3.50, 1)
        ));
    }

    private String body(Map<String, String> mapping, PolicyOverrides policy) throws Exception {
        return objectMapper.writeValueAsString(new RaceResultsRequest(List.of(source()), mapping, policy));
    }

    @Nested
    @DisplayName("reference data")
    class ReferenceData {

        @Test
        void listsConfiguredClasses() throws Exception {
            mockMvc.perform(get("/api/results/classes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.standardClasses[0]").value("Lion"))
                .andExpect(jsonPath("$.finalsClass").value("Grand Finals"))
                .andExpect(jsonPath("$.skip").value("SKIP"))
                .andExpect(jsonPath("$.defaultPolicy.scoringMethod").value("DROP_SLOWEST"))
                .andExpect(jsonPath("$.defaultPolicy.finalsFieldSize").value(12));
        }

        @Test
        void suggestsMappingsFromConfiguredKeywords() throws Exception {
            mockMvc.perform(post("/api/results/mapping/suggest")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("[\"Wolves\", \"AOL Den 3\", \"Siblings\", \"Mystery\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Wolves").value("Wolf"))
                .andExpect(jsonPath("$['AOL Den 3']").value("Arrow of Light"))
                .andExpect(jsonPath("$.Siblings").value("SKIP"))
                .andExpect(jsonPath("$", hasKey("Mystery")))
                .andExpect(jsonPath("$.Mystery").value(nullValue()));
        }
    }

    @Nested
    @DisplayName("POST /api/results")
    class Process {

        @Test
        void returnsRankedReport() throws Exception {
            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body(Map.of("Wolves", "Wolf", "Bear Den", "Bear"), null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sanityReport.findings").isEmpty())
                .andExpect(jsonPath("$.classStats.Wolf[0].racerKey.firstName").value("Ann"))
                .andExpect(jsonPath("$.ranking.finalists.length()").value(2))
                .andExpect(jsonPath("$.totals.totalRaces").value(3));
        }

        @Test
        void appliesPolicyOverrides() throws Exception {
            PolicyOverrides overrides = new PolicyOverrides(ScoringMethod.ALL_HEATS, 2, null, null);

            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body(Map.of("Wolves", "Wolf", "Bear Den", "Bear"), overrides)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ranking.policy.scoringMethod").value("ALL_HEATS"))
                .andExpect(jsonPath("$.ranking.policy.finalsFieldSize").value(2))
                .andExpect(jsonPath("$.ranking.policy.excludeFinalsWinners").value(true))
                .andExpect(jsonPath("$.ranking.wildcards").isEmpty());
        }

        @Test
        void incompleteMappingIsUnprocessable() throws Exception {
            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body(Map.of("Wolves", "Wolf"), null)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.unmappedLabels[0]").value("Bear Den"));
        }

        @Test
        void unansweredSuggestionsAreAllReportedAsUnmapped() throws Exception {
            Map<String, String> mapping = new LinkedHashMap<>();
            mapping.put("Wolves", "Wolf");
            mapping.put("Bear Den", null);
            mapping.put("Siblings", "");
            String request = objectMapper.writeValueAsString(new RaceResultsRequest(
                List.of(source(), siblingsSource()), mapping, null));

            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(request))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.unmappedLabels.length()").value(2))
                .andExpect(jsonPath("$.unmappedLabels[0]").value("Bear Den"))
                .andExpect(jsonPath("$.unmappedLabels[1]").value("Siblings"));
        }

        @Test
        void unknownTargetIsUnprocessable() throws Exception {
            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body(Map.of("Wolves", "Wolf", "Bear Den", "Grizzly"), null)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.invalidEntries['Bear Den']").value("Grizzly"));
        }

        @Test
        void missingSourcesIsBadRequest() throws Exception {
            mockMvc.perform(post("/api/results")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"sources\": [], \"mapping\": {}}"))
                .andExpect(status().isBadRequest());

            verify(raceResultsService, never()).process(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("export and import")
    class ExportAndImport {

        @Test
        void exportsCanonicalTableAsCsv() throws Exception {
            mockMvc.perform(post("/api/results/export")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body(Map.of("Wolves", "Wolf", "Bear Den", "SKIP"), null)))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("merged_race_data.csv")))
                .andExpect(content().string(startsWith("Year,FirstName,LastName")))
                .andExpect(content().string(containsString("Ann|Lee|12|2024|Wolf")))
                .andExpect(content().string(not(containsString("Cy"))));
        }

        @Test
        void rejectsUploadThatIsNotARaceDatabase() throws Exception {
            MockMultipartFile file = new MockMultipartFile("files", "notes.sqlite",
                "application/octet-stream", "not a database".getBytes());

            mockMvc.perform(multipart("/api/results/sources").file(file).param("year", "2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
        }
    }
}
