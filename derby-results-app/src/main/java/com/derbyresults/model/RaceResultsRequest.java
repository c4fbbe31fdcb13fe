package com.derbyresults.model;

import java.util.List;
import java.util.Map;

public record RaceResultsRequest(
    List<SourceBundle> sources,
    Map<String, String> mapping,    // raw label -> standard class or "SKIP"
    PolicyOverrides policy
) {}
