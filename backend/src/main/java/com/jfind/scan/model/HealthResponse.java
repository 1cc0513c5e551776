package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponse(
    @JsonProperty("hostname") String hostname,
    @JsonProperty("process_id") long processId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("db_connectivity") boolean dbConnectivity
) {}
