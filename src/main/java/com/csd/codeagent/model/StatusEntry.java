package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusEntry {
    private String id;
    private AnalysisStatus status;
    private String tag;           // backend id, or "combined"
    private Instant startTime;
    private Instant endTime;
    private AggregatedResult result;
    private ErrorInfo error;
    private Instant expiresAt;    // set on the terminal transition
}
