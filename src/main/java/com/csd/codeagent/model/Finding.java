package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {
    private String title;
    private String category;     // security, performance, style, bug, ...
    private Severity severity;
    private Integer line;        // null when the backend gave no location
    private String description;
    private String suggestion;
    private List<String> sources; // contributing backend ids, first-seen order
    private Confidence confidence;
}
