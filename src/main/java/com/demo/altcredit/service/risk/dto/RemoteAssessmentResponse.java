package com.demo.altcredit.service.risk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteAssessmentResponse {
    public Integer overallScore;
    // keys are source keys ("deviceProfile") or enum names
    public Map<String, Integer> componentScores;
    public List<String> insights;
    public List<String> recommendations;

    @JsonProperty("model_version")
    public String modelVersion;
}
