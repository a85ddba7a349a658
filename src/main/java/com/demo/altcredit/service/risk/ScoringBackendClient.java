package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.risk.dto.RemoteAssessmentResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/**
 * Calls the remote scoring backend: {@code POST {baseUrl}/risk/assess} with body
 * {@code {"profile": ...}}. Every failure, including an unconfigured URL or an unusable
 * payload, surfaces as {@link BackendUnreachableException}.
 */
@Slf4j
public class ScoringBackendClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ScoringBackendClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = (baseUrl != null && baseUrl.endsWith("/")) ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public RemoteAssessmentResponse assess(CompositeProfile profile) {
        if (!isConfigured()) {
            throw new BackendUnreachableException("Scoring backend base URL not configured");
        }
        try {
            var req = RequestEntity
                    .post(URI.create(baseUrl + "/risk/assess"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("profile", profile));
            ResponseEntity<RemoteAssessmentResponse> resp = restTemplate.exchange(req, RemoteAssessmentResponse.class);
            RemoteAssessmentResponse body = resp.getBody();
            if (body == null || body.getOverallScore() == null) {
                throw new BackendUnreachableException("Scoring backend returned invalid payload");
            }
            return body;
        } catch (RestClientException ex) {
            throw new BackendUnreachableException("Scoring backend call failed: " + ex.getMessage(), ex);
        }
    }
}
