package com.demo.altcredit.controller.dto;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.collectors.LocationPermissionState;
import com.demo.altcredit.service.refresh.RefresherState;
import com.demo.altcredit.service.session.CollectionSession;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

public final class SessionDtos {
    private SessionDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpenRequest {
        public String sessionId;     // optional; resumes persisted state for a known id
    }

    public static class SessionResponse {
        public String sessionId;
        public boolean consentGranted;
        public RefresherState refresher;
        public LocationPermissionState locationPermission;
        public List<SourceId> sources;

        public static SessionResponse of(CollectionSession s) {
            SessionResponse r = new SessionResponse();
            r.sessionId = s.getId();
            r.consentGranted = s.hasConsent();
            r.refresher = s.refresherState();
            r.locationPermission = s.locationPermission();
            r.sources = s.getOrchestrator().registeredSources();
            return r;
        }
    }
}
