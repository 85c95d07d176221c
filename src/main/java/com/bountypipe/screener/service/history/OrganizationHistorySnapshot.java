package com.bountypipe.screener.service.history;

import com.bountypipe.screener.dto.OrganizationHistory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, session-scoped view of organization history. Built once per session and
 * passed into every decision; refreshed only by building a new snapshot.
 */
public final class OrganizationHistorySnapshot {

    private final Map<String, OrganizationHistory> byOrganization;
    private final List<String> rejectedRecords;

    OrganizationHistorySnapshot(Map<String, OrganizationHistory> byOrganization, List<String> rejectedRecords) {
        this.byOrganization = Collections.unmodifiableMap(new LinkedHashMap<>(byOrganization));
        this.rejectedRecords = List.copyOf(rejectedRecords);
    }

    public static OrganizationHistorySnapshot empty() {
        return new OrganizationHistorySnapshot(Map.of(), List.of());
    }

    public Optional<OrganizationHistory> find(String organization) {
        return Optional.ofNullable(organization == null ? null : byOrganization.get(organization));
    }

    public Map<String, OrganizationHistory> asMap() {
        return byOrganization;
    }

    /**
     * Ids of corpus records left out of the snapshot because they failed shape validation.
     */
    public List<String> getRejectedRecords() {
        return rejectedRecords;
    }

    public int size() {
        return byOrganization.size();
    }
}
