package com.bountypipe.screener.service.history;

import com.bountypipe.screener.common.exception.ValidationException;
import com.bountypipe.screener.config.HistoryProperties;
import com.bountypipe.screener.dto.OrganizationHistory;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.bountypipe.screener.service.validation.BountyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds per-organization attempt/success statistics from the whole record corpus in one
 * pass. There are no incremental updates: rebuild to refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationHistoryService {

    private final BountyValidator validator;
    private final HistoryProperties properties;

    public OrganizationHistorySnapshot build(Collection<Bounty> corpus) {
        Map<String, Accumulator> acc = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();

        for (Bounty bounty : corpus) {
            try {
                validator.requireIngestible(bounty);
            } catch (ValidationException e) {
                if (properties.isStrictIngestion()) throw e;
                log.warn("history: skipping record - {}", e.getMessage());
                rejected.add(bounty == null || bounty.getId() == null ? "<no id>" : bounty.getId());
                continue;
            }
            acc.computeIfAbsent(bounty.getOrganization(), Accumulator::new).add(bounty);
        }

        Map<String, OrganizationHistory> histories = new LinkedHashMap<>();
        for (Accumulator a : acc.values()) {
            OrganizationHistory h = a.toHistory();
            histories.put(h.name(), h);
            log.info("history: {} -> {} attempts, {}% success",
                    h.name(), h.totalAttempts(), String.format(Locale.ROOT, "%.1f", h.successRate()));
        }
        return new OrganizationHistorySnapshot(histories, rejected);
    }

    private final class Accumulator {
        private final String name;
        private int attempts;
        private int successes;
        private long totalValue;
        private long complexitySum;
        private int complexityCount;
        private Instant lastSuccess;
        private final List<String> flagged = new ArrayList<>();

        Accumulator(String name) {
            this.name = name;
        }

        void add(Bounty b) {
            totalValue += b.getRewardAmount();
            InternalTracking t = b.getInternal();
            if (t == null) return;

            if (BountyValidator.isReadyWithoutCompletion(t)) {
                String msg = "record " + b.getId() + " is ready_for_submission but implementation_status is "
                        + t.getImplementationStatus();
                if (properties.isStrictIngestion()) {
                    throw new ValidationException(ValidationException.INCONSISTENT_FLAGS, msg);
                }
                log.warn("history: {} (not counted as success)", msg);
                flagged.add(b.getId());
            }

            if (t.getImplementationStatus() != null) {
                attempts++;
                if (t.isSuccessfulImplementation()) {
                    successes++;
                    Instant done = t.getImplementationCompletedAt();
                    if (done != null && (lastSuccess == null || done.isAfter(lastSuccess))) lastSuccess = done;
                }
            }

            if (t.getComplexityScore() != null) {
                complexitySum += t.getComplexityScore();
                complexityCount++;
            }
        }

        OrganizationHistory toHistory() {
            double rate = attempts > 0 ? (successes * 100.0) / attempts : 0.0;
            double avgComplexity = complexityCount > 0 ? (double) complexitySum / complexityCount : 5.0;
            return new OrganizationHistory(name, attempts, successes, rate, avgComplexity, totalValue, lastSuccess, flagged);
        }
    }
}
