package com.bountypipe.screener.test.service;

import com.bountypipe.screener.common.exception.ValidationException;
import com.bountypipe.screener.dto.OrganizationHistory;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.service.history.OrganizationHistorySnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrganizationHistoryServiceTest {

    @Test
    void aggregatesAttemptsSuccessesAndValuePerOrganization() {
        List<Bounty> corpus = new ArrayList<>(Fixtures.pastAttempts("acme", 10, 8));
        corpus.add(Fixtures.evaluated("acme-new", "acme", 150_000, 3, 75, 70));
        corpus.addAll(Fixtures.pastAttempts("globex", 2, 0));

        OrganizationHistorySnapshot snapshot = Fixtures.historyService(false).build(corpus);

        OrganizationHistory acme = snapshot.find("acme").orElseThrow();
        assertThat(acme.totalAttempts()).as("untouched record is not an attempt").isEqualTo(10);
        assertThat(acme.successfulImplementations()).isEqualTo(8);
        assertThat(acme.successRate()).isEqualTo(80.0);
        assertThat(acme.totalValue()).isEqualTo(10 * 20_000L + 150_000L);
        assertThat(acme.averageComplexity()).isEqualTo(3.0);
        assertThat(acme.lastSuccessDate()).isEqualTo(Fixtures.T0.minusSeconds(3600));

        OrganizationHistory globex = snapshot.find("globex").orElseThrow();
        assertThat(globex.successRate()).isZero();
        assertThat(globex.averageComplexity()).isEqualTo(5.0);
        assertThat(globex.lastSuccessDate()).isNull();

        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.find("initech")).isEmpty();
    }

    @Test
    void completedWithoutReadinessIsAnAttemptButNotASuccess() {
        Bounty b = Fixtures.bounty("b-1", "acme", 1_000);
        b.getInternal().setImplementationStatus(ImplementationStatus.COMPLETED);

        OrganizationHistory h = Fixtures.historyService(false).build(List.of(b)).find("acme").orElseThrow();

        assertThat(h.totalAttempts()).isEqualTo(1);
        assertThat(h.successfulImplementations()).isZero();
    }

    @Test
    void readyWithoutCompletionIsFlaggedAndNotCounted() {
        Bounty b = Fixtures.bounty("b-1", "acme", 1_000);
        b.getInternal().setImplementationStatus(ImplementationStatus.IN_PROGRESS);
        b.getInternal().setReadyForSubmission(true);

        OrganizationHistory h = Fixtures.historyService(false).build(List.of(b)).find("acme").orElseThrow();

        assertThat(h.successfulImplementations()).isZero();
        assertThat(h.flaggedRecords()).containsExactly("b-1");
    }

    @Test
    void strictIngestionRejectsInconsistentRecords() {
        Bounty b = Fixtures.bounty("b-1", "acme", 1_000);
        b.getInternal().setImplementationStatus(ImplementationStatus.FAILED);
        b.getInternal().setReadyForSubmission(true);

        assertThatThrownBy(() -> Fixtures.historyService(true).build(List.of(b)))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrorCode()).isEqualTo(ValidationException.INCONSISTENT_FLAGS));
    }

    @Test
    void malformedRecordsAreSkippedNotFatal() {
        Bounty noOrg = Bounty.builder().id("b-x").title("t").rewardAmount(100L).build();
        List<Bounty> corpus = new ArrayList<>(Fixtures.pastAttempts("acme", 3, 3));
        corpus.add(noOrg);

        OrganizationHistorySnapshot snapshot = Fixtures.historyService(false).build(corpus);

        assertThat(snapshot.getRejectedRecords()).containsExactly("b-x");
        assertThat(snapshot.find("acme").orElseThrow().successRate()).isEqualTo(100.0);

        assertThatThrownBy(() -> Fixtures.historyService(true).build(corpus))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void emptyCorpusYieldsEmptySnapshot() {
        assertThat(Fixtures.historyService(false).build(List.of()).size()).isZero();
        assertThat(OrganizationHistorySnapshot.empty().asMap()).isEmpty();
    }
}
