package com.bountypipe.screener.test.service;

import com.bountypipe.screener.dto.OrganizationHistory;
import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.model.Bounty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BountyJsonMappingTest {

    private static final String MARKETPLACE_RECORD = """
            {
              "id": "bty_1",
              "status": "active",
              "tech": ["rust"],
              "reward": {"currency": "USD", "amount": 150000, "formatted": "$1500", "tiers": [], "type": "cash"},
              "org": {"handle": "acme", "id": "org_9", "name": "Acme", "tech": ["rust"]},
              "task": {"id": "t1", "number": 42, "title": "Add retry option to the CLI",
                       "body": "The client should retry failed uploads.", "repo_name": "cli"},
              "internal": {
                "evaluation_status": "evaluated",
                "go_no_go": "go",
                "complexity_score": 4,
                "success_probability": 70,
                "risk_level": "unknown",
                "prep_status": "completed",
                "is_available": true,
                "implementation_status": "completed",
                "implementation_completed_at": "2025-02-20T12:00:00Z",
                "implementation_result": {"tests_passing": true, "requirements_met": true,
                                          "code_quality_validated": true, "ready_for_submission": true}
              }
            }
            """;

    private final ObjectMapper mapper = Fixtures.mapper();

    @Test
    void readsNestedMarketplaceShape() throws Exception {
        Bounty b = mapper.readValue(MARKETPLACE_RECORD, Bounty.class);

        assertThat(b.getId()).isEqualTo("bty_1");
        assertThat(b.getRewardAmount()).isEqualTo(150_000L);
        assertThat(b.getOrganization()).isEqualTo("acme");
        assertThat(b.getTitle()).isEqualTo("Add retry option to the CLI");
        assertThat(b.getBody()).isEqualTo("The client should retry failed uploads.");

        assertThat(b.getInternal().getEvaluationStatus()).isEqualTo(EvaluationStatus.EVALUATED);
        assertThat(b.getInternal().getGoNoGo()).isEqualTo(GoNoGo.GO);
        assertThat(b.getInternal().getRiskLevel()).isNull();
        assertThat(b.getInternal().getImplementationStatus()).isEqualTo(ImplementationStatus.COMPLETED);
        assertThat(b.getInternal().getReadyForSubmission()).isTrue();
        assertThat(b.getInternal().isSuccessfulImplementation()).isTrue();
    }

    @Test
    void nestedRecordCountsAsSuccessInHistory() throws Exception {
        Bounty b = mapper.readValue(MARKETPLACE_RECORD, Bounty.class);

        OrganizationHistory acme = Fixtures.historyService(true).build(List.of(b)).find("acme").orElseThrow();

        assertThat(acme.totalAttempts()).isEqualTo(1);
        assertThat(acme.successfulImplementations()).isEqualTo(1);
        assertThat(acme.totalValue()).isEqualTo(150_000L);
        assertThat(acme.lastSuccessDate()).isEqualTo(Instant.parse("2025-02-20T12:00:00Z"));
    }

    @Test
    void flatShapeStillReads() throws Exception {
        Bounty original = Fixtures.evaluated("b-1", "acme", 20_000, 3, 75, 70);

        Bounty read = mapper.readValue(mapper.writeValueAsString(original), Bounty.class);

        assertThat(read.getRewardAmount()).isEqualTo(20_000L);
        assertThat(read.getOrganization()).isEqualTo("acme");
        assertThat(read.getTitle()).isEqualTo(original.getTitle());
        assertThat(read.getInternal().getComplexityScore()).isEqualTo(3);
    }
}
