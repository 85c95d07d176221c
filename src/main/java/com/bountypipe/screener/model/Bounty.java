package com.bountypipe.screener.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * An externally sourced unit of work. Identity, text, reward and owning organization are
 * fixed once ingested; only the {@link InternalTracking} block changes as the record moves
 * through evaluation and implementation.
 * <p>
 * Reads both the flat form this pipeline writes ({@code reward_amount}, {@code organization},
 * {@code title}, {@code body}) and the marketplace form, where those values sit under
 * {@code reward.amount}, {@code org.handle} and {@code task.title}/{@code task.body}.
 * Other marketplace fields are ignored.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@ToString(exclude = "body")
public class Bounty {

    private final String id;
    private final String title;
    private final String body;

    /** Reward in minor currency units (cents). Null means the fetch layer never supplied one. */
    private final Long rewardAmount;

    /** Owning organization handle. */
    private final String organization;

    @Builder.Default
    private final InternalTracking internal = new InternalTracking();

    public static class BountyBuilder {

        @JsonProperty("reward")
        public BountyBuilder reward(RewardRef reward) {
            return reward == null ? this : rewardAmount(reward.getAmount());
        }

        @JsonProperty("org")
        public BountyBuilder org(OrgRef org) {
            return org == null ? this : organization(org.getHandle());
        }

        @JsonProperty("task")
        public BountyBuilder task(TaskRef task) {
            return task == null ? this : title(task.getTitle()).body(task.getBody());
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RewardRef {
        private Long amount;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrgRef {
        private String handle;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaskRef {
        private String title;
        private String body;
    }
}
