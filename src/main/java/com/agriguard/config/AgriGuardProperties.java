package com.agriguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Objects;

/**
 * The {@code agriguard.*} configuration tree. Engines receive the slice they need
 * through their constructors; nothing here is read from a global.
 */
@ConfigurationProperties(prefix = "agriguard")
public record AgriGuardProperties(
    @DefaultValue("admin") String admin,
    String oracle,
    @DefaultValue("true") boolean autoLink,
    @DefaultValue Clock clock,
    @DefaultValue Treasury treasury,
    @DefaultValue Insurance insurance,
    @DefaultValue Dispute dispute
) {

    public AgriGuardProperties {
        admin = requireNonBlank(admin, "admin");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(treasury, "treasury");
        Objects.requireNonNull(insurance, "insurance");
        Objects.requireNonNull(dispute, "dispute");
    }

    public record Clock(@DefaultValue("0") long initialRound) {
    }

    public record Treasury(@DefaultValue("100000000") long initialBalance) {
    }

    /**
     * @param address the insurance engine's own address, used when it opens disputes
     * @param minLeadRounds rounds required between now and a policy's t0
     * @param minDurationRounds t1 must exceed t0 by more than this
     * @param disputeWindowRounds rounds after settlement during which the owner may dispute
     */
    public record Insurance(
        @DefaultValue("insurance-engine") String address,
        @DefaultValue("1") long minLeadRounds,
        @DefaultValue("100") long minDurationRounds,
        @DefaultValue("1000") long disputeWindowRounds
    ) {

        public Insurance {
            address = requireNonBlank(address, "insurance.address");
            requireNonNegative(minLeadRounds, "insurance.min-lead-rounds");
            requireNonNegative(minDurationRounds, "insurance.min-duration-rounds");
            requireNonNegative(disputeWindowRounds, "insurance.dispute-window-rounds");
        }

        public static Insurance defaults() {
            return new Insurance("insurance-engine", 1, 100, 1000);
        }
    }

    public record Dispute(
        @DefaultValue("dispute-engine") String address,
        @DefaultValue("7") int quorum,
        @DefaultValue("4") int majority,
        @DefaultValue("10") int panelSize,
        @DefaultValue("1000") long votingDurationRounds,
        @DefaultValue("10") long voteCooldownRounds,
        @DefaultValue("10") long jurorWarmupRounds,
        @DefaultValue("50") long disputeWarmupRounds,
        @DefaultValue("50") long eligibilityWaitRounds,
        @DefaultValue("10") int minReputation,
        @DefaultValue("100") int initialReputation,
        @DefaultValue("5") int reputationStep,
        @DefaultValue("1000000") long minStakeAmount
    ) {

        public Dispute {
            address = requireNonBlank(address, "dispute.address");
            if (quorum < 1) {
                throw new IllegalArgumentException("dispute.quorum must be >= 1");
            }
            if (majority < 1 || majority > quorum) {
                throw new IllegalArgumentException("dispute.majority must be in [1, quorum]");
            }
            if (panelSize < quorum) {
                throw new IllegalArgumentException("dispute.panel-size must be >= quorum");
            }
            requireNonNegative(votingDurationRounds, "dispute.voting-duration-rounds");
            requireNonNegative(voteCooldownRounds, "dispute.vote-cooldown-rounds");
            requireNonNegative(jurorWarmupRounds, "dispute.juror-warmup-rounds");
            requireNonNegative(disputeWarmupRounds, "dispute.dispute-warmup-rounds");
            requireNonNegative(eligibilityWaitRounds, "dispute.eligibility-wait-rounds");
            requireNonNegative(minStakeAmount, "dispute.min-stake-amount");
        }

        public static Dispute defaults() {
            return new Dispute("dispute-engine", 7, 4, 10, 1000, 10, 10, 50, 50, 10, 100, 5, 1_000_000);
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }
}
