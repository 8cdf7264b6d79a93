package com.visaeligibility.service.check;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one eligibility check run.
 * <pre>
 * PENDING -> RULE_EVALUATED -> (AI_EVALUATED | AI_SKIPPED) -> COMBINED -> PERSISTED -> (ESCALATED | DONE)
 * </pre>
 * Any non-terminal state may move to FAILED.
 */
public enum CheckState {

    PENDING,
    RULE_EVALUATED,
    AI_EVALUATED,
    AI_SKIPPED,
    COMBINED,
    PERSISTED,
    ESCALATED,
    DONE,
    FAILED;

    public Set<CheckState> next() {
        return switch (this) {
            case PENDING -> EnumSet.of(RULE_EVALUATED, FAILED);
            case RULE_EVALUATED -> EnumSet.of(AI_EVALUATED, AI_SKIPPED, FAILED);
            case AI_EVALUATED, AI_SKIPPED -> EnumSet.of(COMBINED, FAILED);
            case COMBINED -> EnumSet.of(PERSISTED, FAILED);
            case PERSISTED -> EnumSet.of(ESCALATED, DONE, FAILED);
            case ESCALATED, DONE, FAILED -> EnumSet.noneOf(CheckState.class);
        };
    }

    public boolean canMoveTo(CheckState target) {
        return next().contains(target);
    }

    public boolean isTerminal() {
        return next().isEmpty();
    }
}
