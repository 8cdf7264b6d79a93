package com.visaeligibility.service.check;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * State of a single (case, visa type) run. Not shared between runs.
 */
@Slf4j
public class CheckRun {

    @Getter
    private final String caseId;

    @Getter
    private final String visaTypeId;

    @Getter
    private CheckState state = CheckState.PENDING;

    private final List<CheckState> trail = new ArrayList<>(List.of(CheckState.PENDING));

    public CheckRun(String caseId, String visaTypeId) {
        this.caseId = caseId;
        this.visaTypeId = visaTypeId;
    }

    public void moveTo(CheckState target) {
        if (!state.canMoveTo(target)) {
            throw new IllegalStateException("Illegal check transition " + state + " -> " + target
                    + " for case " + caseId + ", visa type " + visaTypeId);
        }
        log.debug("Check {}/{}: {} -> {}", caseId, visaTypeId, state, target);
        state = target;
        trail.add(target);
    }

    /**
     * Marks the run failed unless it already reached a terminal state.
     */
    public void fail() {
        if (!state.isTerminal()) {
            moveTo(CheckState.FAILED);
        }
    }

    public List<CheckState> getTrail() {
        return List.copyOf(trail);
    }
}
