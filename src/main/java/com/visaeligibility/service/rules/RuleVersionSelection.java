package com.visaeligibility.service.rules;

import com.visaeligibility.model.RuleVersion;

import java.util.List;

/**
 * The rule version chosen for a (visa type, date) pair, plus the ids of every
 * version that was active at the same time when there was more than one.
 */
public record RuleVersionSelection(RuleVersion ruleVersion, List<String> competingVersionIds) {

    public RuleVersionSelection {
        competingVersionIds = List.copyOf(competingVersionIds);
    }

    public boolean isAmbiguous() {
        return competingVersionIds.size() > 1;
    }
}
