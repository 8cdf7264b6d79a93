package com.visaeligibility.service.store;

import com.visaeligibility.model.RuleVersion;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to published rule versions. Normally at most one version is
 * active for a visa type on a given date, but the provider returns every
 * match so the caller can resolve overlaps deterministically.
 */
public interface RuleVersionProvider {

    List<RuleVersion> findActiveRuleVersions(String visaTypeId, LocalDate asOf);
}
