package com.visaeligibility.service.store.memory;

import com.visaeligibility.model.RuleVersion;
import com.visaeligibility.service.store.RuleVersionProvider;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryRuleVersionStore implements RuleVersionProvider {

    private final List<RuleVersion> ruleVersions = new CopyOnWriteArrayList<>();

    @Override
    public List<RuleVersion> findActiveRuleVersions(String visaTypeId, LocalDate asOf) {
        return ruleVersions.stream()
                .filter(v -> v.visaTypeId().equals(visaTypeId))
                .filter(v -> v.isActiveOn(asOf))
                .toList();
    }

    public void add(RuleVersion ruleVersion) {
        ruleVersions.add(ruleVersion);
    }

    public void clear() {
        ruleVersions.clear();
    }

    public int size() {
        return ruleVersions.size();
    }
}
