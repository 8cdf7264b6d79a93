package com.visaeligibility.service.store;

import com.visaeligibility.model.ReasoningLog;

import java.util.Optional;

public interface ReasoningLogRepository {

    ReasoningLog save(ReasoningLog log);

    Optional<ReasoningLog> findById(String id);

    void deleteById(String id);
}
