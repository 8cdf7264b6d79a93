package com.visaeligibility.service.store.memory;

import com.visaeligibility.exception.PersistenceException;
import com.visaeligibility.model.ReasoningLog;
import com.visaeligibility.service.store.ReasoningLogRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryReasoningLogRepository implements ReasoningLogRepository {

    private final Map<String, ReasoningLog> logs = new ConcurrentHashMap<>();

    @Override
    public ReasoningLog save(ReasoningLog log) {
        if (log.getCaseId() == null) {
            throw new PersistenceException("Reasoning log requires a case id");
        }
        ReasoningLog stored = log.getId() != null
                ? log
                : log.toBuilder().id(UUID.randomUUID().toString()).build();
        logs.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<ReasoningLog> findById(String id) {
        return Optional.ofNullable(logs.get(id));
    }

    @Override
    public void deleteById(String id) {
        logs.remove(id);
    }

    public int size() {
        return logs.size();
    }
}
