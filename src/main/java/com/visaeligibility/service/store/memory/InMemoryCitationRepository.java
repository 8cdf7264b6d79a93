package com.visaeligibility.service.store.memory;

import com.visaeligibility.exception.PersistenceException;
import com.visaeligibility.model.Citation;
import com.visaeligibility.service.store.CitationRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryCitationRepository implements CitationRepository {

    private final Map<String, List<Citation>> citationsByLog = new ConcurrentHashMap<>();

    @Override
    public List<Citation> saveAll(List<Citation> citations) {
        List<Citation> stored = new ArrayList<>(citations.size());
        for (Citation citation : citations) {
            if (citation.getReasoningLogId() == null) {
                throw new PersistenceException("Citation requires a reasoning log id");
            }
            Citation withId = citation.getId() != null
                    ? citation
                    : citation.toBuilder().id(UUID.randomUUID().toString()).build();
            stored.add(withId);
        }
        for (Citation citation : stored) {
            citationsByLog
                    .computeIfAbsent(citation.getReasoningLogId(), id -> new CopyOnWriteArrayList<>())
                    .add(citation);
        }
        return stored;
    }

    @Override
    public List<Citation> findByReasoningLogId(String reasoningLogId) {
        return List.copyOf(citationsByLog.getOrDefault(reasoningLogId, List.of()));
    }

    @Override
    public void deleteByReasoningLogId(String reasoningLogId) {
        citationsByLog.remove(reasoningLogId);
    }
}
