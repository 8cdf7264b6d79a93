package com.visaeligibility.service.store;

import com.visaeligibility.model.Citation;

import java.util.List;

public interface CitationRepository {

    List<Citation> saveAll(List<Citation> citations);

    List<Citation> findByReasoningLogId(String reasoningLogId);

    void deleteByReasoningLogId(String reasoningLogId);
}
