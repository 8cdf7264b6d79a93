package com.visaeligibility.service.store.memory;

import com.visaeligibility.service.store.HumanReviewGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records review requests and logs them. Stands in for the review queue,
 * which assigns reviewers on its own.
 */
@Slf4j
@Component
public class LoggingHumanReviewGateway implements HumanReviewGateway {

    private final List<ReviewRequest> requests = new CopyOnWriteArrayList<>();

    @Override
    public void requestHumanReview(String caseId, String reason) {
        log.info("Human review requested for case {}: {}", caseId, reason);
        requests.add(new ReviewRequest(caseId, reason, Instant.now()));
    }

    public List<ReviewRequest> getRequests() {
        return List.copyOf(requests);
    }

    public record ReviewRequest(String caseId, String reason, Instant requestedAt) {
    }
}
