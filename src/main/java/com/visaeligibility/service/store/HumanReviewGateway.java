package com.visaeligibility.service.store;

public interface HumanReviewGateway {

    void requestHumanReview(String caseId, String reason);
}
