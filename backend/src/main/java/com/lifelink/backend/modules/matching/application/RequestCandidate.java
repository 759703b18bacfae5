package com.lifelink.backend.modules.matching.application;

import com.lifelink.backend.modules.request.domain.DonationRequest;

public record RequestCandidate(DonationRequest request, int score, Compatibility compatibility) {

    public record Compatibility(boolean bloodTypeMatch, boolean eligible) {
    }
}
