package com.lifelink.backend.modules.donor.presentation.dto;

import com.lifelink.backend.modules.matching.application.RequestCandidate;
import com.lifelink.backend.modules.request.presentation.dto.RequestResponse;

public record RequestMatchResponse(
        RequestResponse request,
        int score,
        boolean bloodTypeMatch,
        boolean eligible
) {

    public static RequestMatchResponse from(RequestCandidate candidate) {
        return new RequestMatchResponse(
                RequestResponse.from(candidate.request()),
                candidate.score(),
                candidate.compatibility().bloodTypeMatch(),
                candidate.compatibility().eligible()
        );
    }
}
