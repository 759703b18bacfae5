package com.lifelink.backend.modules.matching.application;

import com.lifelink.backend.modules.user.domain.Donor;

public record DonorCandidate(Donor donor, double score, String reason) {
}
