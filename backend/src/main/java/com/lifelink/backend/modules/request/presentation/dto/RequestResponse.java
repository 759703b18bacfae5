package com.lifelink.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.OrganType;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.domain.Urgency;

public record RequestResponse(
        UUID id,
        UUID hospitalId,
        String hospitalName,
        RequestKind kind,
        BloodType bloodType,
        OrganType organType,
        Urgency urgency,
        RequestStatus status,
        OffsetDateTime requiredBy,
        int quantity,
        String notes,
        OffsetDateTime createdAt
) {

    public static RequestResponse from(DonationRequest request) {
        return new RequestResponse(
                request.getId(),
                request.getHospital().getId(),
                request.getHospital().getHospitalName(),
                request.getKind(),
                request.getBloodType(),
                request.getOrganType(),
                request.getUrgency(),
                request.getStatus(),
                request.getRequiredBy(),
                request.getQuantity(),
                request.getNotes(),
                request.getCreatedAt()
        );
    }
}
