package com.lifelink.backend.modules.donor.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Body is optional; quantity defaults to 1.
 */
public record RespondToRequestRequest(
        Integer quantity,
        @Size(max = 1000) String notes
) {
}
