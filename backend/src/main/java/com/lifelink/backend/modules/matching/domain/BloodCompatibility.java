package com.lifelink.backend.modules.matching.domain;

import static com.lifelink.backend.modules.matching.domain.BloodType.AB_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.AB_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.A_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.A_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.B_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.B_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.O_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.O_POSITIVE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Donor to recipient red cell compatibility. O- gives to everyone, AB+ receives from everyone.
 */
public final class BloodCompatibility {

    private static final Map<BloodType, Set<BloodType>> RECIPIENTS_BY_DONOR = new EnumMap<>(BloodType.class);

    static {
        RECIPIENTS_BY_DONOR.put(O_NEGATIVE, EnumSet.allOf(BloodType.class));
        RECIPIENTS_BY_DONOR.put(O_POSITIVE, EnumSet.of(O_POSITIVE, A_POSITIVE, B_POSITIVE, AB_POSITIVE));
        RECIPIENTS_BY_DONOR.put(A_NEGATIVE, EnumSet.of(A_POSITIVE, A_NEGATIVE, AB_POSITIVE, AB_NEGATIVE));
        RECIPIENTS_BY_DONOR.put(A_POSITIVE, EnumSet.of(A_POSITIVE, AB_POSITIVE));
        RECIPIENTS_BY_DONOR.put(B_NEGATIVE, EnumSet.of(B_POSITIVE, B_NEGATIVE, AB_POSITIVE, AB_NEGATIVE));
        RECIPIENTS_BY_DONOR.put(B_POSITIVE, EnumSet.of(B_POSITIVE, AB_POSITIVE));
        RECIPIENTS_BY_DONOR.put(AB_NEGATIVE, EnumSet.of(AB_POSITIVE, AB_NEGATIVE));
        RECIPIENTS_BY_DONOR.put(AB_POSITIVE, EnumSet.of(AB_POSITIVE));
    }

    private BloodCompatibility() {
    }

    public static boolean isCompatible(BloodType donorType, BloodType recipientType) {
        if (donorType == null || recipientType == null) {
            return false;
        }
        return RECIPIENTS_BY_DONOR.get(donorType).contains(recipientType);
    }

    public static Set<BloodType> recipientsOf(BloodType donorType) {
        if (donorType == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(RECIPIENTS_BY_DONOR.get(donorType));
    }
}
