package com.lifelink.backend.modules.matching;

import static com.lifelink.backend.modules.matching.domain.BloodType.AB_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.AB_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.A_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.A_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.B_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.B_POSITIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.O_NEGATIVE;
import static com.lifelink.backend.modules.matching.domain.BloodType.O_POSITIVE;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.lifelink.backend.modules.matching.domain.BloodCompatibility;
import com.lifelink.backend.modules.matching.domain.BloodType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BloodCompatibilityTest {

    // recipients each donor type may supply, per ABO/Rh transfusion rules
    private static final Map<BloodType, Set<BloodType>> EXPECTED = Map.of(
            O_NEGATIVE, EnumSet.allOf(BloodType.class),
            O_POSITIVE, EnumSet.of(O_POSITIVE, A_POSITIVE, B_POSITIVE, AB_POSITIVE),
            A_NEGATIVE, EnumSet.of(A_NEGATIVE, A_POSITIVE, AB_NEGATIVE, AB_POSITIVE),
            A_POSITIVE, EnumSet.of(A_POSITIVE, AB_POSITIVE),
            B_NEGATIVE, EnumSet.of(B_NEGATIVE, B_POSITIVE, AB_NEGATIVE, AB_POSITIVE),
            B_POSITIVE, EnumSet.of(B_POSITIVE, AB_POSITIVE),
            AB_NEGATIVE, EnumSet.of(AB_NEGATIVE, AB_POSITIVE),
            AB_POSITIVE, EnumSet.of(AB_POSITIVE)
    );

    @Test
    @DisplayName("every donor/recipient pair matches the transfusion table")
    void matchesTransfusionTableForAllPairs() {
        for (BloodType donor : BloodType.values()) {
            for (BloodType recipient : BloodType.values()) {
                assertThat(BloodCompatibility.isCompatible(donor, recipient))
                        .as("%s -> %s", donor.getCode(), recipient.getCode())
                        .isEqualTo(EXPECTED.get(donor).contains(recipient));
            }
        }
    }

    @Test
    void universalDonorAndRecipient() {
        assertThat(BloodCompatibility.recipientsOf(O_NEGATIVE)).hasSize(8);
        assertThat(BloodCompatibility.recipientsOf(AB_POSITIVE)).containsExactly(AB_POSITIVE);
        for (BloodType donor : BloodType.values()) {
            assertThat(BloodCompatibility.isCompatible(donor, AB_POSITIVE)).isTrue();
        }
    }

    @Test
    void unknownTypesAreNeverCompatible() {
        assertThat(BloodCompatibility.isCompatible(null, O_POSITIVE)).isFalse();
        assertThat(BloodCompatibility.isCompatible(O_NEGATIVE, null)).isFalse();
        assertThat(BloodCompatibility.recipientsOf(null)).isEmpty();
    }

    @Test
    void bloodTypeCodesParseInBothForms() {
        assertThat(BloodType.fromCode("A-")).contains(A_NEGATIVE);
        assertThat(BloodType.fromCode("AB_POSITIVE")).contains(AB_POSITIVE);
        assertThat(BloodType.fromCode("C+")).isEmpty();
        assertThat(BloodType.fromCode(null)).isEmpty();
    }
}
