package com.rabs.backend.modules.loom.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StaffingRequirementTest {

    @ParameterizedTest(name = "{0} participants need {1} non-driver staff")
    @CsvSource({"0, 1", "1, 2", "4, 2", "5, 3", "9, 3", "10, 4"})
    @DisplayName("one lead plus a support worker per five participants, rounded up")
    void ratioLaw(int participants, int expectedNonDriver) {
        StaffingRequirement requirement = StaffingRequirement.of(participants, 5, 0, false);

        assertThat(requirement.lead()).isEqualTo(1);
        assertThat(requirement.nonDriverCount()).isEqualTo(expectedNonDriver);
    }

    @Test
    @DisplayName("transport programs add a driver and extra staff count as support")
    void driverAndAdditionalStaff() {
        StaffingRequirement requirement = StaffingRequirement.of(6, 5, 1, true);

        assertThat(requirement.support()).isEqualTo(3);
        assertThat(requirement.driver()).isEqualTo(1);
        assertThat(requirement.total()).isEqualTo(5);
    }

    @Test
    @DisplayName("a non-positive ratio is rejected")
    void rejectsInvalidRatio() {
        assertThatThrownBy(() -> StaffingRequirement.of(3, 0, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
