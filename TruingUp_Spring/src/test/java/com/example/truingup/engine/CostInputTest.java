package com.example.truingup.engine;

import com.example.truingup.engine.exception.CostInputValidationException;
import com.example.truingup.engine.exception.InvalidEnumValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CostInputTest {

    private static CostInput.CostInputBuilder om() {
        return CostInput.builder()
                .head("O&M")
                .category(CostCategory.CONTROLLABLE)
                .sbuCode(SbuCode.SBU_D)
                .approved(new BigDecimal("150"));
    }

    @Test
    @DisplayName("category labels are matched exactly, and a miss names the accepted set")
    void categoryIsCaseSensitive() {
        assertThatThrownBy(() -> om().category("controllable").build())
                .isInstanceOf(InvalidEnumValueException.class)
                .hasMessageContaining("'controllable'")
                .hasMessageContaining("Controllable")
                .hasMessageContaining("Uncontrollable")
                .satisfies(e -> {
                    InvalidEnumValueException ex = (InvalidEnumValueException) e;
                    assertThat(ex.getField()).isEqualTo("category");
                    assertThat(ex.getAcceptedValues()).containsExactly("Controllable", "Uncontrollable");
                });
    }

    @Test
    @DisplayName("unknown SBU codes are rejected with the three partitions listed")
    void unknownSbu() {
        assertThatThrownBy(() -> om().sbuCode("SBU-X").build())
                .isInstanceOf(InvalidEnumValueException.class)
                .hasMessageContaining("SBU-G")
                .hasMessageContaining("SBU-T")
                .hasMessageContaining("SBU-D");
    }

    @Test
    @DisplayName("labels parse into their constants")
    void labelsParse() {
        CostInput input = om().category("Uncontrollable").sbuCode("SBU-G").build();

        assertThat(input.category()).isEqualTo(CostCategory.UNCONTROLLABLE);
        assertThat(input.sbuCode()).isEqualTo(SbuCode.SBU_G);
    }

    @Test
    @DisplayName("head, SBU and approved amount are required")
    void requiredFields() {
        assertThatThrownBy(() -> om().head("  ").build()).isInstanceOf(CostInputValidationException.class);
        assertThatThrownBy(() -> om().sbuCode((SbuCode) null).build())
                .isInstanceOf(CostInputValidationException.class)
                .hasMessageContaining("sbu_code");
        assertThatThrownBy(() -> om().approved(null).build())
                .isInstanceOf(CostInputValidationException.class)
                .hasMessageContaining("approved");
    }

    @Test
    @DisplayName("cost-head labels longer than the audit column are rejected")
    void headLength() {
        assertThat(om().head("H".repeat(CostInput.MAX_HEAD_LENGTH)).build().head()).hasSize(100);
        assertThatThrownBy(() -> om().head("H".repeat(CostInput.MAX_HEAD_LENGTH + 1)).build())
                .isInstanceOf(CostInputValidationException.class)
                .hasMessageContaining("exceeds 100 characters");
    }

    @Test
    @DisplayName("amounts are held at money scale")
    void moneyScale() {
        CostInput input = om().approved(new BigDecimal("150")).actual(new BigDecimal("120.005")).build();

        assertThat(input.approved()).isEqualTo(new BigDecimal("150.00"));
        assertThat(input.actual()).isEqualTo(new BigDecimal("120.01"));
        assertThat(input).isEqualTo(om().approved(new BigDecimal("150.00")).actual(new BigDecimal("120.01")).build());
        assertThat(om().build().actual()).isNull();
    }

    @Test
    @DisplayName("anomaly score must lie in [0, 1]")
    void anomalyRange() {
        assertThatThrownBy(() -> om().anomalyScore(1.2).build()).isInstanceOf(CostInputValidationException.class);
        assertThatThrownBy(() -> om().anomalyScore(Double.NaN).build()).isInstanceOf(CostInputValidationException.class);
        assertThat(om().anomalyScore(1.0).build().anomalyScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("evidence pages are 1-based")
    void evidencePage() {
        assertThatThrownBy(() -> om().evidencePage(0).build()).isInstanceOf(CostInputValidationException.class);
        assertThat(om().evidencePage(12).build().evidencePage()).isEqualTo(12);
    }

    @Test
    @DisplayName("a record without an actual is unverified and awaiting extraction")
    void defaults() {
        CostInput input = om().build();

        assertThat(input.humanVerified()).isFalse();
        assertThat(input.awaitingExtraction()).isTrue();
    }
}
