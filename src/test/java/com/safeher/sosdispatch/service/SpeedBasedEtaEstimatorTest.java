package com.safeher.sosdispatch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class SpeedBasedEtaEstimatorTest {

    private SpeedBasedEtaEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new SpeedBasedEtaEstimator();
        ReflectionTestUtils.setField(estimator, "metersPerMinute", 500.0);
    }

    @Test
    void estimateMinutes_roundsUp() {
        assertThat(estimator.estimateMinutes(1200L)).isEqualTo(3);
        assertThat(estimator.estimateMinutes(1000L)).isEqualTo(2);
        assertThat(estimator.estimateMinutes(0L)).isZero();
    }

    @Test
    void estimateMinutes_unknownDistance_null() {
        assertThat(estimator.estimateMinutes(null)).isNull();
    }

    @Test
    void estimateMinutes_nonPositiveSpeed_null() {
        ReflectionTestUtils.setField(estimator, "metersPerMinute", 0.0);
        assertThat(estimator.estimateMinutes(1200L)).isNull();
    }
}
