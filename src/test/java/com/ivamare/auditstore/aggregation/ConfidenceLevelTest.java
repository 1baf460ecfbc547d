package com.ivamare.auditstore.aggregation;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceLevelTest {

    @ParameterizedTest
    @CsvSource({
        "0, INSUFFICIENT_DATA",
        "4, INSUFFICIENT_DATA",
        "5, LOW",
        "19, LOW",
        "20, MEDIUM",
        "99, MEDIUM",
        "100, HIGH",
        "5000, HIGH"
    })
    void shouldMapSampleCountToLevel(long total, ConfidenceLevel expected) {
        assertEquals(expected, ConfidenceLevel.forSampleCount(total));
    }
}
