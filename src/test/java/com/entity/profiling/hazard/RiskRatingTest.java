package com.entity.profiling.hazard;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RiskRatingTest {

    @ParameterizedTest
    @CsvSource({
            "100, Very High",
            "80, Very High",
            "79.99, Relatively High",
            "60, Relatively High",
            "40, Relatively Moderate",
            "20, Relatively Low",
            "19.9, Very Low",
            "0, Very Low"
    })
    void quintiles(double score, String expected) {
        assertEquals(expected, RiskRating.forScore(score));
    }
}
