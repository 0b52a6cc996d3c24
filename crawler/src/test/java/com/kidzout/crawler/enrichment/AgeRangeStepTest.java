package com.kidzout.crawler.enrichment;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AgeRangeStepTest {

    @Test
    void explicitGermanRange() {
        assertArrayEquals(new int[]{4, 8}, AgeRangeStep.explicitRange("für kinder von 4-8 jahren"));
        assertArrayEquals(new int[]{6, 10}, AgeRangeStep.explicitRange("6 bis 10 jahre"));
    }

    @Test
    void englishRangeAndMinimum() {
        assertArrayEquals(new int[]{5, 9}, AgeRangeStep.explicitRange("ages 5-9 welcome"));
        assertArrayEquals(new int[]{7, 12}, AgeRangeStep.explicitRange("ages 7+"));
    }

    @Test
    void minimumAgeIgnoresClockTimesAndPrices() {
        assertArrayEquals(new int[]{4, 12}, AgeRangeStep.explicitRange("einlass ab 10 uhr, geeignet ab 4 jahren"));
        assertNull(AgeRangeStep.explicitRange("tickets ab 5 €"));
    }

    @Test
    void underThreeButNotSubwayLines() {
        assertArrayEquals(new int[]{0, 3}, AgeRangeStep.explicitRange("krabbeln für u3"));
        assertNull(AgeRangeStep.explicitRange("anfahrt mit der u6 bis klinikum"));
    }

    @Test
    void adultRangesAreIgnored() {
        assertNull(AgeRangeStep.explicitRange("workshop für 18-99 jahre"));
    }

    @Test
    void ageGroupsOverlapRange() {
        assertEquals(List.of("3-6", "6-9"), AgeRangeStep.ageGroups(4, 8));
        assertEquals(List.of("0-3", "3-6", "6-9", "9-12"), AgeRangeStep.ageGroups(0, 12));
        assertEquals(List.of("9-12"), AgeRangeStep.ageGroups(10, 12));
    }
}
