package com.jreinhal.tieredrag.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HeadingDetectorTest {

    @Test
    void recognisesHeadingForms() {
        assertTrue(HeadingDetector.isHeading("## Scope"));
        assertTrue(HeadingDetector.isHeading("2.1 Eligibility"));
        assertTrue(HeadingDetector.isHeading("Chapter 3"));
        assertTrue(HeadingDetector.isHeading("ARTICLE IV Termination"));
        assertTrue(HeadingDetector.isHeading("TERMS AND CONDITIONS"));
    }

    @Test
    void rejectsBodyText() {
        assertFalse(HeadingDetector.isHeading("The committee met on Tuesday."));
        assertFalse(HeadingDetector.isHeading("2 apples were left"));
        assertFalse(HeadingDetector.isHeading("OK"));
        assertFalse(HeadingDetector.isHeading("   "));
        assertFalse(HeadingDetector.isHeading(null));
        assertFalse(HeadingDetector.isHeading("A".repeat(61)));
    }

    @Test
    void titleDropsMarkdownMarkers() {
        assertEquals("Scope", HeadingDetector.title("### Scope"));
        assertEquals("2.1 Eligibility", HeadingDetector.title("  2.1 Eligibility "));
        assertNull(HeadingDetector.title("plain text"));
    }

    @Test
    void lastHeadingFindsFinalHeading() {
        String text = "# Intro\nSome text.\n## Costs\nMore text.";

        assertEquals("Costs", HeadingDetector.lastHeading(text));
        assertNull(HeadingDetector.lastHeading("No headings here."));
    }
}
