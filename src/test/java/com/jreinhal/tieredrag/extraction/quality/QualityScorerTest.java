package com.jreinhal.tieredrag.extraction.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityScorerTest {

    private static final String SECTION = """
            # Firearms Registration
            Every firearm held in the province must be registered with the district office within thirty days.
            The owner must present proof of identity together with the purchase receipt and the serial number.
            - Registration fee: fifty units
            - Processing time: ten working days
            | Form | Purpose | Fee |
            | A1 | New registration | 50 |
            Renewal is required every five years and late renewal carries a penalty set by the registrar.
            """;

    private final QualityScorer scorer = new QualityScorer();

    @Test
    void identicalInputGivesIdenticalReport() {
        List<String> pages = List.of(SECTION, SECTION.replace("thirty", "sixty"));

        QualityReport first = scorer.score(pages);
        QualityReport second = scorer.score(new ArrayList<>(pages));

        assertEquals(first, second);
        assertEquals(Double.doubleToLongBits(first.overallScore()), Double.doubleToLongBits(second.overallScore()));
    }

    @Test
    void emptyPageListScoresZeroWithIssue() {
        QualityReport report = scorer.score(List.of());

        assertEquals(0.0, report.overallScore());
        assertEquals(Recommendation.POOR, report.recommendation());
        assertTrue(report.issues().contains("no pages extracted"));
        assertEquals(5, report.dimensions().size());
    }

    @Test
    void blankPagesScoreZeroWithIssue() {
        QualityReport report = scorer.score(List.of("", "   \n"));

        assertEquals(0.0, report.overallScore());
        assertTrue(report.dimension(QualityDimension.CONTENT_DENSITY).issues().contains("no text extracted"));
    }

    @Test
    void nullInputIsTreatedAsEmpty() {
        assertEquals(0.0, scorer.score(null).overallScore());
    }

    @Test
    void overallScoreIsWeightedSumOfDimensions() {
        QualityReport report = scorer.score(List.of(SECTION, SECTION));

        double expected = 0.0;
        for (DimensionScore dimension : report.dimensions().values()) {
            expected += dimension.score() * dimension.weight();
        }
        assertEquals(expected, report.overallScore(), 1e-12);
        assertEquals(0.25, report.dimension(QualityDimension.TEXT_CLEANLINESS).weight());
        assertEquals(0.20, report.dimension(QualityDimension.WORD_INTEGRITY).weight());
        assertEquals(0.15, report.dimension(QualityDimension.CROSS_PAGE_CONSISTENCY).weight());
        assertEquals(0.20, report.dimension(QualityDimension.STRUCTURAL_RICHNESS).weight());
        assertEquals(0.20, report.dimension(QualityDimension.CONTENT_DENSITY).weight());
    }

    @Test
    void cleanStructuredTextScoresWell() {
        QualityReport report = scorer.score(List.of(SECTION, SECTION));

        assertEquals(1.0, report.dimension(QualityDimension.TEXT_CLEANLINESS).score(), 1e-12);
        assertEquals(1.0, report.dimension(QualityDimension.CROSS_PAGE_CONSISTENCY).score(), 1e-12);
        assertEquals(1.0, report.dimension(QualityDimension.STRUCTURAL_RICHNESS).score(), 1e-12);
        assertTrue(report.overallScore() >= 0.85, "score was " + report.overallScore());
        assertEquals(Recommendation.EXCELLENT, report.recommendation());
    }

    @Test
    void twentyPercentCorruptionFloorsCleanliness() {
        String corrupted = "abcd\uFFFD".repeat(40);

        QualityReport report = scorer.score(List.of(corrupted));

        DimensionScore cleanliness = report.dimension(QualityDimension.TEXT_CLEANLINESS);
        assertEquals(0.0, cleanliness.score(), 1e-12);
        assertEquals(0.2, cleanliness.signals().get("bad_char_ratio"), 1e-12);
        assertEquals(1, cleanliness.issues().size());
    }

    @Test
    void controlCharactersLowerCleanlinessButLineBreaksDoNot() {
        String withBreaks = "plain words\r\nand\ttabs here ".repeat(10);
        String withControls = ("plain words\u0007and tabs here").repeat(10);

        double clean = scorer.score(List.of(withBreaks)).dimension(QualityDimension.TEXT_CLEANLINESS).score();
        double dirty = scorer.score(List.of(withControls)).dimension(QualityDimension.TEXT_CLEANLINESS).score();

        assertEquals(1.0, clean, 1e-12);
        assertTrue(dirty < 1.0);
    }

    @Test
    void gluedWordsLowerWordIntegrity() {
        String normal = "the registrar issues a licence after checking the application form ".repeat(5);
        String glued = "theregistrarissuesalicenceafterchecking applicationformandthepurchasereceipt ".repeat(5);

        double normalScore = scorer.score(List.of(normal)).dimension(QualityDimension.WORD_INTEGRITY).score();
        DimensionScore gluedScore = scorer.score(List.of(glued)).dimension(QualityDimension.WORD_INTEGRITY);

        assertEquals(1.0, normalScore, 1e-12);
        assertTrue(gluedScore.score() < 0.5);
        assertTrue(gluedScore.issues().stream().anyMatch(issue -> issue.contains("glued")));
    }

    @Test
    void unevenAndEmptyPagesLowerConsistency() {
        QualityReport report = scorer.score(List.of(SECTION, ""));

        DimensionScore consistency = report.dimension(QualityDimension.CROSS_PAGE_CONSISTENCY);
        assertEquals(0.0, consistency.score(), 1e-12);
        assertTrue(consistency.issues().contains("1 of 2 pages are empty"));
        assertEquals(0.5, consistency.signals().get("empty_page_ratio"), 1e-12);
    }

    @Test
    void densitySaturatesAboveFloors() {
        String dense = "registration of firearms requires proof of identity ".repeat(20);
        String thin = "short page";

        assertEquals(1.0, scorer.score(List.of(dense)).dimension(QualityDimension.CONTENT_DENSITY).score(), 1e-12);
        assertTrue(scorer.score(List.of(thin)).dimension(QualityDimension.CONTENT_DENSITY).score() < 0.1);
    }

    @Test
    void plainProseHasNoStructureSignal() {
        DimensionScore structure = scorer.score(List.of("just one sentence of running text without any layout"))
                .dimension(QualityDimension.STRUCTURAL_RICHNESS);

        assertEquals(0.0, structure.score());
        assertTrue(structure.issues().contains("no headers, lists or tables detected"));
    }

    @Test
    void customWeightsAreApplied() {
        QualityScorer cleanlinessOnly = new QualityScorer(new QualityWeights(1.0, 0.0, 0.0, 0.0, 0.0));

        QualityReport report = cleanlinessOnly.score(List.of("short page"));

        assertEquals(1.0, report.overallScore(), 1e-12);
    }

    @Test
    void weightsMustSumToOne() {
        assertThrows(IllegalArgumentException.class, () -> new QualityWeights(0.3, 0.3, 0.3, 0.3, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new QualityWeights(-0.1, 0.3, 0.3, 0.3, 0.2));
    }

    @Test
    void recommendationBands() {
        assertEquals(Recommendation.EXCELLENT, Recommendation.forScore(0.85));
        assertEquals(Recommendation.GOOD, Recommendation.forScore(0.70));
        assertEquals(Recommendation.FAIR, Recommendation.forScore(0.50));
        assertEquals(Recommendation.POOR, Recommendation.forScore(0.4999));
        assertEquals("good", Recommendation.GOOD.label());
    }
}
