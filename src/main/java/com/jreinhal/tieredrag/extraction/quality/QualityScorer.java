package com.jreinhal.tieredrag.extraction.quality;

import com.jreinhal.tieredrag.util.HeadingDetector;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores extracted page texts without ground truth.
 *
 * <p>Pure: no I/O, clock or randomness, so equal input always yields an equal report.
 * Degenerate input (no pages, no text) scores 0.0 and carries an issue entry instead of
 * failing.</p>
 */
public class QualityScorer {
    /** bad-character ratio multiplier; 20% corruption floors cleanliness at 0 */
    static final double CORRUPTION_FACTOR = 5.0;
    static final double MIN_AVG_WORD_LENGTH = 3.0;
    static final double MAX_AVG_WORD_LENGTH = 8.0;
    static final int GLUED_WORD_LENGTH = 25;
    static final double DENSITY_CHAR_FLOOR = 500.0;
    static final double DENSITY_WORD_FLOOR = 80.0;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\p{Pi}\\p{Pf}]+|[\\p{Punct}\\p{Pi}\\p{Pf}]+$");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*([-*+\\u2022\\u25E6]|\\d{1,3}[.)]|[a-z][.)])\\s+\\S.*");
    private static final Pattern WIDE_COLUMNS = Pattern.compile("\\S(\\s{3,}|\\t)\\S.*(\\s{3,}|\\t)\\S");

    private final QualityWeights weights;

    public QualityScorer(QualityWeights weights) {
        this.weights = weights == null ? QualityWeights.DEFAULT : weights;
    }

    public QualityScorer() {
        this(QualityWeights.DEFAULT);
    }

    public QualityWeights getWeights() {
        return weights;
    }

    public QualityReport score(List<String> pages) {
        List<String> safePages = new ArrayList<>();
        if (pages != null) {
            for (String page : pages) {
                safePages.add(page == null ? "" : page);
            }
        }
        String allText = String.join("\n", safePages);
        if (safePages.isEmpty() || allText.isBlank()) {
            return emptyReport(safePages.isEmpty() ? "no pages extracted" : "no text extracted");
        }

        List<String> words = words(allText);
        Map<QualityDimension, DimensionScore> dimensions = new EnumMap<>(QualityDimension.class);
        dimensions.put(QualityDimension.TEXT_CLEANLINESS, cleanliness(allText));
        dimensions.put(QualityDimension.WORD_INTEGRITY, wordIntegrity(words));
        dimensions.put(QualityDimension.CROSS_PAGE_CONSISTENCY, consistency(safePages));
        dimensions.put(QualityDimension.STRUCTURAL_RICHNESS, structure(allText));
        dimensions.put(QualityDimension.CONTENT_DENSITY, density(safePages, allText, words.size()));

        double overall = 0.0;
        for (DimensionScore dimension : dimensions.values()) {
            overall += dimension.weighted();
        }
        overall = clamp(overall);
        return new QualityReport(overall, dimensions, Recommendation.forScore(overall));
    }

    private DimensionScore cleanliness(String text) {
        int total = text.length();
        int bad = 0;
        for (int i = 0; i < total; i++) {
            if (isBadChar(text.charAt(i))) {
                bad++;
            }
        }
        double ratio = (double) bad / total;
        double score = 1.0 - Math.min(1.0, ratio * CORRUPTION_FACTOR);
        List<String> issues = new ArrayList<>();
        if (ratio > 0.01) {
            issues.add(String.format(Locale.ROOT, "%.1f%% of characters are control or replacement characters", ratio * 100.0));
        }
        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put("bad_char_count", (double) bad);
        signals.put("total_char_count", (double) total);
        signals.put("bad_char_ratio", ratio);
        return dimension(QualityDimension.TEXT_CLEANLINESS, score, signals, issues);
    }

    private static boolean isBadChar(char c) {
        if (c == '\n' || c == '\r' || c == '\t') {
            return false;
        }
        if (c == '\uFFFD') {
            return true;
        }
        int type = Character.getType(c);
        return type == Character.CONTROL || type == Character.UNASSIGNED || type == Character.PRIVATE_USE;
    }

    private DimensionScore wordIntegrity(List<String> words) {
        Map<String, Double> signals = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        if (words.isEmpty()) {
            signals.put("word_count", 0.0);
            issues.add("no words found");
            return dimension(QualityDimension.WORD_INTEGRITY, 0.0, signals, issues);
        }
        long totalLength = 0;
        int longWords = 0;
        for (String word : words) {
            totalLength += word.length();
            if (word.length() > GLUED_WORD_LENGTH) {
                longWords++;
            }
        }
        double avgLength = (double) totalLength / words.size();
        double deviation = 0.0;
        if (avgLength < MIN_AVG_WORD_LENGTH) {
            deviation = (MIN_AVG_WORD_LENGTH - avgLength) / MIN_AVG_WORD_LENGTH;
        } else if (avgLength > MAX_AVG_WORD_LENGTH) {
            deviation = (avgLength - MAX_AVG_WORD_LENGTH) / MAX_AVG_WORD_LENGTH;
        }
        double longRatio = (double) longWords / words.size();
        double lengthScore = 1.0 - Math.min(1.0, deviation);
        double longWordScore = 1.0 - Math.min(1.0, longRatio * 10.0);
        double score = 0.5 * lengthScore + 0.5 * longWordScore;
        if (deviation > 0.0) {
            issues.add(String.format(Locale.ROOT, "abnormal average word length %.1f", avgLength));
        }
        if (longRatio > 0.02) {
            issues.add(String.format(Locale.ROOT, "%.1f%% of words look glued together", longRatio * 100.0));
        }
        signals.put("word_count", (double) words.size());
        signals.put("avg_word_length", avgLength);
        signals.put("long_word_ratio", longRatio);
        return dimension(QualityDimension.WORD_INTEGRITY, score, signals, issues);
    }

    private DimensionScore consistency(List<String> pages) {
        int n = pages.size();
        double[] lengths = new double[n];
        int empty = 0;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            lengths[i] = pages.get(i).trim().length();
            sum += lengths[i];
            if (lengths[i] == 0.0) {
                empty++;
            }
        }
        double mean = sum / n;
        double variance = 0.0;
        for (double length : lengths) {
            variance += (length - mean) * (length - mean);
        }
        variance /= n;
        double cv = mean > 0.0 ? Math.sqrt(variance) / mean : 1.0;
        double emptyRatio = (double) empty / n;
        double score = clamp(1.0 - cv) * (1.0 - emptyRatio);
        List<String> issues = new ArrayList<>();
        if (cv > 1.0) {
            issues.add(String.format(Locale.ROOT, "page lengths vary widely (cv=%.2f)", cv));
        }
        if (empty > 0) {
            issues.add(empty + " of " + n + " pages are empty");
        }
        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put("page_count", (double) n);
        signals.put("mean_page_length", mean);
        signals.put("coefficient_of_variation", cv);
        signals.put("empty_page_ratio", emptyRatio);
        return dimension(QualityDimension.CROSS_PAGE_CONSISTENCY, score, signals, issues);
    }

    private DimensionScore structure(String text) {
        int lines = 0;
        int headers = 0;
        int listItems = 0;
        int tableRows = 0;
        for (String raw : text.split("\n")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            lines++;
            if (HeadingDetector.isHeading(line)) {
                headers++;
            } else if (LIST_ITEM.matcher(raw).matches()) {
                listItems++;
            } else if (isTableRow(raw)) {
                tableRows++;
            }
        }
        double headerRatio = (double) headers / lines;
        double listRatio = (double) listItems / lines;
        double tableRatio = (double) tableRows / lines;
        double score = 0.4 * Math.min(1.0, headerRatio / 0.05)
                + 0.3 * Math.min(1.0, listRatio / 0.10)
                + 0.3 * Math.min(1.0, tableRatio / 0.10);
        List<String> issues = new ArrayList<>();
        if (headers == 0 && listItems == 0 && tableRows == 0) {
            issues.add("no headers, lists or tables detected");
        }
        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put("line_count", (double) lines);
        signals.put("header_ratio", headerRatio);
        signals.put("list_ratio", listRatio);
        signals.put("table_ratio", tableRatio);
        return dimension(QualityDimension.STRUCTURAL_RICHNESS, score, signals, issues);
    }

    private static boolean isTableRow(String line) {
        int pipes = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '|') {
                pipes++;
            }
        }
        return pipes >= 2 || WIDE_COLUMNS.matcher(line).find();
    }

    private DimensionScore density(List<String> pages, String allText, int wordCount) {
        int n = pages.size();
        int chars = 0;
        for (String page : pages) {
            chars += page.trim().length();
        }
        double charsPerPage = (double) chars / n;
        double wordsPerPage = (double) wordCount / n;
        double score = 0.5 * Math.min(1.0, charsPerPage / DENSITY_CHAR_FLOOR)
                + 0.5 * Math.min(1.0, wordsPerPage / DENSITY_WORD_FLOOR);
        List<String> issues = new ArrayList<>();
        if (charsPerPage < DENSITY_CHAR_FLOOR) {
            issues.add(String.format(Locale.ROOT, "sparse pages (%.0f chars per page)", charsPerPage));
        }
        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put("chars_per_page", charsPerPage);
        signals.put("words_per_page", wordsPerPage);
        signals.put("total_chars", (double) allText.length());
        return dimension(QualityDimension.CONTENT_DENSITY, score, signals, issues);
    }

    private QualityReport emptyReport(String issue) {
        Map<QualityDimension, DimensionScore> dimensions = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            List<String> issues = dimension == QualityDimension.CONTENT_DENSITY ? List.of(issue) : List.of();
            dimensions.put(dimension, dimension(dimension, 0.0, Map.of(), issues));
        }
        return new QualityReport(0.0, dimensions, Recommendation.POOR);
    }

    private DimensionScore dimension(QualityDimension dimension, double score, Map<String, Double> signals,
                                     List<String> issues) {
        return new DimensionScore(clamp(score), weights.weightOf(dimension), signals, issues);
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String token : WHITESPACE.split(text.strip())) {
            String word = EDGE_PUNCTUATION.matcher(token).replaceAll("");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
