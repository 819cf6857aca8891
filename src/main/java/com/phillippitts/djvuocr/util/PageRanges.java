package com.phillippitts.djvuocr.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses page selections such as {@code "17,37-42"} into 1-based page numbers.
 *
 * <p>Each comma-separated element is either a single number or an inclusive range
 * {@code first-last}. Ranges expand in ascending order; an inverted range such as
 * {@code "42-37"} contributes no pages. Page numbers above {@value #MAX_PAGE_NUMBER} are
 * rejected before any range is expanded.
 *
 * @since 1.0
 */
public final class PageRanges {

    /** Upper bound for a page number in a selection. */
    public static final int MAX_PAGE_NUMBER = 1_000_000;

    private PageRanges() {
        // Utility class - prevent instantiation
    }

    /**
     * Expands a page selection.
     *
     * @param spec page selection, or {@code null} for "all pages"
     * @return page numbers in selection order, or {@code null} if {@code spec} is null
     * @throws IllegalArgumentException if an element is not a number or a range, or a page
     *         number exceeds {@link #MAX_PAGE_NUMBER}
     */
    public static List<Integer> parse(String spec) {
        if (spec == null) {
            return null;
        }
        List<Integer> result = new ArrayList<>();
        for (String element : spec.split(",", -1)) {
            String trimmed = element.strip();
            int dash = trimmed.indexOf('-');
            if (dash >= 0) {
                int first = parseNumber(trimmed.substring(0, dash), spec);
                int last = parseNumber(trimmed.substring(dash + 1), spec);
                for (int page = first; page <= last; page++) {
                    result.add(page);
                }
            } else {
                result.add(parseNumber(trimmed, spec));
            }
        }
        return List.copyOf(result);
    }

    private static int parseNumber(String s, String spec) {
        int number;
        try {
            number = Integer.parseInt(s.strip(), 10);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unable to parse page numbers: '" + spec + "'", e);
        }
        if (number > MAX_PAGE_NUMBER) {
            throw new IllegalArgumentException("Page number " + number + " out of range in '" + spec + "'");
        }
        return number;
    }
}
