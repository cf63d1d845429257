package com.lookup.matching.normalization;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes strings so that case, accent and spacing noise compare equal.
 * Steps run in a fixed order: lowercase, accent stripping, non-alphanumeric
 * replacement, whitespace collapsing and trimming.
 */
public class StringNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9\\s]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern EDGES = Pattern.compile("^(\\s*)(.*?)(\\s*)$", Pattern.DOTALL);

    private final NormalizationOptions options;

    public StringNormalizer() {
        this(NormalizationOptions.defaults());
    }

    public StringNormalizer(NormalizationOptions options) {
        this.options = options;
    }

    /**
     * Normalizes with this normalizer's options. {@code null} becomes the empty string.
     */
    public String normalize(String input) {
        return normalize(input, options);
    }

    public NormalizationOptions getOptions() {
        return options;
    }

    /**
     * Normalizes the given string with explicit options.
     */
    public static String normalize(String input, NormalizationOptions options) {
        if (input == null) {
            return "";
        }

        String result = input;

        if (options.isLowercase()) {
            result = result.toLowerCase(Locale.ROOT);
        }

        if (options.isRemoveAccents()) {
            result = COMBINING_MARKS.matcher(Normalizer.normalize(result, Normalizer.Form.NFD)).replaceAll("");
        }

        // Replaced by a space rather than removed so word boundaries survive
        if (options.isRemoveNonAlphanumeric()) {
            result = NON_ALPHANUMERIC.matcher(result).replaceAll(" ");
        }

        if (options.isCollapseWhitespace()) {
            if (options.isTrim()) {
                result = WHITESPACE_RUN.matcher(result).replaceAll(" ").trim();
            } else {
                Matcher edges = EDGES.matcher(result);
                if (edges.matches()) {
                    result = edges.group(1)
                            + WHITESPACE_RUN.matcher(edges.group(2)).replaceAll(" ")
                            + edges.group(3);
                }
            }
        } else if (options.isTrim()) {
            result = result.trim();
        }

        return result;
    }
}
