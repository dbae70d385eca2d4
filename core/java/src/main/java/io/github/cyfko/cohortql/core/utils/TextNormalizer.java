package io.github.cyfko.cohortql.core.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization of search terms shared by indexing and lookup.
 * <p>
 * Both sides of a match go through the same {@link #clean(String)} so that an indexed term and a
 * query term compare equal exactly when they differ only in case, punctuation or spacing.
 * </p>
 *
 * <pre>{@code
 * TextNormalizer.clean("  Tumor-Site!  ")     // "tumorsite"
 * TextNormalizer.clean("Age  at   diagnosis") // "age at diagnosis"
 * TextNormalizer.tokenize("age at diagnosis", 3) // ["age", "diagnosis"]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TextNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
        // utility class
    }

    /**
     * Lower-cases, strips, removes every character other than {@code [a-z0-9]} and whitespace,
     * then collapses whitespace runs into one space.
     *
     * @param term raw term, may be {@code null}
     * @return the cleaned term, empty for {@code null} or blank input
     */
    public static String clean(String term) {
        if (term == null) return "";
        String cleaned = term.toLowerCase(Locale.ROOT).strip();
        cleaned = NON_ALPHANUMERIC.matcher(cleaned).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    }

    /**
     * Lower-cases and strips a term without removing any character. Used for catalog searchable
     * terms, which keep their punctuation for fuzzy comparison.
     *
     * @param term raw term, may be {@code null}
     * @return the lower-cased, stripped term, empty for {@code null}
     */
    public static String lowerStrip(String term) {
        return term == null ? "" : term.toLowerCase(Locale.ROOT).strip();
    }

    /**
     * Splits an already cleaned term on whitespace and keeps the tokens of at least {@code minLength}
     * characters, in order. Duplicate tokens are kept.
     *
     * @param cleaned   a term produced by {@link #clean(String)}
     * @param minLength minimum token length
     * @return the tokens, possibly empty
     */
    public static List<String> tokenize(String cleaned, int minLength) {
        if (cleaned == null || cleaned.isBlank()) return Collections.emptyList();
        List<String> tokens = new ArrayList<>();
        for (String word : WHITESPACE.split(cleaned.strip())) {
            if (word.length() >= minLength) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    /**
     * Turns a snake_case field path into a title, using its last segment:
     * {@code "tumor_assessments.tumor_site"} gives {@code "Tumor Site"}.
     *
     * @param fieldPath a catalog field path
     * @return the title
     */
    public static String toTitle(String fieldPath) {
        String name = fieldPath.substring(fieldPath.lastIndexOf('.') + 1).replace('_', ' ');
        StringBuilder title = new StringBuilder(name.length());
        boolean startOfWord = true;
        for (char c : name.toCharArray()) {
            if (Character.isLetter(c)) {
                title.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                title.append(c);
                startOfWord = true;
            }
        }
        return title.toString();
    }
}
