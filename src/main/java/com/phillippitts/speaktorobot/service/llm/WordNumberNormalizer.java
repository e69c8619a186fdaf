package com.phillippitts.speaktorobot.service.llm;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts simple English number phrases to integers: {@code "five"}, {@code "twenty one"},
 * {@code "twenty-one"}, {@code "minus ten"}, {@code "three hundred and sixty"}.
 *
 * <p>Only well-formed whole numbers below one million are recognized. Runs such as
 * {@code "three sixty"} or {@code "five five"} are not numbers and are rejected rather than summed.
 * Anything else (digits, mixed text, unknown words) is left for the validator to judge.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class WordNumberNormalizer {

    private static final Map<String, Integer> UNITS = Map.ofEntries(
            Map.entry("zero", 0), Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3),
            Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11),
            Map.entry("twelve", 12), Map.entry("thirteen", 13), Map.entry("fourteen", 14),
            Map.entry("fifteen", 15), Map.entry("sixteen", 16), Map.entry("seventeen", 17),
            Map.entry("eighteen", 18), Map.entry("nineteen", 19));

    private static final Map<String, Integer> TENS = Map.of(
            "twenty", 20, "thirty", 30, "forty", 40, "fifty", 50,
            "sixty", 60, "seventy", 70, "eighty", 80, "ninety", 90);

    private static final int MAX_EXCLUSIVE = 1_000_000;

    private WordNumberNormalizer() {
    }

    /**
     * @param text candidate phrase (nullable)
     * @return the number, or empty if the phrase is not a recognizable number phrase
     */
    public static Optional<Integer> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String[] words = text.trim().toLowerCase(Locale.ROOT).split("[\\s\\-]+");
        int i = 0;
        int sign = 1;
        if (words[0].equals("minus") || words[0].equals("negative")) {
            sign = -1;
            i++;
        }
        if (i >= words.length) {
            return Optional.empty();
        }

        int total = 0;
        int current = 0;
        boolean sawThousand = false;
        boolean pendingAnd = false;
        Phase phase = Phase.START;
        for (; i < words.length; i++) {
            String w = words[i];
            if (phase == Phase.ZERO) {
                return Optional.empty(); // "zero" only stands alone
            }
            if (w.equals("and")) {
                boolean afterMultiplier = phase == Phase.HUNDRED || (phase == Phase.START && sawThousand);
                if (pendingAnd || !afterMultiplier) {
                    return Optional.empty();
                }
                pendingAnd = true;
                continue;
            }
            if (w.equals("a")) {
                if (phase != Phase.START || sawThousand) {
                    return Optional.empty();
                }
                current = 1; // "a hundred", "a thousand"
                phase = Phase.ARTICLE;
                continue;
            }
            Integer unit = UNITS.get(w);
            Integer ten = TENS.get(w);
            if (unit != null) {
                if (unit == 0) {
                    if (phase != Phase.START || sawThousand) {
                        return Optional.empty();
                    }
                    phase = Phase.ZERO;
                } else if (phase == Phase.START || phase == Phase.HUNDRED) {
                    current += unit;
                    phase = unit < 10 && phase == Phase.START ? Phase.DIGIT : Phase.CLOSED;
                } else if (phase == Phase.TENS && unit < 10) {
                    current += unit;
                    phase = Phase.CLOSED;
                } else {
                    return Optional.empty();
                }
                pendingAnd = false;
            } else if (ten != null) {
                if (phase != Phase.START && phase != Phase.HUNDRED) {
                    return Optional.empty();
                }
                current += ten;
                phase = Phase.TENS;
                pendingAnd = false;
            } else if (w.equals("hundred")) {
                if (pendingAnd || (phase != Phase.DIGIT && phase != Phase.ARTICLE)) {
                    return Optional.empty();
                }
                current *= 100;
                phase = Phase.HUNDRED;
            } else if (w.equals("thousand")) {
                if (pendingAnd || sawThousand || current == 0 || phase == Phase.START) {
                    return Optional.empty();
                }
                total = current * 1000;
                current = 0;
                sawThousand = true;
                phase = Phase.START;
            } else {
                return Optional.empty();
            }
            if (total + current >= MAX_EXCLUSIVE) {
                return Optional.empty();
            }
        }
        if (pendingAnd || phase == Phase.ARTICLE || (phase == Phase.START && !sawThousand)) {
            return Optional.empty();
        }
        return Optional.of(sign * (total + current));
    }

    /** Position within the current group of up to three digits. */
    private enum Phase {
        /** Nothing yet in this group. */
        START,
        /** "a", which must be followed by a multiplier. */
        ARTICLE,
        /** A single unit 1-9 that may still take "hundred". */
        DIGIT,
        /** After "hundred"; a tens word or unit may follow. */
        HUNDRED,
        /** After a tens word; only a unit 1-9 may follow. */
        TENS,
        /** Group finished apart from "thousand". */
        CLOSED,
        ZERO
    }

    /**
     * Returns the number for a word-number string, otherwise the value unchanged.
     */
    public static Object normalize(Object value) {
        if (value instanceof String s) {
            Optional<Integer> parsed = parse(s);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return value;
    }
}
