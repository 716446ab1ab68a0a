package com.phillippitts.voxbank.service.tokenize;

import java.util.ArrayList;
import java.util.List;

/**
 * Spells out non-negative integers below one million as English words.
 */
final class NumberWords {

    static final long MAX_SPELLABLE = 999_999L;

    private static final String[] ONES = {
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
            "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen",
            "seventeen", "eighteen", "nineteen"
    };

    private static final String[] TENS = {
            "", "", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety"
    };

    private NumberWords() {
        // Prevent instantiation
    }

    /**
     * @param value number in [0, 999999]
     * @return words in speaking order, e.g. 1204 to [one, thousand, two, hundred, four]
     */
    static List<String> spell(long value) {
        if (value < 0 || value > MAX_SPELLABLE) {
            throw new IllegalArgumentException("Cannot spell " + value);
        }
        List<String> words = new ArrayList<>();
        if (value == 0) {
            words.add(ONES[0]);
            return words;
        }
        int thousands = (int) (value / 1000);
        int rest = (int) (value % 1000);
        if (thousands > 0) {
            appendBelowThousand(thousands, words);
            words.add("thousand");
        }
        if (rest > 0) {
            appendBelowThousand(rest, words);
        }
        return words;
    }

    private static void appendBelowThousand(int value, List<String> words) {
        int hundreds = value / 100;
        int rest = value % 100;
        if (hundreds > 0) {
            words.add(ONES[hundreds]);
            words.add("hundred");
        }
        if (rest >= 20) {
            words.add(TENS[rest / 10]);
            if (rest % 10 > 0) {
                words.add(ONES[rest % 10]);
            }
        } else if (rest > 0) {
            words.add(ONES[rest]);
        }
    }
}
