package com.claude.patternlearning.detector;

/**
 * Conversions out of a sample.
 */
final class Tally {

    private int conversions;
    private int total;

    void add(boolean converted) {
        total++;
        if (converted) {
            conversions++;
        }
    }

    int getConversions() {
        return conversions;
    }

    int getTotal() {
        return total;
    }

    double rate() {
        return ConversionStats.rate(conversions, total);
    }
}
