package com.predictionmarket.domain;

/**
 * The two complementary contracts of a binary market. A YES share and a NO
 * share together always settle for 100.
 */
public enum Side {
    YES,
    NO;

    public Side complement() {
        return this == YES ? NO : YES;
    }
}
