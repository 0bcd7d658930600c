package com.tennis.edge.signal;

/**
 * One of the two competitors in a match.
 */
public enum Side {

    A,
    B;

    public Side opponent() {
        return this == A ? B : A;
    }
}
