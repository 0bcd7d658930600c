package com.tennis.edge.signal;

/**
 * Head-to-head record between side A and side B.
 */
public record H2HRecord(int winsA, int winsB) {

    public static final H2HRecord EMPTY = new H2HRecord(0, 0);

    public int meetings() {
        return winsA + winsB;
    }

    public int winsFor(Side side) {
        return side == Side.A ? winsA : winsB;
    }

    public int lossesFor(Side side) {
        return side == Side.A ? winsB : winsA;
    }

    public boolean isEmpty() {
        return meetings() == 0;
    }
}
