package com.kreasipositif.baiprocessor.matching;

/**
 * Points earned by one invoice against one transaction.
 *
 * @param amountPoints 50 for an exact amount, 30 within 1%, otherwise 0
 * @param namePoints   0–50 from memo / customer-name similarity
 */
public record MatchScore(int amountPoints, int namePoints) {

    public int total() {
        return amountPoints + namePoints;
    }
}
