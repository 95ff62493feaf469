package com.predictionmarket.matching;

import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.OrderType;
import com.predictionmarket.domain.Side;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderNormalizerTest {

    private static NormalizedOrder normalize(Side side, OrderType type, int price) {
        return OrderNormalizer.normalize(new OrderRequest(side, type, price, 1, "acct"));
    }

    @Test
    void buyOrdersKeepSideAndPrice() {
        assertEquals(new NormalizedOrder(Side.YES, 60, false), normalize(Side.YES, OrderType.BUY, 60));
        assertEquals(new NormalizedOrder(Side.NO, 35, false), normalize(Side.NO, OrderType.BUY, 35));
    }

    @Test
    void sellOrdersBecomeComplementaryBuys() {
        assertEquals(new NormalizedOrder(Side.NO, 50, false), normalize(Side.YES, OrderType.SELL, 50));
        assertEquals(new NormalizedOrder(Side.NO, 30, false), normalize(Side.YES, OrderType.SELL, 70));
        assertEquals(new NormalizedOrder(Side.YES, 65, false), normalize(Side.NO, OrderType.SELL, 35));
    }

    @Test
    void complementaryPricingHoldsAcrossTheWholeRange() {
        for (int p = 0; p <= 100; p++) {
            NormalizedOrder sellYes = normalize(Side.YES, OrderType.SELL, p);
            NormalizedOrder sellNo = normalize(Side.NO, OrderType.SELL, 100 - p);
            assertEquals(Side.NO, sellYes.canonicalSide());
            assertEquals(100 - p, sellYes.canonicalPrice());
            // SELL NO at (100 - P) lands on the other contract at P
            assertEquals(Side.YES, sellNo.canonicalSide());
            assertEquals(p, sellNo.canonicalPrice());
        }
    }

    @Test
    void marketOrdersArePricedAtTheCrossingExtreme() {
        assertTrue(normalize(Side.YES, OrderType.BUY, 100).market());
        assertTrue(normalize(Side.NO, OrderType.BUY, 100).market());
        assertTrue(normalize(Side.YES, OrderType.SELL, 0).market());
        assertTrue(normalize(Side.NO, OrderType.SELL, 0).market());

        assertFalse(normalize(Side.YES, OrderType.BUY, 0).market());
        assertFalse(normalize(Side.YES, OrderType.SELL, 100).market());
        assertFalse(normalize(Side.NO, OrderType.BUY, 99).market());
    }

    @Test
    void marketSellRestsAtCanonicalOneHundred() {
        NormalizedOrder normalized = normalize(Side.NO, OrderType.SELL, 0);
        assertEquals(Side.YES, normalized.canonicalSide());
        assertEquals(100, normalized.canonicalPrice());
    }
}
