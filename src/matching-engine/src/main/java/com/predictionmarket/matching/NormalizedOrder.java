package com.predictionmarket.matching;

import com.predictionmarket.domain.Side;

/**
 * Canonical BUY equivalent of a submitted order.
 */
public record NormalizedOrder(Side canonicalSide, int canonicalPrice, boolean market) {}
