package com.predictionmarket.matching;

import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.OrderType;

/**
 * Rewrites every order as an equivalent BUY.
 *
 * <ul>
 *   <li>BUY YES at P  -&gt; BUY YES at P</li>
 *   <li>BUY NO at P   -&gt; BUY NO at P</li>
 *   <li>SELL YES at P -&gt; BUY NO at 100 - P</li>
 *   <li>SELL NO at P  -&gt; BUY YES at 100 - P</li>
 * </ul>
 *
 * An order priced at the crossing extreme (BUY at 100, SELL at 0) is a market
 * order and skips the price check during matching.
 */
public final class OrderNormalizer {

    public static final int MIN_PRICE = 0;
    public static final int MAX_PRICE = 100;

    private OrderNormalizer() {
    }

    public static NormalizedOrder normalize(OrderRequest request) {
        boolean market = isMarketOrder(request.type(), request.price());
        if (request.type() == OrderType.SELL) {
            return new NormalizedOrder(request.side().complement(), MAX_PRICE - request.price(), market);
        }
        return new NormalizedOrder(request.side(), request.price(), market);
    }

    public static boolean isMarketOrder(OrderType type, int price) {
        return (type == OrderType.BUY && price == MAX_PRICE)
                || (type == OrderType.SELL && price == MIN_PRICE);
    }
}
