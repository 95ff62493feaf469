package com.predictionmarket.engine;

import com.predictionmarket.domain.BookEntry;
import com.predictionmarket.domain.MarketSnapshot;
import com.predictionmarket.domain.MatchResultSet;
import com.predictionmarket.domain.Order;
import com.predictionmarket.domain.OrderBook;
import com.predictionmarket.domain.OrderPlacement;
import com.predictionmarket.domain.OrderQueue;
import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.OrderStatus;
import com.predictionmarket.domain.Side;
import com.predictionmarket.domain.Trade;
import com.predictionmarket.ledger.TradeLedger;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.matching.MatchingAlgorithm;
import com.predictionmarket.matching.NormalizedOrder;
import com.predictionmarket.matching.OrderNormalizer;
import com.predictionmarket.matching.PriceTimePriorityMatcher;
import com.predictionmarket.metrics.MetricsRegistry;
import com.predictionmarket.view.MarketViewReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * The matching engine for the single YES/NO market.
 *
 * All mutable state (both canonical queues, the order index, the trade ledger
 * and the order id counter) sits behind one lock. Every public operation holds
 * the lock for its full duration, so a snapshot never observes a half-finished
 * matching pass. Logging happens only after the lock is released.
 *
 * Input is assumed valid: price in [0, 100], quantity at least 1.
 */
public class MatchingEngine {

    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final MetricsRegistry metrics;
    private final MatchingStats stats;
    private final LongSupplier clock;
    private final boolean detailedLogging;
    private final MarketViewReconstructor viewReconstructor = new MarketViewReconstructor();

    // guarded by lock
    private OrderBook book;
    private TradeLedger ledger;
    private MatchingAlgorithm matcher;
    private long nextOrderId;

    public MatchingEngine(MetricsRegistry metrics, MatchingStats stats, boolean detailedLogging) {
        this(metrics, stats, System::currentTimeMillis, detailedLogging);
    }

    public MatchingEngine(MetricsRegistry metrics, MatchingStats stats, LongSupplier clock,
                          boolean detailedLogging) {
        this.metrics = metrics;
        this.stats = stats;
        this.clock = clock;
        this.detailedLogging = detailedLogging;
        initState();
    }

    /**
     * Normalize, match and rest one order.
     */
    public OrderPlacement place(OrderRequest request) {
        long start = System.nanoTime();
        NormalizedOrder normalized = OrderNormalizer.normalize(request);
        OrderPlacement placement;
        lock.lock();
        try {
            long orderId = nextOrderId++;

            Order order = new Order(
                    orderId,
                    request.accountId(),
                    request.side(),
                    request.type(),
                    request.price(),
                    normalized.canonicalSide(),
                    normalized.canonicalPrice(),
                    normalized.market(),
                    request.quantity(),
                    clock.getAsLong()
            );

            MatchResultSet resultSet = matcher.match(book, order);

            OrderStatus status;
            if (resultSet.isIncomingFullyFilled()) {
                status = OrderStatus.FILLED;
            } else {
                book.rest(order);
                status = resultSet.hasTrades() ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            }

            recordStats(request, resultSet);

            placement = new OrderPlacement(orderId, status, order.getFilledQuantity(),
                    order.getRemainingQuantity(), resultSet.getTrades());
        } finally {
            lock.unlock();
            metrics.placeDuration.observe((System.nanoTime() - start) / 1_000_000_000.0);
        }

        logPlacement(request, normalized, placement);
        return placement;
    }

    public MarketSnapshot snapshot() {
        return snapshot(MarketViewReconstructor.DEFAULT_DEPTH);
    }

    public MarketSnapshot snapshot(int depth) {
        lock.lock();
        try {
            return viewReconstructor.snapshot(book, depth);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The last {@code limit} trades, most recent first.
     */
    public List<Trade> recentTrades(int limit) {
        lock.lock();
        try {
            return ledger.recent(limit);
        } finally {
            lock.unlock();
        }
    }

    public Optional<BookEntry> lookup(long orderId) {
        lock.lock();
        try {
            return book.lookup(orderId).map(Order::toBookEntry);
        } finally {
            lock.unlock();
        }
    }

    public int restingOrderCount(Side canonicalSide) {
        lock.lock();
        try {
            return book.queueFor(canonicalSide).size();
        } finally {
            lock.unlock();
        }
    }

    public long restingQuantity(Side canonicalSide) {
        lock.lock();
        try {
            return book.queueFor(canonicalSide).totalQuantity();
        } finally {
            lock.unlock();
        }
    }

    public int tradeCount() {
        lock.lock();
        try {
            return ledger.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard every order and trade and start again from ids 1.
     */
    public void reset() {
        lock.lock();
        try {
            initState();
            updateBookGauges();
        } finally {
            lock.unlock();
        }
        logger.info("Engine reset", keyValue("event", "ENGINE_RESET"));
    }

    private void initState() {
        this.book = new OrderBook();
        this.ledger = new TradeLedger();
        this.matcher = new PriceTimePriorityMatcher(ledger, clock);
        this.nextOrderId = 1;
    }

    private void recordStats(OrderRequest request, MatchResultSet resultSet) {
        metrics.ordersReceivedTotal.labelValues(request.side().name().toLowerCase(),
                request.type().name().toLowerCase()).inc();
        if (request.side() == Side.YES) {
            stats.yesOrdersReceived.incrementAndGet();
        } else {
            stats.noOrdersReceived.incrementAndGet();
        }

        if (resultSet.hasTrades()) {
            metrics.tradesTotal.inc(resultSet.getTradeCount());
            metrics.tradedQuantityTotal.inc(resultSet.getTotalFilledQuantity());
            stats.tradesExecuted.addAndGet(resultSet.getTradeCount());
            stats.sharesTraded.addAndGet(resultSet.getTotalFilledQuantity());
        }
        updateBookGauges();
    }

    // Called after the lock is released; only immutable values are read.
    private void logPlacement(OrderRequest request, NormalizedOrder normalized, OrderPlacement placement) {
        if (detailedLogging) {
            for (Trade trade : placement.getTrades()) {
                logger.info("Trade executed",
                        keyValue("event", "TRADE_EXECUTED"),
                        keyValue("tradeId", trade.getTradeId()),
                        keyValue("makerOrderId", trade.getMakerOrderId()),
                        keyValue("takerOrderId", trade.getTakerOrderId()),
                        keyValue("price", trade.getPrice()),
                        keyValue("quantity", trade.getQuantity()),
                        keyValue("side", trade.getSide()));
            }
        }
        logger.debug("Order {} {} {}@{} x{} for {} -> canonical {}@{}, {}",
                placement.getOrderId(), request.type(), request.side(), request.price(),
                request.quantity(), request.accountId(), normalized.canonicalSide(),
                normalized.canonicalPrice(), placement.getStatus());
    }

    private void updateBookGauges() {
        for (OrderQueue queue : List.of(book.getYesQueue(), book.getNoQueue())) {
            metrics.restingOrders.labelValues(queue.getSide().name().toLowerCase()).set(queue.size());
        }
    }
}
