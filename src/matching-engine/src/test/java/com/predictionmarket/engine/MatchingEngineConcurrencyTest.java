package com.predictionmarket.engine;

import com.predictionmarket.domain.MarketSnapshot;
import com.predictionmarket.domain.OrderPlacement;
import com.predictionmarket.domain.OrderRequest;
import com.predictionmarket.domain.OrderType;
import com.predictionmarket.domain.Side;
import com.predictionmarket.domain.Trade;
import com.predictionmarket.logging.MatchingStats;
import com.predictionmarket.metrics.MetricsRegistry;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ORDERS_PER_THREAD = 500;

    @Test
    void concurrentPlacementKeepsIdsUniqueAndQuantityConserved() throws Exception {
        MatchingEngine engine = new MatchingEngine(
                new MetricsRegistry(new PrometheusRegistry()), new MatchingStats(), false);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS + 1);

        List<Future<List<OrderPlacement>>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int seed = t;
            Callable<List<OrderPlacement>> task = () -> {
                Random random = new Random(seed);
                List<OrderPlacement> placements = new ArrayList<>();
                for (int i = 0; i < ORDERS_PER_THREAD; i++) {
                    OrderRequest request = new OrderRequest(
                            random.nextBoolean() ? Side.YES : Side.NO,
                            random.nextBoolean() ? OrderType.BUY : OrderType.SELL,
                            random.nextInt(101),
                            1 + random.nextInt(10),
                            "acct-" + random.nextInt(6));
                    placements.add(engine.place(request));
                }
                return placements;
            };
            futures.add(pool.submit(task));
        }

        // Concurrent readers must always see a consistent view
        Future<Integer> reader = pool.submit(() -> {
            int reads = 0;
            while (!futures.stream().allMatch(Future::isDone)) {
                MarketSnapshot snapshot = engine.snapshot();
                assertTrue(snapshot.yesBids().size() <= 10);
                assertTrue(snapshot.noBids().size() <= 10);
                engine.recentTrades(20);
                reads++;
            }
            return reads;
        });

        Set<Long> orderIds = new HashSet<>();
        long submitted = 0;
        long traded = 0;
        int tradeCount = 0;
        for (Future<List<OrderPlacement>> future : futures) {
            for (OrderPlacement placement : future.get(60, TimeUnit.SECONDS)) {
                assertTrue(orderIds.add(placement.getOrderId()), "duplicate order id");
                submitted += placement.getFilledQuantity() + placement.getRemainingQuantity();
                traded += placement.getFilledQuantity();
                tradeCount += placement.getTrades().size();
            }
        }
        reader.get(60, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(THREADS * ORDERS_PER_THREAD, orderIds.size());
        assertEquals(tradeCount, engine.tradeCount());

        List<Trade> all = engine.recentTrades(tradeCount);
        Set<Long> tradeIds = new HashSet<>();
        for (Trade trade : all) {
            assertTrue(tradeIds.add(trade.getTradeId()), "duplicate trade id");
        }

        long resting = engine.restingQuantity(Side.YES) + engine.restingQuantity(Side.NO);
        assertEquals(submitted, resting + 2 * traded);
    }
}
