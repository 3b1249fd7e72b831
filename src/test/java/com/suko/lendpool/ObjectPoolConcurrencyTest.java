package com.suko.lendpool;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking, timeout and priority behaviour of ObjectPool under real threads.
 */
public class ObjectPoolConcurrencyTest {

    private static final int CONCURRENCY_LEVEL = 10;
    private static final int OPERATIONS_PER_THREAD = 1000;

    private ExecutorService executor;
    private AtomicInteger createdCount;

    @Before
    public void setUp() {
        executor = Executors.newCachedThreadPool();
        createdCount = new AtomicInteger(0);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    private ObjectPool<TestObject> newPool(int capacity, int prefill) {
        return new ObjectPool<>(capacity, prefill, () -> {
            createdCount.incrementAndGet();
            return new TestObject();
        });
    }

    private static void awaitWaiters(ObjectPool<?> pool, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pool.waitingCount() < expected) {
            if (System.nanoTime() > deadline) {
                Assert.fail("Expected " + expected + " waiters but saw " + pool.waitingCount());
            }
            Thread.sleep(5);
        }
    }

    @Test
    public void testBlockedAcquireIsServedByRelease() throws Exception {
        ObjectPool<TestObject> pool = newPool(2, 2);
        Pooled<TestObject> first = pool.acquire();
        Pooled<TestObject> second = pool.acquire();
        Assert.assertEquals(0, pool.available());

        Future<TestObject> blocked = executor.submit(() -> {
            try (Pooled<TestObject> lease = pool.acquire()) {
                return lease.get();
            }
        });
        awaitWaiters(pool, 1);
        Assert.assertFalse(blocked.isDone());

        TestObject released = first.get();
        first.close();

        Assert.assertSame("Waiter should reuse the released object", released, blocked.get(5, TimeUnit.SECONDS));
        Assert.assertEquals(2, createdCount.get());
        Assert.assertEquals(3, pool.getStats().hits);
        Assert.assertEquals(1, pool.getStats().waitCount);
        second.close();
    }

    @Test
    public void testTryAcquireForTimesOut() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();

        long start = System.nanoTime();
        Future<Optional<Pooled<TestObject>>> attempt =
                executor.submit(() -> pool.tryAcquireFor(Duration.ofMillis(50)));
        Optional<Pooled<TestObject>> result = attempt.get(5, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        Assert.assertFalse(result.isPresent());
        Assert.assertTrue("Should have waited about 50ms, waited " + elapsedMillis, elapsedMillis >= 45);
        PoolStats stats = pool.getStats();
        Assert.assertEquals(1, stats.timeoutCount);
        Assert.assertEquals(1, stats.waitCount);
        Assert.assertEquals(0, pool.waitingCount());
        held.close();
    }

    @Test
    public void testTryAcquireForSucceedsAfterRelease() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();

        Future<Optional<Pooled<TestObject>>> attempt =
                executor.submit(() -> pool.tryAcquireFor(Duration.ofSeconds(5), Priority.HIGH));
        awaitWaiters(pool, 1);
        held.close();

        Optional<Pooled<TestObject>> result = attempt.get(5, TimeUnit.SECONDS);
        Assert.assertTrue(result.isPresent());
        Assert.assertEquals(0, pool.getStats().timeoutCount);
        result.get().close();
    }

    @Test
    public void testZeroTimeoutOnExhaustedPoolReturnsImmediately() {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();

        long start = System.nanoTime();
        Optional<Pooled<TestObject>> result = pool.tryAcquireFor(Duration.ZERO);

        Assert.assertFalse(result.isPresent());
        Assert.assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
        Assert.assertEquals(1, pool.getStats().timeoutCount);
        held.close();
    }

    @Test
    public void testInterruptedTryAcquireReturnsEmpty() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger outcome = new AtomicInteger(-1);

        Thread waiter = new Thread(() -> {
            Optional<Pooled<TestObject>> result = pool.tryAcquireFor(Duration.ofSeconds(30));
            outcome.set(result.isPresent() ? 1 : Thread.currentThread().isInterrupted() ? 0 : 2);
            done.countDown();
        });
        waiter.start();
        awaitWaiters(pool, 1);
        waiter.interrupt();

        Assert.assertTrue(done.await(5, TimeUnit.SECONDS));
        Assert.assertEquals("Empty result with interrupt flag restored", 0, outcome.get());
        Assert.assertEquals(0, pool.waitingCount());
        held.close();
    }

    @Test
    public void testCriticalWaiterServedBeforeLow() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();
        Queue<Priority> serviceOrder = new ConcurrentLinkedQueue<>();
        CountDownLatch criticalHolding = new CountDownLatch(1);
        CountDownLatch releaseCritical = new CountDownLatch(1);

        Future<?> low = executor.submit(() -> {
            try (Pooled<TestObject> lease = pool.acquire(Priority.LOW)) {
                serviceOrder.add(Priority.LOW);
            }
        });
        awaitWaiters(pool, 1);

        Future<?> critical = executor.submit(() -> {
            try (Pooled<TestObject> lease = pool.acquire(Priority.CRITICAL)) {
                serviceOrder.add(Priority.CRITICAL);
                criticalHolding.countDown();
                releaseCritical.await();
            }
            return null;
        });
        awaitWaiters(pool, 2);

        held.close();
        Assert.assertTrue(criticalHolding.await(5, TimeUnit.SECONDS));
        Assert.assertFalse("Low priority waiter must still be blocked", low.isDone());

        releaseCritical.countDown();
        critical.get(5, TimeUnit.SECONDS);
        low.get(5, TimeUnit.SECONDS);

        Assert.assertEquals(Priority.CRITICAL, serviceOrder.poll());
        Assert.assertEquals(Priority.LOW, serviceOrder.poll());
    }

    @Test
    public void testNewcomerDoesNotOvertakeHigherPriorityWaiter() throws Exception {
        ObjectPool<TestObject> pool = newPool(2, 0);
        List<Pooled<TestObject>> held = pool.acquireBatch(2);

        // a HIGH waiter needing two objects blocks lower priorities until it is served
        Future<List<Pooled<TestObject>>> batch = executor.submit(() -> pool.acquireBatch(2, Priority.HIGH));
        awaitWaiters(pool, 1);

        held.get(0).close();
        Assert.assertEquals(1, pool.available());
        Assert.assertFalse("NORMAL request must not jump the HIGH waiter",
                pool.tryAcquireFor(Duration.ofMillis(20)).isPresent());

        held.get(1).close();
        List<Pooled<TestObject>> served = batch.get(5, TimeUnit.SECONDS);
        Assert.assertEquals(2, served.size());
        served.forEach(Pooled::close);
    }

    @Test
    public void testBatchOfFullCapacityBlocksFurtherAcquires() throws Exception {
        ObjectPool<TestObject> pool = newPool(3, 0);

        List<Pooled<TestObject>> all = pool.acquireBatch(3);
        Assert.assertEquals(3, all.size());
        Assert.assertFalse(pool.tryAcquireFor(Duration.ofMillis(20)).isPresent());

        Future<Pooled<TestObject>> waiter = executor.submit(() -> pool.acquire());
        awaitWaiters(pool, 1);
        all.get(2).close();

        Pooled<TestObject> lease = waiter.get(5, TimeUnit.SECONDS);
        Assert.assertNotNull(lease.get());
        lease.close();
        all.get(0).close();
        all.get(1).close();
        Assert.assertEquals(3, pool.available());
    }

    @Test
    public void testBatchWaitsUntilEnoughObjectsAreFree() throws Exception {
        ObjectPool<TestObject> pool = newPool(4, 0);
        List<Pooled<TestObject>> held = pool.acquireBatch(3);

        Future<List<Pooled<TestObject>>> batch = executor.submit(() -> pool.acquireBatch(3));
        awaitWaiters(pool, 1);

        held.get(0).close();
        Thread.sleep(20);
        Assert.assertFalse("Two free objects are not enough for a batch of three", batch.isDone());

        held.get(1).close();
        List<Pooled<TestObject>> served = batch.get(5, TimeUnit.SECONDS);
        Assert.assertEquals(3, served.size());
        Assert.assertEquals(4, pool.inUseCount());
        served.forEach(Pooled::close);
        held.get(2).close();
    }

    @Test
    public void testResizeGrowthWakesBlockedBatch() throws Exception {
        ObjectPool<TestObject> pool = newPool(2, 0);
        List<Pooled<TestObject>> held = pool.acquireBatch(2);

        Future<List<Pooled<TestObject>>> batch = executor.submit(() -> pool.acquireBatch(2));
        awaitWaiters(pool, 1);

        pool.resize(4);
        List<Pooled<TestObject>> served = batch.get(5, TimeUnit.SECONDS);
        Assert.assertEquals(2, served.size());
        Assert.assertEquals(4, pool.inUseCount());
        served.forEach(Pooled::close);
        held.forEach(Pooled::close);
    }

    @Test
    public void testShrinkFailsBatchThatCanNoLongerFit() throws Exception {
        ObjectPool<TestObject> pool = newPool(4, 0);
        Pooled<TestObject> held = pool.acquire();
        List<Pooled<TestObject>> others = pool.acquireBatch(3);

        Future<List<Pooled<TestObject>>> batch = executor.submit(() -> pool.acquireBatch(4));
        awaitWaiters(pool, 1);

        others.forEach(Pooled::close);
        pool.resize(2);

        try {
            batch.get(5, TimeUnit.SECONDS);
            Assert.fail("Batch of four cannot fit a pool of two");
        } catch (java.util.concurrent.ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof PoolExhaustedException);
        }
        Assert.assertEquals(0, pool.waitingCount());
        held.close();
    }

    @Test
    public void testValidatedWaiterKeepsWaitingForMatch() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();
        held.get().value = 3;

        Future<Pooled<TestObject>> validated = executor.submit(() -> pool.acquireValidated(obj -> obj.id < 0));
        awaitWaiters(pool, 1);

        held.close();
        Thread.sleep(20);
        Assert.assertFalse("Idle object does not match and pool is full", validated.isDone());

        pool.clear();
        Pooled<TestObject> lease = validated.get(5, TimeUnit.SECONDS);
        Assert.assertEquals(2, createdCount.get());
        lease.close();
    }

    @Test
    public void testCloseFailsBlockedWaiters() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();

        Future<Pooled<TestObject>> waiter = executor.submit(() -> pool.acquire());
        awaitWaiters(pool, 1);
        pool.close();

        try {
            waiter.get(5, TimeUnit.SECONDS);
            Assert.fail("Waiter should fail once the pool closes");
        } catch (java.util.concurrent.ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
        held.close();
        Assert.assertEquals(0, pool.waitingCount());
    }

    @Test
    public void testReleaseFromAnotherThread() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> lease = pool.acquire();

        executor.submit(lease::close).get(5, TimeUnit.SECONDS);

        Assert.assertEquals(1, pool.size());
        Assert.assertEquals(0, pool.inUseCount());
    }

    @Test
    public void testWaitTimeTracking() throws Exception {
        ObjectPool<TestObject> pool = newPool(1, 0);
        Pooled<TestObject> held = pool.acquire();

        Future<?> waiter = executor.submit(() -> pool.acquire().close());
        awaitWaiters(pool, 1);
        Thread.sleep(50);
        held.close();
        waiter.get(5, TimeUnit.SECONDS);

        PoolStats stats = pool.getStats();
        Assert.assertEquals(1, stats.waitCount);
        Assert.assertTrue(stats.totalWaitTime.toMillis() >= 40);
        Assert.assertTrue(stats.maxWaitTime.compareTo(Duration.ZERO) > 0);
        Assert.assertEquals(stats.totalWaitTime, stats.averageWaitTime());
    }

    @Test
    public void testConcurrentAcquireRelease() throws InterruptedException {
        ObjectPool<TestObject> pool = newPool(10, 0);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(CONCURRENCY_LEVEL);
        AtomicLong acquireCount = new AtomicLong(0);

        for (int i = 0; i < CONCURRENCY_LEVEL; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < OPERATIONS_PER_THREAD; j++) {
                        try (Pooled<TestObject> lease = pool.acquire()) {
                            lease.get().value = j;
                            acquireCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        Assert.assertTrue(doneLatch.await(30, TimeUnit.SECONDS));

        Assert.assertEquals(CONCURRENCY_LEVEL * OPERATIONS_PER_THREAD, acquireCount.get());
        Assert.assertEquals(10, pool.available());
        Assert.assertEquals(0, pool.inUseCount());
        Assert.assertTrue(createdCount.get() <= 10);
        Assert.assertEquals(pool.size(), createdCount.get());
    }

    @Test
    public void testStressWithBatchesAndPriorities() throws InterruptedException {
        ObjectPool<TestObject> pool = newPool(20, 0);
        Priority[] priorities = Priority.values();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(CONCURRENCY_LEVEL);
        AtomicLong totalAcquisitions = new AtomicLong(0);
        AtomicInteger aliasing = new AtomicInteger(0);

        for (int i = 0; i < CONCURRENCY_LEVEL; i++) {
            final Priority priority = priorities[i % priorities.length];
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 200; j++) {
                        if (j % 10 == 0) {
                            int count = 1 + ThreadLocalRandom.current().nextInt(3);
                            List<Pooled<TestObject>> leases = pool.acquireBatch(count, priority);
                            for (Pooled<TestObject> lease : leases) {
                                if (lease.get().value != 0) aliasing.incrementAndGet();
                                lease.get().value++;
                            }
                            totalAcquisitions.addAndGet(leases.size());
                            leases.forEach(Pooled::close);
                        } else {
                            try (Pooled<TestObject> lease = pool.acquire(priority)) {
                                if (lease.get().value != 0) aliasing.incrementAndGet();
                                lease.get().value++;
                                totalAcquisitions.incrementAndGet();
                            }
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        Assert.assertTrue(doneLatch.await(30, TimeUnit.SECONDS));

        Assert.assertEquals("Object lent twice at once or not reset", 0, aliasing.get());
        Assert.assertTrue(totalAcquisitions.get() >= CONCURRENCY_LEVEL * 200);
        Assert.assertEquals(20, pool.available());
        Assert.assertEquals(0, pool.inUseCount());
        Assert.assertEquals(0, pool.waitingCount());
        PoolStats stats = pool.getStats();
        Assert.assertTrue(stats.hits > 0);
        Assert.assertTrue(stats.misses > 0);
    }
}
