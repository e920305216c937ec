package tsq.workload;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tsq.ConcurrentQueue;
import tsq.Counter;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkerGroupTest
{

    private ExecutorService pool;

    @BeforeEach
    void setUp()
    {
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown()
    {
        pool.shutdownNow();
    }

    @Test
    void allWorkersSucceed()
    {
        Counter counter = new Counter();
        WorkerGroup group = WorkerGroup.create("ok", pool, counter::increment, counter::increment, counter::increment);

        assertEquals(3, group.size());
        assertTrue(group.startAndAwait(5, TimeUnit.SECONDS));
        assertEquals(3, counter.get());
        assertTrue(group.getThrowableQueue().isEmpty());
    }

    @Test
    void failuresAreCollected()
    {
        WorkerGroup group = WorkerGroup.create("fail", pool,
                                               () -> { throw new IllegalStateException("boom"); },
                                               () -> { });

        assertFalse(group.startAndAwait(5, TimeUnit.SECONDS));
        assertEquals(1, group.getThrowableQueue().size());

        Throwable failure = group.getThrowableQueue().peek();
        assertInstanceOf(WorkerGroup.WorkerGroupException.class, failure);
        assertInstanceOf(IllegalStateException.class, failure.getCause());
    }

    @Test
    void startAndCheckThrowsFirstFailureWithSuppressed()
    {
        WorkerGroup group = WorkerGroup.create("check", pool,
                                               () -> { throw new IllegalStateException("a"); },
                                               () -> { throw new IllegalArgumentException("b"); });

        WorkerGroup.WorkerGroupException e = assertThrows(WorkerGroup.WorkerGroupException.class,
                                                          () -> group.startAndCheck(5, TimeUnit.SECONDS));
        assertEquals(1, e.getSuppressed().length);
    }

    @Test
    void timeoutCancelsBlockedWorkers()
    {
        ConcurrentQueue<Integer> queue = new ConcurrentQueue<>();
        WorkerGroup              group = WorkerGroup.create("blocked", pool, queue::pop);

        assertFalse(group.startAndAwait(100, TimeUnit.MILLISECONDS));
        assertInstanceOf(WorkerGroup.WorkerGroupException.class, group.getThrowableQueue().peek());
    }
}
