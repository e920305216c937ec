package tsq.workload;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tsq.ConcurrentQueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueueConsumerTest
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
    void shutdownReleasesIdleConsumer() throws Exception
    {
        ConcurrentQueue<Integer> queue    = new ConcurrentQueue<>();
        QueueConsumer<Integer>   consumer = new QueueConsumer<>("idle", queue, value -> { });
        pool.execute(consumer);

        Thread.sleep(20);
        assertFalse(consumer.awaitTermination(20, TimeUnit.MILLISECONDS), "consumer should wait for items");

        consumer.shutdown();
        assertTrue(consumer.isShutdown());
        assertTrue(consumer.awaitTermination(1, TimeUnit.SECONDS));
        assertEquals(0, consumer.getHandledCount());
    }

    @Test
    void queuedItemsAreHandledBeforeExit() throws Exception
    {
        ConcurrentQueue<Integer> queue    = new ConcurrentQueue<>();
        List<Integer>            handled  = Collections.synchronizedList(new ArrayList<>());
        QueueConsumer<Integer>   consumer = new QueueConsumer<>("drain", queue, handled::add);

        for (int i = 0; i < 100; i++) queue.push(i);
        consumer.shutdown();
        pool.execute(consumer);

        assertTrue(consumer.awaitTermination(1, TimeUnit.SECONDS));
        assertEquals(100, consumer.getHandledCount());
        synchronized (handled)
        {
            for (int i = 0; i < 100; i++) assertEquals(i, handled.get(i));
        }
        assertTrue(queue.isEmpty());
    }

    @Test
    void handlerFailureDoesNotStopConsumer() throws Exception
    {
        ConcurrentQueue<Integer> queue = new ConcurrentQueue<>();
        QueueConsumer<Integer> consumer = new QueueConsumer<>("failing", queue, value ->
        {
            if (value % 2 == 0) throw new IllegalArgumentException("even " + value);
        });
        pool.execute(consumer);

        for (int i = 0; i < 10; i++) queue.push(i);
        consumer.shutdown();

        assertTrue(consumer.awaitTermination(1, TimeUnit.SECONDS));
        assertEquals(5, consumer.getHandledCount());
        assertEquals(5, consumer.getFailedCount());
    }

    @Test
    void manyConsumersHandleEveryItemOnce() throws Exception
    {
        ConcurrentQueue<Integer>     queue     = new ConcurrentQueue<>();
        Set<Integer>                 seen      = ConcurrentHashMap.newKeySet();
        List<QueueConsumer<Integer>> consumers = new ArrayList<>();
        for (int c = 0; c < 4; c++)
        {
            QueueConsumer<Integer> consumer = new QueueConsumer<>("c" + c, queue, value ->
            {
                if (!seen.add(value)) throw new IllegalStateException("duplicate " + value);
            });
            consumers.add(consumer);
            pool.execute(consumer);
        }

        for (int i = 0; i < 10_000; i++) queue.push(i);
        consumers.forEach(QueueConsumer::shutdown);

        long handled = 0;
        for (QueueConsumer<Integer> consumer : consumers)
        {
            assertTrue(consumer.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(0, consumer.getFailedCount());
            handled += consumer.getHandledCount();
        }
        assertEquals(10_000, handled);
        assertEquals(10_000, seen.size());
        assertTrue(queue.isEmpty());
    }
}
