package tsq;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CounterTest
{

    @Test
    void incrementGetReset()
    {
        Counter counter = new Counter();
        assertEquals(0, counter.get());

        counter.increment();
        counter.increment();
        counter.add(3);
        assertEquals(5, counter.get());
        assertEquals("5", counter.toString());

        counter.reset();
        assertEquals(0, counter.get());
    }

    @Test
    void concurrentIncrementsAreNotLost() throws InterruptedException
    {
        Counter      counter = new Counter();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++)
        {
            Thread thread = new Thread(() ->
            {
                for (int j = 0; j < 10_000; j++) counter.increment();
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) thread.join();

        assertEquals(80_000, counter.get());
    }
}
