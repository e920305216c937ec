package tsq.workload;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadConfigTest
{

    @Test
    void defaults()
    {
        WorkloadConfig config = WorkloadConfig.defaults();
        assertEquals(WorkloadConfig.DEFAULT_PRODUCERS, config.getProducers());
        assertEquals(WorkloadConfig.DEFAULT_CONSUMERS, config.getConsumers());
        assertEquals(WorkloadConfig.DEFAULT_STRESS_THREADS, config.getStressThreads());
        assertEquals(WorkloadConfig.DEFAULT_ITEMS_PER_STRESS, config.getItemsPerStressThread());
        assertEquals(WorkloadConfig.DEFAULT_POP_TIMEOUT_MILLIS, config.getPopTimeoutMillis());
    }

    @Test
    void threadCountsAreClamped()
    {
        WorkloadConfig config = WorkloadConfig.builder()
                                              .producers(0)
                                              .consumers(1000)
                                              .stressThreads(-3)
                                              .build();
        assertEquals(WorkloadConfig.MIN_THREADS, config.getProducers());
        assertEquals(WorkloadConfig.MAX_THREADS, config.getConsumers());
        assertEquals(WorkloadConfig.MIN_THREADS, config.getStressThreads());
    }

    @Test
    void invalidValuesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> WorkloadConfig.builder().itemsPerProducer(0).build());
        assertThrows(IllegalArgumentException.class, () -> WorkloadConfig.builder().spscItems(-1).build());
        assertThrows(IllegalArgumentException.class, () -> WorkloadConfig.builder().popTimeoutMillis(-1L).build());
        assertThrows(IllegalArgumentException.class, () -> WorkloadConfig.builder().awaitTimeoutSeconds(0L).build());
    }
}
