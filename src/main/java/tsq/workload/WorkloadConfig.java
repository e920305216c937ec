package tsq.workload;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * <p>负载参数, 未设置的参数使用默认值
 * <p>线程数被限制在 [MIN_THREADS, MAX_THREADS] 之间, 元素个数必须大于 0, 时间参数不能为负数
 */
@Getter
@ToString
public class WorkloadConfig
{

    public static final int MIN_THREADS = 1;  // 最小线程数
    public static final int MAX_THREADS = 64; // 最大线程数

    public static final int  DEFAULT_PRODUCERS              = 3;
    public static final int  DEFAULT_CONSUMERS              = 4;
    public static final int  DEFAULT_ITEMS_PER_PRODUCER     = 20;
    public static final int  DEFAULT_SPSC_ITEMS             = 10;
    public static final int  DEFAULT_STRESS_THREADS         = 10;
    public static final int  DEFAULT_ITEMS_PER_STRESS       = 100;
    public static final long DEFAULT_PRODUCE_DELAY_MILLIS   = 50;  // 单生产者每次写入之后的停顿
    public static final long DEFAULT_POLL_INTERVAL_MILLIS   = 10;  // tryPop() 失败之后的休眠
    public static final long DEFAULT_POP_TIMEOUT_MILLIS     = 100;
    public static final long DEFAULT_AWAIT_TIMEOUT_SECONDS  = 30;  // 等待一个工作组结束的上限

    private final int  producers;
    private final int  consumers;
    private final int  itemsPerProducer;
    private final int  spscItems;
    private final int  stressThreads;
    private final int  itemsPerStressThread;
    private final long produceDelayMillis;
    private final long pollIntervalMillis;
    private final long popTimeoutMillis;
    private final long awaitTimeoutSeconds;

    @Builder
    private WorkloadConfig(Integer producers, Integer consumers, Integer itemsPerProducer, Integer spscItems,
                           Integer stressThreads, Integer itemsPerStressThread,
                           Long produceDelayMillis, Long pollIntervalMillis, Long popTimeoutMillis,
                           Long awaitTimeoutSeconds)
    {
        this.producers     = threads(producers, DEFAULT_PRODUCERS);
        this.consumers     = threads(consumers, DEFAULT_CONSUMERS);
        this.stressThreads = threads(stressThreads, DEFAULT_STRESS_THREADS);

        this.itemsPerProducer     = positive("itemsPerProducer", itemsPerProducer, DEFAULT_ITEMS_PER_PRODUCER);
        this.spscItems            = positive("spscItems", spscItems, DEFAULT_SPSC_ITEMS);
        this.itemsPerStressThread = positive("itemsPerStressThread", itemsPerStressThread, DEFAULT_ITEMS_PER_STRESS);

        this.produceDelayMillis  = nonNegative("produceDelayMillis", produceDelayMillis, DEFAULT_PRODUCE_DELAY_MILLIS);
        this.pollIntervalMillis  = nonNegative("pollIntervalMillis", pollIntervalMillis, DEFAULT_POLL_INTERVAL_MILLIS);
        this.popTimeoutMillis    = nonNegative("popTimeoutMillis", popTimeoutMillis, DEFAULT_POP_TIMEOUT_MILLIS);
        this.awaitTimeoutSeconds = nonNegative("awaitTimeoutSeconds", awaitTimeoutSeconds, DEFAULT_AWAIT_TIMEOUT_SECONDS);
        if (this.awaitTimeoutSeconds == 0) throw new IllegalArgumentException("awaitTimeoutSeconds must be > 0");
    }

    public static WorkloadConfig defaults()
    {
        return builder().build();
    }

    // =================================================================================================================

    private static int threads(Integer value, int defaultValue)
    {
        if (value == null) return defaultValue;
        if (value > MAX_THREADS) return MAX_THREADS;
        return Math.max(value, MIN_THREADS);
    }

    private static int positive(String name, Integer value, int defaultValue)
    {
        if (value == null) return defaultValue;
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0: " + value);
        return value;
    }

    private static long nonNegative(String name, Long value, long defaultValue)
    {
        if (value == null) return defaultValue;
        if (value < 0) throw new IllegalArgumentException(name + " must be >= 0: " + value);
        return value;
    }
}
