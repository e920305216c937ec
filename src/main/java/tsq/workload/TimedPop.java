package tsq.workload;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import tsq.ConcurrentQueue;
import tsq.Counter;
import tsq.Util;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <p>限时出队
 * <p>1、空队列上 popTimeout() 返回 empty, 且耗时不少于 popTimeoutMillis
 * <p>2、另一个线程在 popTimeoutMillis / 2 之后写入, popTimeout() 在截止时间之前拿到该元素
 */
@Slf4j
public class TimedPop implements Workload
{

    private static final int VALUE = 42;

    private final WorkloadConfig config;

    public TimedPop(WorkloadConfig config)
    {
        this.config = config;
    }

    @Override
    public String name()
    {
        return "timed-pop";
    }

    @Override
    public WorkloadReport run(ExecutorService executorService)
    {
        final Duration                 timeout  = Duration.ofMillis(config.getPopTimeoutMillis());
        final ConcurrentQueue<Integer> queue    = new ConcurrentQueue<>();
        final Counter                  produced = new Counter();
        final Counter                  consumed = new Counter();

        Stopwatch stopwatch = Stopwatch.createStarted();
        try
        {
            // 空队列, 等待超时
            Optional<Integer> none = queue.popTimeout(timeout);
            long waited = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            if (none.isPresent()) throw new IllegalStateException("空队列上 popTimeout() 返回了元素 " + none.get());
            if (waited < timeout.toMillis())
            {
                throw new IllegalStateException("popTimeout() 提前返回: " + waited + " ms < " + timeout.toMillis() + " ms");
            }
            log.debug("popTimeout({} ms) on empty queue returned after {} ms", timeout.toMillis(), waited);

            // 截止时间之前写入
            WorkerGroup producer = WorkerGroup.create(name(), executorService, () ->
            {
                if (!Util.sleep(timeout.toMillis() / 2)) throw new InterruptedException();
                queue.push(VALUE);
                produced.increment();
            }).start();

            Optional<Integer> value = queue.popTimeout(timeout.multipliedBy(2));
            value.ifPresent(v -> consumed.increment());
            if (!producer.success(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS))
            {
                throw new WorkerGroup.WorkerGroupException(name() + "-写入失败", producer.getThrowableQueue().peek());
            }
            if (value.isEmpty() || value.get() != VALUE)
            {
                throw new IllegalStateException("popTimeout() 没有拿到写入的元素: " + value);
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new WorkerGroup.WorkerGroupException(name() + "-等待被中断", e);
        }
        return new WorkloadReport(name(), produced.get(), consumed.get(), queue.size(),
                                  stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }
}
