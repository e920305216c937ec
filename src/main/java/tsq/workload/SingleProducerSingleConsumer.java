package tsq.workload;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import tsq.ConcurrentQueue;
import tsq.Counter;
import tsq.Util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <p>单生产者、单消费者
 * <p>生产者每写入一个元素停顿 produceDelayMillis, 消费者使用阻塞的 pop(), 消费顺序必须与写入顺序一致
 */
@Slf4j
public class SingleProducerSingleConsumer implements Workload
{

    private final WorkloadConfig config;

    public SingleProducerSingleConsumer(WorkloadConfig config)
    {
        this.config = config;
    }

    @Override
    public String name()
    {
        return "spsc";
    }

    @Override
    public WorkloadReport run(ExecutorService executorService)
    {
        final int                      n        = config.getSpscItems();
        final ConcurrentQueue<Integer> queue    = new ConcurrentQueue<>();
        final Counter                  produced = new Counter();
        final Counter                  consumed = new Counter();
        final List<Integer>            received = new ArrayList<>(n); // 只有消费者线程写入

        // 生产者
        WorkerGroup.Worker producer = () ->
        {
            for (int i = 0; i < n; i++)
            {
                queue.push(i);
                produced.increment();
                log.debug("produced {}", i);
                if (!Util.sleep(config.getProduceDelayMillis())) throw new InterruptedException();
            }
        };
        // 消费者
        WorkerGroup.Worker consumer = () ->
        {
            for (int i = 0; i < n; i++)
            {
                int value = queue.pop();
                received.add(value);
                consumed.increment();
                log.debug("consumed {}", value);
            }
        };

        Stopwatch stopwatch = Stopwatch.createStarted();
        WorkerGroup.create(name(), executorService, producer, consumer)
                   .startAndCheck(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS);
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        // latch.await() 之后 received 对当前线程可见
        for (int i = 0; i < received.size(); i++)
        {
            if (received.get(i) != i)
            {
                throw new IllegalStateException("FIFO 顺序被破坏: index=" + i + ", value=" + received.get(i));
            }
        }
        return new WorkloadReport(name(), produced.get(), consumed.get(), queue.size(), elapsed);
    }
}
