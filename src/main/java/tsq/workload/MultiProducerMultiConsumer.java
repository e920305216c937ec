package tsq.workload;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import tsq.ConcurrentQueue;
import tsq.Counter;
import tsq.Util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <p>多生产者、多消费者
 * <p>每个生产者写入互不相交的一段整数, 消费者轮询 tryPop(), 队列为空时休眠 pollIntervalMillis,
 * 直到共享的消费计数达到生产总数
 */
@Slf4j
public class MultiProducerMultiConsumer implements Workload
{

    private final WorkloadConfig config;

    public MultiProducerMultiConsumer(WorkloadConfig config)
    {
        this.config = config;
    }

    @Override
    public String name()
    {
        return "mpmc";
    }

    @Override
    public WorkloadReport run(ExecutorService executorService)
    {
        final int                      perProducer = config.getItemsPerProducer();
        final long                     total       = (long) config.getProducers() * perProducer;
        final ConcurrentQueue<Integer> queue       = new ConcurrentQueue<>();
        final Counter                  produced    = new Counter();
        final Counter                  consumed    = new Counter();
        final Set<Integer>             seen        = ConcurrentHashMap.newKeySet();

        List<WorkerGroup.Worker> workers = new ArrayList<>();
        for (int p = 0; p < config.getProducers(); p++)
        {
            final int base = p * perProducer;
            workers.add(() ->
            {
                for (int j = 0; j < perProducer; j++)
                {
                    queue.push(base + j);
                    produced.increment();
                }
            });
        }
        for (int c = 0; c < config.getConsumers(); c++)
        {
            workers.add(() ->
            {
                while (consumed.get() < total)
                {
                    Optional<Integer> value = queue.tryPop();
                    if (value.isPresent())
                    {
                        if (!seen.add(value.get())) throw new IllegalStateException("重复消费: " + value.get());
                        consumed.increment();
                    }
                    else if (!Util.sleep(config.getPollIntervalMillis()))
                    {
                        throw new InterruptedException();
                    }
                }
            });
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        WorkerGroup.create(name(), executorService, workers)
                   .startAndCheck(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS);
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        if (seen.size() != total) throw new IllegalStateException("丢失元素: seen=" + seen.size() + ", total=" + total);
        log.debug("{} producers={}, consumers={}, total={}", name(), config.getProducers(), config.getConsumers(), total);
        return new WorkloadReport(name(), produced.get(), consumed.get(), queue.size(), elapsed);
    }
}
