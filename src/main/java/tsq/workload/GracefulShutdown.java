package tsq.workload;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import tsq.ConcurrentQueue;
import tsq.Counter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <p>优雅关闭: 消费者阻塞等待, 所有生产者结束之后关闭消费者
 * <p>关闭之前已经写入的元素必须全部被处理, 关闭之后没有消费者永久阻塞
 */
@Slf4j
public class GracefulShutdown implements Workload
{

    private final WorkloadConfig config;

    public GracefulShutdown(WorkloadConfig config)
    {
        this.config = config;
    }

    @Override
    public String name()
    {
        return "shutdown";
    }

    @Override
    public WorkloadReport run(ExecutorService executorService)
    {
        final int                      perProducer = config.getItemsPerProducer();
        final long                     total       = (long) config.getProducers() * perProducer;
        final ConcurrentQueue<Integer> queue       = new ConcurrentQueue<>();
        final Counter                  produced    = new Counter();
        final Set<Integer>             seen        = ConcurrentHashMap.newKeySet();

        List<QueueConsumer<Integer>> consumers = new ArrayList<>();
        for (int c = 0; c < config.getConsumers(); c++)
        {
            QueueConsumer<Integer> consumer = new QueueConsumer<>(name() + "-consumer-" + c, queue, value ->
            {
                if (!seen.add(value)) throw new IllegalStateException("重复消费: " + value);
            });
            consumers.add(consumer);
            executorService.execute(consumer);
        }

        List<WorkerGroup.Worker> producers = new ArrayList<>();
        for (int p = 0; p < config.getProducers(); p++)
        {
            final int base = p * perProducer;
            producers.add(() ->
            {
                for (int j = 0; j < perProducer; j++)
                {
                    queue.push(base + j);
                    produced.increment();
                }
            });
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        try
        {
            WorkerGroup.create(name(), executorService, producers)
                       .startAndCheck(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS);
        }
        finally
        {
            consumers.forEach(QueueConsumer::shutdown);
        }

        long handled = 0;
        long failed  = 0;
        try
        {
            for (QueueConsumer<Integer> consumer : consumers)
            {
                if (!consumer.awaitTermination(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS))
                {
                    throw new WorkerGroup.WorkerGroupException(consumer.getName() + "-关闭超时");
                }
                handled += consumer.getHandledCount();
                failed += consumer.getFailedCount();
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new WorkerGroup.WorkerGroupException(name() + "-等待被中断", e);
        }
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        if (failed > 0) throw new IllegalStateException("处理失败的元素数量 " + failed);
        if (seen.size() != total) throw new IllegalStateException("丢失元素: seen=" + seen.size() + ", total=" + total);
        log.debug("{} consumers={}, handled={}", name(), consumers.size(), handled);
        return new WorkloadReport(name(), produced.get(), handled, queue.size(), elapsed);
    }
}
