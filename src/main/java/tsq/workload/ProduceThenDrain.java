package tsq.workload;

import com.google.common.base.Stopwatch;
import tsq.ConcurrentQueue;
import tsq.Counter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <p>压力测试: 每个线程先写入 itemsPerStressThread 个不同的整数, 再用 tryPop() 自旋取出同样多的元素
 * <p>所有线程结束之后, 生产总数 == 消费总数, 且队列为空
 */
public class ProduceThenDrain implements Workload
{

    private final WorkloadConfig config;

    public ProduceThenDrain(WorkloadConfig config)
    {
        this.config = config;
    }

    @Override
    public String name()
    {
        return "stress";
    }

    @Override
    public WorkloadReport run(ExecutorService executorService)
    {
        final int                      perThread = config.getItemsPerStressThread();
        final ConcurrentQueue<Integer> queue     = new ConcurrentQueue<>();
        final Counter                  produced  = new Counter();
        final Counter                  consumed  = new Counter();
        final Set<Integer>             seen      = ConcurrentHashMap.newKeySet();

        List<WorkerGroup.Worker> workers = new ArrayList<>();
        for (int t = 0; t < config.getStressThreads(); t++)
        {
            final int base = t * perThread;
            workers.add(() ->
            {
                for (int j = 0; j < perThread; j++)
                {
                    queue.push(base + j);
                    produced.increment();
                }

                int drained = 0;
                while (drained < perThread)
                {
                    Optional<Integer> value = queue.tryPop();
                    if (value.isPresent())
                    {
                        if (!seen.add(value.get())) throw new IllegalStateException("重复消费: " + value.get());
                        drained++;
                        consumed.increment();
                    }
                    else
                    {
                        if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
                        Thread.yield();
                    }
                }
            });
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        WorkerGroup.create(name(), executorService, workers)
                   .startAndCheck(config.getAwaitTimeoutSeconds(), TimeUnit.SECONDS);
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        return new WorkloadReport(name(), produced.get(), consumed.get(), queue.size(), elapsed);
    }
}
