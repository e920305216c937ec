package tsq.workload;

import java.util.concurrent.ExecutorService;

/**
 * 针对 ConcurrentQueue 的一种生产者 / 消费者负载
 */
public interface Workload
{

    String name();

    /**
     * 阻塞方法, 执行负载并返回统计结果
     *
     * @throws WorkerGroup.WorkerGroupException worker 抛出异常或超时
     * @throws IllegalStateException            结果校验失败 (丢失、重复、乱序)
     */
    WorkloadReport run(ExecutorService executorService);
}
