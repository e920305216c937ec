package tsq;

import lombok.extern.slf4j.Slf4j;
import tsq.workload.GracefulShutdown;
import tsq.workload.MultiProducerMultiConsumer;
import tsq.workload.ProduceThenDrain;
import tsq.workload.SingleProducerSingleConsumer;
import tsq.workload.TimedPop;
import tsq.workload.WorkloadChain;
import tsq.workload.WorkloadConfig;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 依次执行所有负载, 打印每个负载的生产、消费数量和耗时
 */
@Slf4j
public class QueueDemo
{

    public static void main(String[] args)
    {
        WorkloadConfig  config = WorkloadConfig.defaults();
        ExecutorService pool   = Executors.newCachedThreadPool();
        log.info("config: {}", config);

        WorkloadChain chain = WorkloadChain.create("ConcurrentQueue", pool)
                .with(new SingleProducerSingleConsumer(config),
                      new MultiProducerMultiConsumer(config),
                      new TimedPop(config),
                      new ProduceThenDrain(config),
                      new GracefulShutdown(config));
        boolean success = chain.start();
        if (!success)
        {
            chain.printErrorInfo();
        }

        // 中断仍然阻塞在 pop() 上的线程
        pool.shutdownNow();
        log.info("全部负载执行{}", success ? "成功" : "失败");
    }
}
