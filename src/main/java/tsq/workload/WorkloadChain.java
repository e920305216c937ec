package tsq.workload;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 负载链: 按顺序执行负载, 某个负载失败则停止
 */
@Slf4j
public class WorkloadChain
{

    private final String                           chainName;
    private final ExecutorService                  executorService;
    private final LinkedList<Workload>             workloads;
    private final List<WorkloadReport>             reports;
    private final ConcurrentLinkedQueue<Throwable> throwableQueue;

    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    private WorkloadChain(final String chainName, final ExecutorService executorService)
    {
        this.chainName       = chainName;
        this.executorService = executorService;
        this.workloads       = new LinkedList<>();
        this.reports         = new ArrayList<>();
        this.throwableQueue  = new ConcurrentLinkedQueue<>();
    }

    public static WorkloadChain create(final String chainName, final ExecutorService executorService)
    {
        return new WorkloadChain(chainName, executorService);
    }

    // =================================================================================================================

    public WorkloadChain with(final Workload... workload)
    {
        Collections.addAll(workloads, workload);
        return this;
    }

    /**
     * 阻塞方法
     */
    public boolean start()
    {
        for (Workload workload : workloads)
        {
            final String info = chainName + "_" + workload.name();

            stopwatch.reset().start();
            WorkloadReport report;
            try
            {
                report = workload.run(executorService);
            }
            catch (RuntimeException e)
            {
                long times = stopwatch.stop().elapsed(TimeUnit.MILLISECONDS);
                throwableQueue.add(e);
                log.info("{}_失败_耗时 {} ms", info, times);
                return false;
            }
            long times = stopwatch.stop().elapsed(TimeUnit.MILLISECONDS);

            reports.add(report);
            boolean success = report.balanced();
            log.info("{}_{}_耗时 {} ms, produced={}, consumed={}, remaining={}",
                     info, success ? "成功" : "失败", times,
                     report.getProduced(), report.getConsumed(), report.getRemaining());
            if (!success)
            {
                throwableQueue.add(new IllegalStateException(info + " 生产与消费数量不一致: " + report));
                return false;
            }
        }
        return true;
    }

    public List<WorkloadReport> getReports()
    {
        return Collections.unmodifiableList(reports);
    }

    @SuppressWarnings("all")
    public ConcurrentLinkedQueue<Throwable> getThrowableQueue()
    {
        return throwableQueue;
    }

    public void printErrorInfo()
    {
        for (Throwable throwable : throwableQueue)
        {
            log.error(throwable.getMessage(), throwable);
        }
    }
}
