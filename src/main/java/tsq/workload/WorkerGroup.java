package tsq.workload;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * <p>工作组: 一组生产者 / 消费者线程同时开始, 全部结束之后才算完成
 * <p>worker 之间会互相等待 (例如消费者阻塞在 pop() 上等待生产者), executorService 的可用线程数不能少于 worker 数量
 */
public class WorkerGroup
{

    /**
     * 工作线程的执行体, 允许抛出受检异常
     */
    @FunctionalInterface
    public interface Worker
    {
        void run() throws Exception;
    }

    public static class WorkerGroupException extends RuntimeException
    {
        public WorkerGroupException(String message, Throwable cause)
        {
            super(message, cause);
        }

        public WorkerGroupException(String message)
        {
            super(message);
        }
    }

    // =================================================================================================================

    private class CountDownWorker implements Runnable
    {
        private final int    index;
        private final Worker worker;

        public CountDownWorker(int index, Worker worker)
        {
            this.index  = index;
            this.worker = worker;
        }

        @Override
        public void run()
        {
            try
            {
                start.await();
                worker.run();
            }
            catch (Throwable x)
            {
                if (x instanceof InterruptedException) Thread.currentThread().interrupt();
                throwableQueue.add(new WorkerGroupException(groupName + "-" + index + "-" + "异常", x));
            }
            finally
            {
                latch.countDown();
            }
        }
    }

    // =================================================================================================================

    private final String                           groupName;
    private final CountDownLatch                   start;
    private final CountDownLatch                   latch;
    private final ExecutorService                  executorService;
    private final CountDownWorker[]                countDownWorkerArr;
    private final List<Future<?>>                  futures;
    private final ConcurrentLinkedQueue<Throwable> throwableQueue;

    private WorkerGroup(final String groupName, final ExecutorService executorService, final Worker... workers)
    {
        final int size = workers.length;

        this.groupName          = groupName;
        this.start              = new CountDownLatch(1);
        this.latch              = new CountDownLatch(size);
        this.executorService    = executorService;
        this.countDownWorkerArr = new CountDownWorker[size];
        for (int i = 0; i < size; i++)
        {
            countDownWorkerArr[i] = new CountDownWorker(i, workers[i]);
        }
        this.futures        = new ArrayList<>(size);
        this.throwableQueue = new ConcurrentLinkedQueue<>();
    }

    public static WorkerGroup create(final String groupName, final ExecutorService executorService,
                                     final Worker... workers)
    {
        return new WorkerGroup(groupName, executorService, workers);
    }

    public static WorkerGroup create(final String groupName, final ExecutorService executorService,
                                     final List<Worker> workers)
    {
        return new WorkerGroup(groupName, executorService, workers.toArray(new Worker[0]));
    }

    public String info()
    {
        return groupName;
    }

    public int size()
    {
        return countDownWorkerArr.length;
    }

    // =================================================================================================================

    /**
     * 提交所有 worker, 所有 worker 提交完成之后才同时开始执行
     */
    public WorkerGroup start()
    {
        for (final CountDownWorker worker : countDownWorkerArr)
        {
            futures.add(executorService.submit(worker));
        }
        start.countDown();
        return this;
    }

    /**
     * 阻塞方法, 等待所有 worker 结束; 超时则取消 (中断) 仍在执行的 worker
     *
     * @return 所有 worker 按时结束且没有异常
     */
    public boolean success(long timeout, TimeUnit unit)
    {
        boolean finished;
        try
        {
            finished = latch.await(timeout, unit);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            cancel();
            throw new WorkerGroupException(groupName + "-等待被中断", e);
        }

        if (!finished)
        {
            cancel();
            throwableQueue.add(new WorkerGroupException(
                    groupName + "-超时, 未结束的 worker 数量 " + latch.getCount()));
        }
        return finished && throwableQueue.isEmpty();
    }

    public boolean startAndAwait(long timeout, TimeUnit unit)
    {
        start();
        return success(timeout, unit);
    }

    /**
     * 等待所有 worker 结束, 失败则抛出 WorkerGroupException, 其余异常作为 suppressed 附加
     */
    public void startAndCheck(long timeout, TimeUnit unit)
    {
        if (startAndAwait(timeout, unit)) return;

        WorkerGroupException failure = null;
        for (Throwable throwable : throwableQueue)
        {
            if (failure == null) failure = new WorkerGroupException(groupName + "-失败", throwable);
            else failure.addSuppressed(throwable);
        }
        throw failure;
    }

    private void cancel()
    {
        for (Future<?> future : futures)
        {
            future.cancel(true);
        }
    }

    @SuppressWarnings("all")
    public ConcurrentLinkedQueue<Throwable> getThrowableQueue()
    {
        return throwableQueue;
    }
}
