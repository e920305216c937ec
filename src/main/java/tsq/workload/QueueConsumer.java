package tsq.workload;

import lombok.extern.slf4j.Slf4j;
import tsq.ConcurrentQueue;
import tsq.Counter;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * <p>消费者线程: 不断从队列中取出元素交给 handler 处理
 * <p>关闭协议: shutdown() 先设置关闭标志, 再调用 queue.wakeAll() 唤醒阻塞在 popOrShutdown() 上的线程
 * <p>关闭之后仍然会处理完队列中已有的元素, 队列为空时退出
 * <p>handler 在锁外执行, handler 抛出的异常只记录日志, 不会终止消费者
 */
@Slf4j
public class QueueConsumer<T> implements Runnable
{

    private final String              name;
    private final ConcurrentQueue<T>  queue;
    private final Consumer<? super T> handler;

    private final AtomicBoolean  shutdown   = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Counter        handled    = new Counter();
    private final Counter        failed     = new Counter();

    public QueueConsumer(String name, ConcurrentQueue<T> queue, Consumer<? super T> handler)
    {
        this.name    = name;
        this.queue   = Objects.requireNonNull(queue, "queue");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void run()
    {
        try
        {
            for (; ; )
            {
                Optional<T> item = queue.popOrShutdown(shutdown);
                if (item.isEmpty()) break;

                try
                {
                    handler.accept(item.get());
                    handled.increment();
                }
                catch (RuntimeException e)
                {
                    failed.increment();
                    log.error("{} 处理元素失败: {}", name, item.get(), e);
                }
            }
            log.debug("{} 已关闭, handled={}, failed={}", name, handled.get(), failed.get());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.debug("{} 被中断, handled={}", name, handled.get());
        }
        finally
        {
            terminated.countDown();
        }
    }

    /**
     * 幂等, 不等待消费者退出
     */
    public void shutdown()
    {
        shutdown.set(true);
        queue.wakeAll();
    }

    public boolean isShutdown()
    {
        return shutdown.get();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException
    {
        return terminated.await(timeout, unit);
    }

    public long getHandledCount()
    {
        return handled.get();
    }

    public long getFailedCount()
    {
        return failed.get();
    }

    public String getName()
    {
        return name;
    }
}
