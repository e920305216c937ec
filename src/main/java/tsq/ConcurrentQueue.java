package tsq;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <p>多生产者、多消费者共享的 FIFO 阻塞队列, 默认无界, 也可以指定容量
 * <p>出队: pop() 阻塞等待, tryPop() 立即返回, popTimeout() 最多等待指定时长
 * <p>入队: 无界队列的 push() 不会阻塞; 有界队列已满时, push() 会被阻塞, 直到队列有空位为止
 * <p>基于条件变量实现, await() 和 signal() 之前必须先加锁, while(...) await() 避免假唤醒
 * <p>队列本身没有 "关闭" 状态, 空闲的消费者只能通过 wakeAll() + 外部关闭标志 (见 popOrShutdown) 或中断来唤醒,
 * 否则 pop() 可能永久阻塞
 *
 * @param <T> 元素类型, 不允许为 null
 */
public class ConcurrentQueue<T>
{

    private static final int UNBOUNDED = Integer.MAX_VALUE;

    private final ArrayDeque<T> items;
    private final int           capacity;

    private final ReentrantLock lock     = new ReentrantLock();
    private final Condition     notEmpty = lock.newCondition();
    private final Condition     notFull  = lock.newCondition();

    /**
     * 无界队列
     */
    public ConcurrentQueue()
    {
        this.items    = new ArrayDeque<>();
        this.capacity = UNBOUNDED;
    }

    /**
     * 有界队列, capacity 必须大于 0
     */
    public ConcurrentQueue(int capacity)
    {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        this.items    = new ArrayDeque<>(Math.min(capacity, 1024));
        this.capacity = capacity;
    }

    // =================================================================================================================

    /**
     * 入队: 有界队列已满时, 写入操作会被阻塞, 直到队列有空位为止
     */
    public void push(T value) throws InterruptedException
    {
        Objects.requireNonNull(value, "value");
        final ReentrantLock lock = this.lock;
        lock.lock();
        try
        {
            while (items.size() == capacity) notFull.await();
            enqueue(value);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 非阻塞入队, 有界队列已满时返回 false
     */
    public boolean tryPush(T value)
    {
        Objects.requireNonNull(value, "value");
        final ReentrantLock lock = this.lock;
        lock.lock();
        try
        {
            if (items.size() == capacity) return false;
            enqueue(value);
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 限时入队, 队列在 timeout 内一直是满的则返回 false
     */
    public boolean pushTimeout(T value, Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(value, "value");
        long nanos = toNanos(timeout);
        if (nanos <= 0L) return tryPush(value);

        final long          deadline = System.nanoTime() + nanos;
        final ReentrantLock lock     = this.lock;
        lock.lockInterruptibly();
        try
        {
            while (items.size() == capacity)
            {
                nanos = deadline - System.nanoTime();
                if (nanos <= 0L) return false;
                notFull.awaitNanos(nanos);
            }
            enqueue(value);
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    // =================================================================================================================

    /**
     * 出队: 队列为空时, 读取操作会被阻塞, 直到队列有数据为止
     * <p>没有生产者写入时会一直阻塞, 需要限时等待请使用 popTimeout()
     */
    public T pop() throws InterruptedException
    {
        final ReentrantLock lock = this.lock;
        lock.lockInterruptibly();
        try
        {
            while (items.isEmpty()) notEmpty.await();
            return dequeue();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 非阻塞出队, 队列为空时立即返回 empty
     */
    public Optional<T> tryPop()
    {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try
        {
            if (items.isEmpty()) return Optional.empty();
            return Optional.of(dequeue());
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * <p>限时出队, 截止时间从调用开始计算
     * <p>超时返回 empty; 假唤醒和 wakeAll() 不会让等待提前结束, 只会消耗剩余的等待时间
     * <p>timeout <= 0 等价于 tryPop()
     */
    public Optional<T> popTimeout(Duration timeout) throws InterruptedException
    {
        return popTimeout(toNanos(timeout), TimeUnit.NANOSECONDS);
    }

    public Optional<T> popTimeout(long timeout, TimeUnit unit) throws InterruptedException
    {
        long nanos = unit.toNanos(timeout);
        if (nanos <= 0L) return tryPop();

        final long          deadline = System.nanoTime() + nanos;
        final ReentrantLock lock     = this.lock;
        lock.lockInterruptibly();
        try
        {
            while (items.isEmpty())
            {
                nanos = deadline - System.nanoTime();
                if (nanos <= 0L) return Optional.empty();
                notEmpty.awaitNanos(nanos);
            }
            return Optional.of(dequeue());
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * <p>出队或者关闭: 队列为空且 shutdown 为 false 时阻塞
     * <p>shutdown 在锁内作为等待条件的一部分读取, 关闭方先设置 shutdown = true 再调用 wakeAll(), 不会丢失唤醒
     * <p>关闭之后仍然先返回队列中已有的元素, 队列为空才返回 empty
     */
    public Optional<T> popOrShutdown(AtomicBoolean shutdown) throws InterruptedException
    {
        Objects.requireNonNull(shutdown, "shutdown");
        final ReentrantLock lock = this.lock;
        lock.lockInterruptibly();
        try
        {
            while (items.isEmpty())
            {
                if (shutdown.get()) return Optional.empty();
                notEmpty.await();
            }
            return Optional.of(dequeue());
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 按 FIFO 顺序取出全部元素并加入 target, 返回取出的个数
     */
    public int drainTo(Collection<? super T> target)
    {
        Objects.requireNonNull(target, "target");
        final List<T>       drained = new ArrayList<>();
        final ReentrantLock lock    = this.lock;
        lock.lock();
        try
        {
            T e;
            while ((e = items.pollFirst()) != null) drained.add(e);
            if (!drained.isEmpty()) notFull.signalAll();
        }
        finally
        {
            lock.unlock();
        }
        // 不在锁内调用外部集合
        target.addAll(drained);
        return drained.size();
    }

    // =================================================================================================================

    /**
     * <p>唤醒所有阻塞在 pop()、popTimeout()、popOrShutdown() 以及有界 push() 上的线程
     * <p>被唤醒的线程在锁内重新检查条件, 条件不满足则继续等待
     */
    public void wakeAll()
    {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try
        {
            notEmpty.signalAll();
            notFull.signalAll();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 快照值, 解锁之后随时可能过期, 只用于诊断
     */
    public int size()
    {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try
        {
            return items.size();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * 快照值, 同 size()
     */
    public boolean isEmpty()
    {
        return size() == 0;
    }

    public int remainingCapacity()
    {
        return capacity == UNBOUNDED ? UNBOUNDED : capacity - size();
    }

    public int capacity()
    {
        return capacity;
    }

    public boolean isBounded()
    {
        return capacity != UNBOUNDED;
    }

    // =================================================================================================================

    /**
     * 必须持有锁
     */
    private void enqueue(T value)
    {
        items.addLast(value);
        notEmpty.signal();
    }

    /**
     * 必须持有锁, 且队列不为空; 出队之后队列不再持有该元素的引用
     */
    private T dequeue()
    {
        T e = items.pollFirst();
        notFull.signal();
        return e;
    }

    private static long toNanos(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        try
        {
            return timeout.toNanos();
        }
        catch (ArithmeticException overflow)
        {
            return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
