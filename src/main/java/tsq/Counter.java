package tsq;

import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>线程安全计数器, 用于统计生产、消费的元素个数
 * <p>get() 是原子读, 结果准确 (LongAdder 的 sum() 是非准确求和, 不适合作为循环退出条件)
 * <p>与队列操作之间没有顺序保证, 先 increment() 再 push() 不是原子的
 */
public class Counter {

    private final AtomicLong count = new AtomicLong();

    public void increment() {
        count.incrementAndGet();
    }

    public void add(long value) {
        count.addAndGet(value);
    }

    public long get() {
        return count.get();
    }

    public void reset() {
        count.set(0L);
    }

    @Override
    public String toString() {
        return String.valueOf(count.get());
    }
}
