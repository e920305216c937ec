package tsq.workload;

import lombok.Value;

/**
 * 负载的统计结果
 */
@Value
public class WorkloadReport
{
    String name;
    long   produced;
    long   consumed;
    int    remaining;
    long   elapsedMillis;

    /**
     * 生产数量 == 消费数量, 且队列中没有剩余元素
     */
    public boolean balanced()
    {
        return produced == consumed && remaining == 0;
    }
}
