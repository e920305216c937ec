package tsq;

public class Util
{

    private Util()
    {
    }

    /**
     * 休眠 millis 毫秒, 被中断时恢复中断标志并返回 false
     */
    public static boolean sleep(long millis)
    {
        try
        {
            Thread.sleep(millis);
            return true;
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
