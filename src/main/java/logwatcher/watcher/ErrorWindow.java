package logwatcher.watcher;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 滑动窗口错误率 - 按请求数计算最近 N 个请求中的 5xx 比例
 *
 * <p>窗口满时淘汰最早的结果，错误数随写入增量维护。只由引擎线程访问。</p>
 */
public class ErrorWindow {

    private final int capacity;
    private final EvictingQueue<Boolean> outcomes;
    private int errorCount;

    public ErrorWindow(int capacity) {
        Preconditions.checkArgument(capacity >= 1, "窗口大小必须 >= 1: %s", capacity);
        this.capacity = capacity;
        this.outcomes = EvictingQueue.create(capacity);
    }

    /**
     * 记录一个请求结果
     */
    public void observe(boolean isError) {
        if (outcomes.remainingCapacity() == 0 && Boolean.TRUE.equals(outcomes.peek())) {
            errorCount--;
        }
        outcomes.add(isError);
        if (isError) {
            errorCount++;
        }
    }

    /**
     * 当前错误率（百分比），窗口为空时返回 empty
     */
    public OptionalDouble currentRate() {
        if (outcomes.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(errorCount * 100.0 / outcomes.size());
    }

    public int size() {
        return outcomes.size();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public int errorCount() {
        return errorCount;
    }

    /**
     * 按时间顺序（最早在前）复制窗口内容
     */
    public List<Boolean> snapshot() {
        return new ArrayList<>(outcomes);
    }
}
