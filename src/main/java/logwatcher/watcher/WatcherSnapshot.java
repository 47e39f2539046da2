package logwatcher.watcher;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 引擎状态快照，退出时写入日志
 */
@Data
@Builder
public class WatcherSnapshot {
    private final String activePool;
    private final int windowSize;
    private final int errorCount;
    private final Double errorRate;            // 窗口为空时为 null
    private final long linesRead;
    private final long linesParsed;
    private final Map<AlertType, AlertDispatcher.AlertStats> alertStats;
}
