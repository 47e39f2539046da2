package logwatcher.watcher;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.Optional;

/**
 * 一行访问日志解析后的记录，处理完即丢弃
 */
@Builder
public class LogRecord {

    private final String pool;
    private final String release;
    private final String upstreamStatus;
    private final String upstreamAddr;
    private final String requestTime;
    private final String upstreamResponseTime;

    @Getter
    private final String rawLine;

    /**
     * 由解析结果构建记录，缺失的字段保持为空
     */
    public static LogRecord fromFields(Map<String, String> fields, String rawLine) {
        return LogRecord.builder()
                .pool(fields.get(LineParser.POOL))
                .release(fields.get(LineParser.RELEASE))
                .upstreamStatus(fields.get(LineParser.UPSTREAM_STATUS))
                .upstreamAddr(fields.get(LineParser.UPSTREAM_ADDR))
                .requestTime(fields.get(LineParser.REQUEST_TIME))
                .upstreamResponseTime(fields.get(LineParser.UPSTREAM_RESPONSE_TIME))
                .rawLine(rawLine)
                .build();
    }

    /**
     * 解析一行日志，没有任何可识别字段时返回 empty
     */
    public static Optional<LogRecord> parse(String line) {
        return LineParser.parse(line).map(fields -> fromFields(fields, line));
    }

    public Optional<String> getPool() {
        return Optional.ofNullable(pool);
    }

    public Optional<String> getRelease() {
        return Optional.ofNullable(release);
    }

    public Optional<String> getUpstreamStatus() {
        return Optional.ofNullable(upstreamStatus);
    }

    public Optional<String> getUpstreamAddr() {
        return Optional.ofNullable(upstreamAddr);
    }

    public Optional<String> getRequestTime() {
        return Optional.ofNullable(requestTime);
    }

    public Optional<String> getUpstreamResponseTime() {
        return Optional.ofNullable(upstreamResponseTime);
    }
}
