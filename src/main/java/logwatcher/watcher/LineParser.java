package logwatcher.watcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 访问日志行解析器 - 从一行日志中提取 key:value 字段
 *
 * <p>每个字段单独匹配，字段缺失或顺序变化时只丢失对应字段，不影响整行。
 * 字段值从 {@code name:} 之后开始，到下一个以空白分隔的 {@code key:} 标记或行尾为止。</p>
 */
public final class LineParser {

    public static final String POOL = "pool";
    public static final String RELEASE = "release";
    public static final String UPSTREAM_STATUS = "upstream_status";
    public static final String UPSTREAM_ADDR = "upstream_addr";
    public static final String REQUEST_TIME = "request_time";
    public static final String UPSTREAM_RESPONSE_TIME = "upstream_response_time";

    public static final List<String> FIELDS = List.of(
            POOL, RELEASE, UPSTREAM_STATUS, UPSTREAM_ADDR, REQUEST_TIME, UPSTREAM_RESPONSE_TIME);

    private static final Map<String, Pattern> FIELD_PATTERNS = compilePatterns();

    private LineParser() {
    }

    /**
     * 解析一行日志
     *
     * @return 找到的字段（已去除首尾空白）；一个字段都没有时返回 empty
     */
    public static Optional<Map<String, String>> parse(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> entry : FIELD_PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(line);
            if (matcher.find()) {
                fields.put(entry.getKey(), matcher.group(1).trim());
            }
        }

        if (fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableMap(fields));
    }

    private static Map<String, Pattern> compilePatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String field : FIELDS) {
            // 标记前必须是行首或空白，值在下一个 " key:" 之前结束
            patterns.put(field, Pattern.compile(
                    "(?:^|\\s)" + Pattern.quote(field) + ":(.*?)(?=\\s+[A-Za-z_]\\w*:|$)"));
        }
        return Collections.unmodifiableMap(patterns);
    }
}
