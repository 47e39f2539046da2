package logwatcher.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("LineParser 测试")
class LineParserTest {

    private static final String FULL_LINE = "172.18.0.1 - - [19/Oct/2026:10:00:00 +0000] \"GET /version HTTP/1.1\" 200 "
            + "pool:blue release:blue-v1.0.0 upstream_status:200 upstream_addr:172.18.0.3:3000 "
            + "request_time:0.004 upstream_response_time:0.003";

    @Test
    @DisplayName("完整日志行解析出全部六个字段")
    void shouldParseAllFields() {
        Map<String, String> fields = LineParser.parse(FULL_LINE).orElseThrow();

        assertThat(fields).containsExactly(
                entry("pool", "blue"),
                entry("release", "blue-v1.0.0"),
                entry("upstream_status", "200"),
                entry("upstream_addr", "172.18.0.3:3000"),
                entry("request_time", "0.004"),
                entry("upstream_response_time", "0.003"));
    }

    @Test
    @DisplayName("字段顺序变化不影响解析")
    void shouldParseReorderedFields() {
        Optional<Map<String, String>> fields = LineParser.parse(
                "upstream_status:502 request_time:1.2 pool:green");

        assertThat(fields).hasValueSatisfying(map -> assertThat(map)
                .containsOnly(
                        entry("upstream_status", "502"),
                        entry("request_time", "1.2"),
                        entry("pool", "green")));
    }

    @Test
    @DisplayName("只返回实际出现的字段，缺失字段不补默认值")
    void shouldOmitMissingFields() {
        Map<String, String> fields = LineParser.parse("GET / 200 pool:blue").orElseThrow();

        assertThat(fields).containsOnlyKeys("pool");
    }

    @Test
    @DisplayName("多值状态码保留逗号和空格，到下一个字段为止")
    void shouldKeepMultiValueStatus() {
        Map<String, String> fields = LineParser.parse(
                "pool:green upstream_status:500, 200 upstream_addr:172.18.0.3:3000, 172.18.0.4:3000 request_time:0.5")
                .orElseThrow();

        assertThat(fields)
                .containsEntry("upstream_status", "500, 200")
                .containsEntry("upstream_addr", "172.18.0.3:3000, 172.18.0.4:3000")
                .containsEntry("request_time", "0.5");
    }

    @Test
    @DisplayName("字段值首尾空白被去除")
    void shouldTrimValues() {
        Map<String, String> fields = LineParser.parse("pool:  blue   release: v2  ").orElseThrow();

        assertThat(fields)
                .containsEntry("pool", "blue")
                .containsEntry("release", "v2");
    }

    @Test
    @DisplayName("未知字段作为值的结束标记")
    void shouldStopAtUnknownKey() {
        Map<String, String> fields = LineParser.parse("pool:blue host:example.com upstream_status:200")
                .orElseThrow();

        assertThat(fields)
                .containsEntry("pool", "blue")
                .containsEntry("upstream_status", "200");
    }

    @Test
    @DisplayName("字段名必须以空白或行首开头")
    void shouldNotMatchFieldNameInsideOtherToken() {
        assertThat(LineParser.parse("subpool:blue prerelease:v1")).isEmpty();
    }

    @Test
    @DisplayName("行尾空字段被识别为空字符串")
    void shouldReturnEmptyValueForBareMarker() {
        Map<String, String> fields = LineParser.parse("upstream_status:200 pool:").orElseThrow();

        assertThat(fields)
                .containsEntry("pool", "")
                .containsEntry("upstream_status", "200");
    }

    @Test
    @DisplayName("不含任何字段的行返回 empty")
    void shouldReturnEmptyWhenNoFieldMatches() {
        assertThat(LineParser.parse("127.0.0.1 - - \"GET / HTTP/1.1\" 200 612")).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", ":::", "pool", "\u0000�", "upstream_status", "key:value other:thing"})
    @DisplayName("任意输入都不抛异常")
    void shouldNeverThrow(String line) {
        assertThatCode(() -> LineParser.parse(line)).doesNotThrowAnyException();
    }
}
