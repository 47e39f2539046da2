package logwatcher.watcher;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 上游状态码分类 - 判断是否为 5xx 服务端错误
 *
 * <p>nginx 在重试多个上游时会写出 "500, 304" 这样的多值字段，只要有一个 5xx 即视为错误。</p>
 */
public final class ServerErrorClassifier {

    private static final Pattern STATUS_TOKEN = Pattern.compile("(?<!\\d)\\d{3}(?!\\d)");

    private ServerErrorClassifier() {
    }

    public static boolean isServerError(String status) {
        if (StringUtils.isBlank(status)) {
            return false;
        }

        Matcher matcher = STATUS_TOKEN.matcher(status);
        while (matcher.find()) {
            int code = Integer.parseInt(matcher.group());
            if (code >= 500 && code < 600) {
                return true;
            }
        }
        return false;
    }
}
