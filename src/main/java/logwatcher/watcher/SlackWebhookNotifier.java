package logwatcher.watcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import logwatcher.utils.HttpUtils;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack incoming webhook 告警实现
 */
public class SlackWebhookNotifier implements Notifier {
    private static final Logger logger = LoggerFactory.getLogger(SlackWebhookNotifier.class);

    static final String USERNAME = "log-watcher";
    static final String ICON_EMOJI = ":rotating_light:";

    private final String webhookUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SlackWebhookNotifier(String webhookUrl, Duration timeout, Clock clock) {
        this.webhookUrl = webhookUrl;
        this.httpClient = HttpUtils.newClient(timeout);
        this.objectMapper = new ObjectMapper();
        this.clock = clock;

        validate();
    }

    @Override
    public boolean deliver(String title, String body) {
        try {
            send(title, body);
            logger.info("Slack告警已发送: {}", title);
            return true;
        } catch (AlertException e) {
            logger.error("发送Slack告警失败: {}", title, e);
            return false;
        }
    }

    private void send(String title, String body) throws AlertException {
        try {
            String content = buildPayload(title, body);
            String response = HttpUtils.postJson(httpClient, webhookUrl, null, content);
            logger.debug("Webhook响应: {}", response);
        } catch (IOException e) {
            throw new AlertException("Webhook请求失败: " + e.getMessage(), e);
        }
    }

    /**
     * 构建 Slack attachment 格式的消息体
     */
    String buildPayload(String title, String body) throws AlertException {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("fallback", title + " - " + body);
        attachment.put("color", "danger");
        attachment.put("title", title);
        attachment.put("text", body);
        attachment.put("ts", clock.instant().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", USERNAME);
        payload.put("icon_emoji", ICON_EMOJI);
        payload.put("attachments", List.of(attachment));

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AlertException("序列化告警内容失败", e);
        }
    }

    private void validate() {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("Webhook URL不能为空");
        }
        if (HttpUrl.parse(webhookUrl) == null) {
            throw new IllegalArgumentException("无效的Webhook URL: " + webhookUrl);
        }
    }
}
