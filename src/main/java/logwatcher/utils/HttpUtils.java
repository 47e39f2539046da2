package logwatcher.utils;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

public class HttpUtils {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private HttpUtils() {
    }

    /**
     * 创建连接、读、写共用同一超时的客户端
     */
    public static OkHttpClient newClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .writeTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
    }

    /**
     * POST JSON，非 2xx 响应抛出 IOException
     *
     * @return 响应体文本
     */
    public static String postJson(OkHttpClient client, String url, Map<String, String> headers,
                                  String jsonBody) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(jsonBody, JSON));
        if (headers != null && !headers.isEmpty()) {
            builder.headers(Headers.of(headers));
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String result = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Unexpected code " + response.code() + ": " + result);
            }
            return result;
        }
    }
}
