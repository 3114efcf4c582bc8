package alertscheduler.incident;

import alertscheduler.utils.HttpClients;
import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Map;

/**
 * 以 HTTP POST 方式把事件交给事件服务
 */
@Slf4j
public class HttpIncidentDispatcher implements IncidentDispatcher {

    public static final String SOURCE_HEADER = "X-Incident-Source";

    private static final MediaType JSON_TYPE = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final HttpUrl endpoint;

    public HttpIncidentDispatcher(OkHttpClient client, String endpoint) {
        this.client = client;
        this.endpoint = HttpUrl.parse(endpoint);
        if (this.endpoint == null) {
            throw new IllegalArgumentException("invalid incident endpoint: " + endpoint);
        }
    }

    public HttpIncidentDispatcher(String endpoint) {
        this(HttpClients.dispatchClient(), endpoint);
    }

    @Override
    public void deliver(String sourceTag, IncidentPayload payload, Map<String, String> params) {
        HttpUrl.Builder url = endpoint.newBuilder();
        if (params != null) {
            params.forEach(url::addQueryParameter);
        }
        RequestBody body = RequestBody.create(JSON.toJSONString(payload), JSON_TYPE);
        Request request = new Request.Builder()
                .url(url.build())
                .header(SOURCE_HEADER, sourceTag)
                .post(body)
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DispatchException("incident endpoint returned status " + response.code()
                        + ": " + HttpClients.bodyOf(response));
            }
            log.debug("Incident {} delivered to {}", payload.getGroupKey(), endpoint);
        } catch (IOException e) {
            throw new DispatchException("failed to deliver incident: " + e.getMessage(), e);
        }
    }
}
