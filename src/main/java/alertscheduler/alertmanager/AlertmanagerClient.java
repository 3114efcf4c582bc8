package alertscheduler.alertmanager;

import alertscheduler.config.AlertmanagerEndpoint;
import alertscheduler.utils.HttpClients;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager v2 告警查询客户端, 无状态
 */
@Slf4j
public class AlertmanagerClient implements AlertSourceClient {

    private final OkHttpClient client;
    private final String baseUrl;
    private final String username;
    private final String password;

    public AlertmanagerClient(OkHttpClient client, AlertmanagerEndpoint endpoint) {
        this.client = client;
        this.baseUrl = endpoint.getUrl();
        this.username = endpoint.getUsername();
        this.password = endpoint.getPassword();
    }

    /**
     * 每个任务各自创建客户端, 共享同一个 OkHttpClient 连接池
     */
    public static AlertSourceClientFactory factory(OkHttpClient client) {
        return endpoint -> new AlertmanagerClient(client, endpoint);
    }

    public static AlertSourceClientFactory factory() {
        return factory(HttpClients.alertSourceClient());
    }

    @Override
    public List<Alert> fetchFiringAlerts() {
        Request.Builder builder = new Request.Builder()
                .url(alertsUrl())
                .header("Accept", "application/json")
                .get();
        if (StringUtils.isNotEmpty(username) && StringUtils.isNotEmpty(password)) {
            builder.header("Authorization", Credentials.basic(username, password));
        }

        String body;
        try (Response response = client.newCall(builder.build()).execute()) {
            body = HttpClients.bodyOf(response);
            if (!response.isSuccessful()) {
                throw new AlertTransportException(response.code(),
                        "alertmanager returned status " + response.code() + ": " + body);
            }
        } catch (IOException e) {
            throw new AlertTransportException("failed to fetch alerts from " + baseUrl + ": " + e.getMessage(), e);
        }

        List<AlertmanagerAlert> alerts = parseAlerts(body);

        // server side filtering differs across alertmanager versions, keep only active ones
        List<Alert> firing = new ArrayList<>();
        for (AlertmanagerAlert alert : alerts) {
            if (alert != null && alert.getStatus() != null
                    && Alert.STATE_ACTIVE.equals(alert.getStatus().getState())) {
                firing.add(toAlert(alert));
            }
        }
        log.debug("Fetched {} alerts from {}, {} active", alerts.size(), baseUrl, firing.size());
        return firing;
    }

    /**
     * 响应体必须是告警对象数组, labels 和 annotations 的值必须是字符串
     */
    static List<AlertmanagerAlert> parseAlerts(String body) {
        if (StringUtils.isBlank(body)) {
            throw new AlertFormatException("empty response body");
        }
        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException e) {
            throw new AlertFormatException("failed to parse alerts: " + e.getMessage(), e);
        }
        if (!(parsed instanceof JSONArray)) {
            throw new AlertFormatException("expected a JSON array of alerts, got: " + StringUtils.abbreviate(body, 200));
        }

        JSONArray array = (JSONArray) parsed;
        List<AlertmanagerAlert> alerts = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object element = array.get(i);
            if (!(element instanceof JSONObject)) {
                throw new AlertFormatException("alert #" + i + " is not a JSON object");
            }
            JSONObject object = (JSONObject) element;
            requireStringValues(object, "labels", i);
            requireStringValues(object, "annotations", i);
            try {
                alerts.add(object.to(AlertmanagerAlert.class));
            } catch (JSONException e) {
                throw new AlertFormatException("failed to parse alert #" + i + ": " + e.getMessage(), e);
            }
        }
        return alerts;
    }

    private static void requireStringValues(JSONObject alert, String field, int index) {
        Object value = alert.get(field);
        if (value == null) {
            return;
        }
        if (!(value instanceof JSONObject)) {
            throw new AlertFormatException("alert #" + index + ": " + field + " is not an object");
        }
        for (Map.Entry<String, Object> entry : ((JSONObject) value).entrySet()) {
            if (entry.getValue() != null && !(entry.getValue() instanceof String)) {
                throw new AlertFormatException("alert #" + index + ": " + field + "." + entry.getKey()
                        + " is not a string");
            }
        }
    }

    HttpUrl alertsUrl() {
        HttpUrl base = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new AlertTransportException("invalid alertmanager url: " + baseUrl, null);
        }
        return base.newBuilder()
                .addPathSegments("api/v2/alerts")
                .addQueryParameter("active", "true")
                .addQueryParameter("silenced", "false")
                .addQueryParameter("inhibited", "false")
                .build();
    }

    private static Alert toAlert(AlertmanagerAlert source) {
        Alert.AlertBuilder builder = Alert.builder()
                .labels(nullToEmpty(source.getLabels()))
                .annotations(nullToEmpty(source.getAnnotations()))
                .startsAt(parseTime(source.getStartsAt(), source))
                .endsAt(parseTime(source.getEndsAt(), source))
                .state(source.getStatus().getState())
                .silencedBy(nullToEmpty(source.getStatus().getSilencedBy()))
                .inhibitedBy(nullToEmpty(source.getStatus().getInhibitedBy()))
                .fingerprint(source.getFingerprint())
                .generatorUrl(source.getGeneratorUrl());
        if (source.getReceivers() != null) {
            for (AlertmanagerAlert.Receiver receiver : source.getReceivers()) {
                if (receiver != null && receiver.getName() != null) {
                    builder.receiver(receiver.getName());
                }
            }
        }
        return builder.build();
    }

    private static OffsetDateTime parseTime(String value, AlertmanagerAlert source) {
        if (StringUtils.isEmpty(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new AlertFormatException("invalid timestamp '" + value + "' in alert " + source.getFingerprint(), e);
        }
    }

    private static Map<String, String> nullToEmpty(Map<String, String> map) {
        return map == null ? Collections.emptyMap() : map;
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
