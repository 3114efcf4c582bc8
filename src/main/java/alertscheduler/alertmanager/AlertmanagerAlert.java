package alertscheduler.alertmanager;

import com.alibaba.fastjson2.annotation.JSONField;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Alertmanager v2 /api/v2/alerts 返回的单条告警
 */
@Data
public class AlertmanagerAlert {
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private String startsAt;
    private String endsAt;
    private Status status;
    private List<Receiver> receivers;
    private String fingerprint;
    @JSONField(name = "generatorURL")
    private String generatorUrl;

    @Data
    public static class Status {
        private String state;
        private List<String> silencedBy;
        private List<String> inhibitedBy;
    }

    @Data
    public static class Receiver {
        private String name;
    }
}
