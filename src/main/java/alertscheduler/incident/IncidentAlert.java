package alertscheduler.incident;

import com.alibaba.fastjson2.annotation.JSONField;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 事件中的单条告警, 与 Alertmanager webhook 格式一致
 */
@Value
@Builder
public class IncidentAlert {
    String status;
    Map<String, String> labels;
    Map<String, String> annotations;
    String startsAt;
    String endsAt;
    String fingerprint;
    @JSONField(name = "generatorURL")
    String generatorUrl;
}
