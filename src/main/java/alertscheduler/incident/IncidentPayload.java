package alertscheduler.incident;

import com.alibaba.fastjson2.annotation.JSONField;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 与告警来源无关的事件载荷
 */
@Data
public class IncidentPayload {
    public static final String RECEIVER = "scheduled-alert";
    public static final String STATUS_FIRING = "firing";
    public static final String GROUP_KEY_PREFIX = "scheduled-";

    private String receiver;
    private String status;
    private List<IncidentAlert> alerts = new ArrayList<>();
    private Map<String, String> commonLabels;
    private Map<String, String> commonAnnotations;
    @JSONField(name = "externalURL")
    private String externalUrl;
    // synthetic, never an upstream alertmanager group
    private String groupKey;

    @JSONField(name = "scheduled_job")
    private String scheduledJob;
    @JSONField(name = "scheduled_time")
    private String scheduledTime;
}
