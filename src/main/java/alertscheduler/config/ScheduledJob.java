package alertscheduler.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个定时任务配置
 */
@Data
public class ScheduledJob {
    private String name;
    private boolean enable;
    // cron expression or "HH:MM"
    private String schedule;
    private AlertmanagerEndpoint alertmanager = new AlertmanagerEndpoint();
    // all labels must match exactly
    private Map<String, String> matchLabels = new LinkedHashMap<>();
    private ChannelOverrides channels = new ChannelOverrides();
    private Boolean oncallEnable;
}
