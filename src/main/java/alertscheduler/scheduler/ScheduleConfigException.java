package alertscheduler.scheduler;

import alertscheduler.ScheduledAlertException;

/**
 * 调度配置错误, 启动阶段出现即终止
 */
public class ScheduleConfigException extends ScheduledAlertException {
    public ScheduleConfigException(String message) {
        super(message);
    }

    public ScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
