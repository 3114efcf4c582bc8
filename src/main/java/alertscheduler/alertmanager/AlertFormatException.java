package alertscheduler.alertmanager;

import alertscheduler.ScheduledAlertException;

/**
 * 告警源返回内容无法解析
 */
public class AlertFormatException extends ScheduledAlertException {
    public AlertFormatException(String message) {
        super(message);
    }

    public AlertFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
