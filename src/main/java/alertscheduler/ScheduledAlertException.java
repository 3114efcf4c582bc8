package alertscheduler;

/**
 * 定时告警异常基类
 */
public class ScheduledAlertException extends RuntimeException {
    public ScheduledAlertException(String message) {
        super(message);
    }

    public ScheduledAlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
