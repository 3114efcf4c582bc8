package alertscheduler.incident;

import alertscheduler.ScheduledAlertException;

/**
 * 事件投递失败
 */
public class DispatchException extends ScheduledAlertException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
