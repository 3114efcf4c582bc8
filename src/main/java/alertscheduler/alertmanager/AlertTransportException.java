package alertscheduler.alertmanager;

import alertscheduler.ScheduledAlertException;
import lombok.Getter;

/**
 * 请求告警源失败: 网络错误或非2xx响应
 */
@Getter
public class AlertTransportException extends ScheduledAlertException {

    /** -1 when no response was received */
    private final int statusCode;

    public AlertTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public AlertTransportException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
