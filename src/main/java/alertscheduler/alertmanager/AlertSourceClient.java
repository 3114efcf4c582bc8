package alertscheduler.alertmanager;

import java.util.List;

/**
 * 告警源客户端
 */
public interface AlertSourceClient {

    /**
     * 拉取当前处于 active 状态的告警
     *
     * @throws AlertTransportException 网络错误或非2xx响应
     * @throws AlertFormatException    响应内容无法解析
     */
    List<Alert> fetchFiringAlerts();
}
