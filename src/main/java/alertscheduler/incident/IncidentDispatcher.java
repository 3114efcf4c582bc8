package alertscheduler.incident;

import java.util.Map;

/**
 * 事件投递入口, 渠道分发与值班升级由下游负责
 */
public interface IncidentDispatcher {

    String SOURCE_SCHEDULED = "scheduled";

    /**
     * @param sourceTag 事件来源标识
     * @param payload   事件载荷
     * @param params    渠道覆盖参数, 至少包含 oncall_enable
     * @throws DispatchException 投递失败
     */
    void deliver(String sourceTag, IncidentPayload payload, Map<String, String> params);
}
