package alertscheduler.incident;

import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 未配置事件服务地址时使用, 只记录日志
 */
@Slf4j
public class LoggingIncidentDispatcher implements IncidentDispatcher {

    @Override
    public void deliver(String sourceTag, IncidentPayload payload, Map<String, String> params) {
        log.info("Incident from '{}' with params {}: {}", sourceTag, params, JSON.toJSONString(payload));
    }
}
