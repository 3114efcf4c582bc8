package alertscheduler.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Component
public class SchedulerSettings {

    @Value("${scheduledalert.config.path}")
    private String configPath;

    // empty: incidents are only logged
    @Value("${scheduledalert.dispatch.url:}")
    private String dispatchUrl;

    @Value("${scheduledalert.worker.core-size:10}")
    private int workerCoreSize;
}
