package alertscheduler.config;

import alertscheduler.alertmanager.AlertmanagerClient;
import alertscheduler.incident.HttpIncidentDispatcher;
import alertscheduler.incident.IncidentDispatcher;
import alertscheduler.incident.IncidentPayloadBuilder;
import alertscheduler.incident.LoggingIncidentDispatcher;
import alertscheduler.scheduler.AlertScheduler;
import alertscheduler.scheduler.TaskSchedulerCronEngine;
import alertscheduler.scheduler.ScheduleConfigException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AlertSchedulerConfiguration {

    @Bean
    public ScheduledAlertConfig scheduledAlertConfig(SchedulerSettings settings) {
        ScheduledAlertConfig config = ScheduledAlertConfig.load(settings.getConfigPath());
        log.info("Loaded scheduled alert config from {}: enable={}, {} jobs",
                settings.getConfigPath(), config.isEnable(), config.getJobs().size());
        return config;
    }

    @Bean
    public IncidentDispatcher incidentDispatcher(SchedulerSettings settings) {
        if (StringUtils.isBlank(settings.getDispatchUrl())) {
            log.warn("scheduledalert.dispatch.url is not set, incidents will only be logged");
            return new LoggingIncidentDispatcher();
        }
        return new HttpIncidentDispatcher(settings.getDispatchUrl());
    }

    @Bean(destroyMethod = "stop")
    public AlertScheduler alertScheduler(ScheduledAlertConfig config,
                                         IncidentDispatcher incidentDispatcher,
                                         SchedulerSettings settings) {
        AlertScheduler scheduler = new AlertScheduler(
                config,
                new TaskSchedulerCronEngine(settings.getWorkerCoreSize()),
                AlertmanagerClient.factory(),
                new IncidentPayloadBuilder(),
                incidentDispatcher);
        try {
            scheduler.start();
        } catch (ScheduleConfigException e) {
            // one invalid job aborts startup, no job is left registered
            log.error("Failed to start scheduler", e);
            scheduler.stop();
            throw e;
        }
        return scheduler;
    }
}
