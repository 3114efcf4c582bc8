package alertscheduler.scheduler;

import alertscheduler.ScheduledAlertException;
import alertscheduler.alertmanager.Alert;
import alertscheduler.alertmanager.AlertFormatException;
import alertscheduler.alertmanager.AlertSourceClient;
import alertscheduler.alertmanager.AlertSourceClientFactory;
import alertscheduler.alertmanager.AlertTransportException;
import alertscheduler.alertmanager.LabelMatcher;
import alertscheduler.config.ScheduledAlertConfig;
import alertscheduler.config.ScheduledJob;
import alertscheduler.incident.ChannelParams;
import alertscheduler.incident.DispatchException;
import alertscheduler.incident.IncidentDispatcher;
import alertscheduler.incident.IncidentPayload;
import alertscheduler.incident.IncidentPayloadBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 定时告警调度器: 按各任务的 cron 拉取 Alertmanager 中的告警, 过滤后转换为事件并投递。
 * <p>
 * 单次触发中的任何失败只记录日志并结束本次触发, 任务保持调度, 等待下一次自然触发。
 */
@Slf4j
public class AlertScheduler {

    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ScheduledAlertConfig config;
    private final List<ScheduledJob> jobs;
    private final CronEngine engine;
    private final AlertSourceClientFactory clientFactory;
    private final IncidentPayloadBuilder payloadBuilder;
    private final IncidentDispatcher dispatcher;
    private final JobRegistry registry = new JobRegistry();
    private final Map<String, CronTaskHandle> handles = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ZoneId zone = ZoneId.systemDefault();

    public AlertScheduler(ScheduledAlertConfig config,
                          CronEngine engine,
                          AlertSourceClientFactory clientFactory,
                          IncidentPayloadBuilder payloadBuilder,
                          IncidentDispatcher dispatcher) {
        this.config = config;
        this.jobs = config.getJobs() == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(config.getJobs()));
        this.engine = engine;
        this.clientFactory = clientFactory;
        this.payloadBuilder = payloadBuilder;
        this.dispatcher = dispatcher;
    }

    /**
     * 注册所有启用的任务。任一任务的调度配置无效时不注册任何任务并抛出异常。
     */
    public void start() {
        if (!config.isEnable()) {
            log.info("Scheduled alerts are disabled");
            return;
        }
        if (stopped.get()) {
            throw new IllegalStateException("scheduler is stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler is already started");
        }

        zone = resolveZone(config.getTimezone());

        // validate every schedule before any timer starts
        List<Map.Entry<ScheduledJob, CronExpression>> resolved = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (!job.isEnable()) {
                log.info("Job '{}' is disabled, skipping", job.getName());
                continue;
            }
            resolved.add(Map.entry(job, resolveSchedule(job)));
        }

        for (Map.Entry<ScheduledJob, CronExpression> entry : resolved) {
            addJob(entry.getKey(), entry.getValue());
        }

        log.info("Scheduler started with {} jobs", registry.size());
        for (JobStatus status : registry.snapshot()) {
            log.info("Job '{}' next run: {}", status.getName(), formatTime(status.getNextRun()));
        }
    }

    /**
     * 停止调度, 等待正在执行的触发结束。重复调用无副作用。
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        engine.stop();
        registry.deactivateAll();
        log.info("Scheduler stopped");
    }

    public List<JobStatus> status() {
        return registry.snapshot();
    }

    public boolean isEnabled() {
        return config.isEnable();
    }

    public ZoneId getZone() {
        return zone;
    }

    private CronExpression resolveSchedule(ScheduledJob job) {
        if (StringUtils.isBlank(job.getName())) {
            throw new ScheduleConfigException("job name is required");
        }
        if (StringUtils.isBlank(job.getSchedule())) {
            throw new ScheduleConfigException("failed to add job '" + job.getName()
                    + "': schedule is required for job '" + job.getName() + "'");
        }
        try {
            return CronSchedules.resolve(job.getSchedule());
        } catch (ScheduleConfigException e) {
            throw new ScheduleConfigException("failed to add job '" + job.getName() + "': " + e.getMessage(), e);
        }
    }

    private void addJob(ScheduledJob job, CronExpression expression) {
        String name = job.getName();
        AlertSourceClient client = clientFactory.create(job.getAlertmanager());
        CronTaskHandle handle = engine.register(
                new CronTaskDescriptor(name, expression, zone),
                (taskHandle, triggerTime) -> fire(job, client, taskHandle, triggerTime));

        CronTaskHandle previous = handles.put(name, handle);
        if (previous != null) {
            engine.cancel(previous);
            log.warn("Job '{}' is defined more than once, the last definition wins", name);
        }
        registry.register(name, engine.nextRun(handle));
        log.info("Added scheduled job '{}' with schedule '{}'", name, job.getSchedule());
    }

    void fire(ScheduledJob job, AlertSourceClient client, CronTaskHandle handle, Instant triggerTime) {
        String name = job.getName();
        registry.recordFiring(name, engine.prevRun(handle), engine.nextRun(handle));
        try {
            runJob(job, client, triggerTime);
        } catch (AlertTransportException | AlertFormatException e) {
            log.error("Error fetching alerts for job '{}': {}", name, e.getMessage(), e);
        } catch (DispatchException e) {
            log.error("Error sending scheduled alert for job '{}': {}", name, e.getMessage(), e);
        } catch (ScheduledAlertException e) {
            log.error("Job '{}' failed: {}", name, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Job '{}' failed unexpectedly", name, e);
        } finally {
            registry.recordIdle(name);
        }
    }

    private void runJob(ScheduledJob job, AlertSourceClient client, Instant triggerTime) {
        String name = job.getName();
        log.info("Running scheduled job: {}", name);

        List<Alert> alerts = client.fetchFiringAlerts();
        log.info("Job '{}': fetched {} firing alerts from Alertmanager", name, alerts.size());

        List<Alert> matched = LabelMatcher.filter(alerts, job.getMatchLabels());
        log.info("Job '{}': {} alerts matched label filters", name, matched.size());

        Optional<IncidentPayload> built = payloadBuilder.build(matched);
        if (built.isEmpty()) {
            log.info("Job '{}': no alerts matched, skipping notification", name);
            return;
        }

        IncidentPayload payload = built.get();
        payload.setScheduledJob(name);
        payload.setScheduledTime(triggerTime.atZone(zone).format(IncidentPayloadBuilder.RFC3339));

        Map<String, String> params = ChannelParams.from(job);
        dispatcher.deliver(IncidentDispatcher.SOURCE_SCHEDULED, payload, params);
        log.info("Job '{}': successfully sent {} alerts to notification channels", name, matched.size());
    }

    static ZoneId resolveZone(String timezone) {
        if (StringUtils.isBlank(timezone)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}', using local timezone: {}", timezone, e.getMessage());
            return ZoneId.systemDefault();
        }
    }

    private String formatTime(Instant time) {
        return time == null ? "never" : time.atZone(zone).format(LOG_TIME);
    }
}
