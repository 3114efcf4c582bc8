package alertscheduler.scheduler;

import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

/**
 * 调度表达式解析: 标准五段 cron, 带秒的六段 cron, @daily 等宏, 以及 "HH:MM" 简写
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * "09:05" -> "5 9 * * *"
     */
    public static String parseSimpleSchedule(String simpleTime) {
        String[] parts = simpleTime == null ? new String[0] : simpleTime.trim().split(":", -1);
        if (parts.length != 2 || !StringUtils.isNumeric(parts[0]) || !StringUtils.isNumeric(parts[1])) {
            throw new ScheduleConfigException("invalid time format '" + simpleTime + "', expected HH:MM");
        }

        String hour = StringUtils.defaultIfEmpty(StringUtils.stripStart(parts[0], "0"), "0");
        String minute = StringUtils.defaultIfEmpty(StringUtils.stripStart(parts[1], "0"), "0");

        // minute hour * * *, every day at the given time
        return minute + " " + hour + " * * *";
    }

    public static CronExpression resolve(String schedule) {
        if (StringUtils.isBlank(schedule)) {
            throw new ScheduleConfigException("schedule is required");
        }
        String expression = schedule.trim();
        if (expression.contains(":")) {
            expression = parseSimpleSchedule(expression);
        }
        String springExpression = toSpringCron(expression);
        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new ScheduleConfigException("invalid cron expression '" + schedule + "': " + e.getMessage(), e);
        }
    }

    static String toSpringCron(String expression) {
        if (expression.startsWith("@")) {
            return expression;
        }
        String[] fields = StringUtils.split(expression);
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        throw new ScheduleConfigException("invalid cron expression '" + expression
                + "': expected 5 fields, or 6 with seconds");
    }
}
