package alertscheduler.scheduler;

import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;

@Value
public class CronTaskDescriptor {
    String name;
    CronExpression expression;
    ZoneId zone;
}
