package alertscheduler.scheduler;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SchedulerStatusController {

    private final AlertScheduler alertScheduler;

    public SchedulerStatusController(AlertScheduler alertScheduler) {
        this.alertScheduler = alertScheduler;
    }

    @GetMapping("/api/scheduler/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (!alertScheduler.isEnabled()) {
            body.put("status", "disabled");
            body.put("message", "Scheduled alerts are not enabled");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        body.put("status", "enabled");
        body.put("jobs", alertScheduler.status());
        return ResponseEntity.ok(body);
    }
}
