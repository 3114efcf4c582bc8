package alertscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertSchedulerApplication.class, args);
    }

}
