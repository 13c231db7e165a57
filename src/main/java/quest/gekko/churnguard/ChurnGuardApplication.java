package quest.gekko.churnguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChurnGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurnGuardApplication.class, args);
    }
}
