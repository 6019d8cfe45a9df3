package fun.fengwk.cpw.cli.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Coordinator: agent hub endpoint, pairing api and scrape scheduler.
 *
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = {
    "fun.fengwk.cpw.cli.coordinator",
    "fun.fengwk.cpw.core.hub",
    "fun.fengwk.cpw.core.scheduler",
    "fun.fengwk.cpw.core.service",
    "fun.fengwk.cpw.core.facade"
})
public class CliCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliCoordinatorApplication.class, args);
    }

}
