package fun.fengwk.cpw.cli.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Remote agent: connects to the hub and serves scrape calls with its own browser sessions.
 *
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = {
    "fun.fengwk.cpw.cli.agent",
    "fun.fengwk.cpw.core.agent",
    "fun.fengwk.cpw.core.hub.protocol",
    "fun.fengwk.cpw.core.service"
})
public class CliAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliAgentApplication.class, args);
    }

}
