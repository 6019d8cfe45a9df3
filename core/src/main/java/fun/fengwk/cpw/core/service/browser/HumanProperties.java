package fun.fengwk.cpw.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pacing of simulated user input.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.human")
public class HumanProperties {

    /**
     * When false pages are driven directly, without mouse paths or think time.
     */
    private boolean enabled = true;

    /**
     * Multiplier applied to every think-time delay.
     */
    private double delayScale = 1.0;

    /**
     * Chance of an idle mouse wander at a wander point.
     */
    private double wanderChance = 0.15;

    private int scrollStepPx = 20;

    private int mouseSteps = 20;

}
