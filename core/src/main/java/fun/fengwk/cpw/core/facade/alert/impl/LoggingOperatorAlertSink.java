package fun.fengwk.cpw.core.facade.alert.impl;

import fun.fengwk.cpw.core.facade.alert.OperatorAlertSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class LoggingOperatorAlertSink implements OperatorAlertSink {

    @Override
    public void alert(String title, String detail) {
        log.warn("operator alert, title={}, detail={}", title, detail);
    }

}
