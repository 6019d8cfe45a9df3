package fun.fengwk.cpw.core.service.variant.model;

import java.math.BigDecimal;

/**
 * Displayed price at one moment. {@code token} is the raw extracted text used for stability checks.
 *
 * @author fengwk
 */
public record PriceQuote(String token, BigDecimal finalPrice, BigDecimal originalPrice) {
}
