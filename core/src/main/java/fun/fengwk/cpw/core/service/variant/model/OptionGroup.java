package fun.fengwk.cpw.core.service.variant.model;

/**
 * One option group of the selector UI, e.g. color or size.
 *
 * @author fengwk
 */
public record OptionGroup(String id, String name) {
}
