package fun.fengwk.cpw.core.service.variant.model;

/**
 * @author fengwk
 */
public record VariantOption(String id, String label) {
}
