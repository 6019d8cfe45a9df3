package fun.fengwk.cpw.core.service.variant.model;

/**
 * @author fengwk
 */
public record OptionSelection(String groupId, String groupName, String optionId, String optionLabel) {
}
