package fun.fengwk.cpw.core.service.variant;

import fun.fengwk.cpw.core.service.variant.model.OptionGroup;
import fun.fengwk.cpw.core.service.variant.model.PriceQuote;
import fun.fengwk.cpw.core.service.variant.model.VariantOption;

import java.util.List;

/**
 * Page capabilities the variant enumerator drives.
 *
 * @author fengwk
 */
public interface VariantPageDriver {

    List<OptionGroup> listGroups();

    /**
     * Options of the group that are currently selectable. Cascading UIs change this set as
     * earlier groups are chosen, so callers re-read it at every visit.
     */
    List<VariantOption> listEnabledOptions(OptionGroup group);

    /**
     * Click the option and poll until it reports selected.
     *
     * @return false when the selected state never flipped within the timeout
     */
    boolean select(OptionGroup group, VariantOption option);

    /**
     * Currently displayed price, null when none can be read.
     */
    PriceQuote readPrice();

    /**
     * Sku id or selection signature of the current state, null when unresolvable.
     */
    String resolveVariantKey();

    String readThumbnail();

    void pause(long millis);

}
