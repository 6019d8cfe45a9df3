package fun.fengwk.cpw.core.service.cart.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CartCollectResult {

    @Builder.Default
    private List<CartLineItem> items = new ArrayList<>();

    /**
     * Item count shown by the cart page header, null when the page exposed none.
     */
    private Integer uiTotalCount;

    private CollectStopReason stopReason;

    /**
     * Heuristic explanation of a non-converged stop.
     */
    private String diagnosis;

    private int rounds;

    @Builder.Default
    private List<String> missingExpectedIds = new ArrayList<>();

    public Set<String> distinctListingIds() {
        return items.stream().map(CartLineItem::getListingId).collect(Collectors.toSet());
    }

}
