package fun.fengwk.cpw.core.service.cart.model;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * @author fengwk
 */
@Data
@Builder
public class CartCollectRequest {

    /**
     * Listing ids the caller expects to find, empty when unknown.
     */
    @Builder.Default
    private Set<String> expectedListingIds = Set.of();

}
