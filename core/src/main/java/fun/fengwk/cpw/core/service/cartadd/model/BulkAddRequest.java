package fun.fengwk.cpw.core.service.cartadd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BulkAddRequest {

    private String listingId;

    /**
     * Variant labels already in the cart for this listing, null reads them from the cart first.
     */
    private Set<String> existingSkuProperties;

    /**
     * Overrides the configured variant limit when set.
     */
    private Integer maxSkus;

}
