package fun.fengwk.cpw.core.service.cart.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One cart row, keyed by listing id plus sku id or variant signature.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CartLineItem {

    private String listingId;

    private String skuId;

    /**
     * Space separated variant labels as rendered in the cart row.
     */
    private String skuProperties;

    private String title;

    private String imageUrl;

    private BigDecimal finalPrice;

    private BigDecimal originalPrice;

    private Integer quantity;

    public String mergeKey() {
        String variant = skuId != null && !skuId.isBlank() ? skuId
            : skuProperties == null ? "" : skuProperties.trim();
        return listingId + ":" + variant;
    }

}
