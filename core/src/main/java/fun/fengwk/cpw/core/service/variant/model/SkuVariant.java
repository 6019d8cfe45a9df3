package fun.fengwk.cpw.core.service.variant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * One sellable option combination of a listing.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SkuVariant {

    /**
     * Resolved sku id, or the selected option signature when the page exposes no sku id.
     */
    private String skuId;

    /**
     * Group and option ids of the selection path, e.g. {@code g0:1627207;g1:20509}.
     */
    private String skuKey;

    /**
     * Readable selection, e.g. {@code 颜色:红色;尺码:M}.
     */
    private String properties;

    @Builder.Default
    private List<OptionSelection> selections = new ArrayList<>();

    private BigDecimal finalPrice;

    private BigDecimal originalPrice;

    private String thumbnail;

}
