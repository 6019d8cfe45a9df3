package fun.fengwk.cpw.core.service.cartadd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SkuAddResult {

    private String skuId;

    private String properties;

    private boolean success;

    /**
     * Already in the cart, nothing was clicked.
     */
    private boolean skipped;

    private int attempts;

    private String error;

}
