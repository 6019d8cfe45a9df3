package fun.fengwk.cpw.core.service.cartadd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BulkAddResult {

    private String listingId;

    private int totalSkus;

    private int successCount;

    private int failedCount;

    private int skippedCount;

    /**
     * Times the operation paused at a safe point for another operation on the account.
     */
    private int pauses;

    @Builder.Default
    private List<SkuAddResult> results = new ArrayList<>();

    private long durationMs;

}
