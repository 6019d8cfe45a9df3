package fun.fengwk.cpw.core.service.cartadd;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface BulkAddListener {

    void onProgress(int total, int current, int success, int failed, String line);

}
