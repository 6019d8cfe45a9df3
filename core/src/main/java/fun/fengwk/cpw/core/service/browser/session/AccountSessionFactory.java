package fun.fengwk.cpw.core.service.browser.session;

/**
 * Builds a fresh account session from credential material.
 *
 * @author fengwk
 */
public interface AccountSessionFactory {

    AccountBrowserSession create(String accountId, String credential, String credentialFingerprint);

}
