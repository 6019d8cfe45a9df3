package fun.fengwk.cpw.core.service.login.model;

import java.util.List;

/**
 * State of the login page at one poll.
 *
 * @param screenshot base64 jpeg, null when the capture failed
 * @author fengwk
 */
public record LoginSnapshot(boolean closed, String url, String screenshot, List<LoginCookie> cookies) {

    public static LoginSnapshot closedPage() {
        return new LoginSnapshot(true, "", null, List.of());
    }

}
