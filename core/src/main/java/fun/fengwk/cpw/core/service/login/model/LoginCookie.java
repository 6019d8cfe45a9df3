package fun.fengwk.cpw.core.service.login.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Browser cookie in the stored credential shape.
 *
 * @author fengwk
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginCookie(
    String name,
    String value,
    String domain,
    String path,
    Double expires,
    Boolean httpOnly,
    Boolean secure,
    String sameSite
) {
}
