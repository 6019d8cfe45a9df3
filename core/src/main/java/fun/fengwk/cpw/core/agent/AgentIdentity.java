package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Persisted agent credentials.
 *
 * @author fengwk
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentIdentity(String agentId, String token, String hubUrl) {
}
