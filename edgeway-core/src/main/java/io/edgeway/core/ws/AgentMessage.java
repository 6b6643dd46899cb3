package io.edgeway.core.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentMessage(
    String type,
    String action,
    @JsonProperty("agent_type") String agentType,
    String pillar,
    String message,
    @JsonProperty("conversation_id") String conversationId,
    Map<String, Object> metadata
) {
    public static final String HEARTBEAT_TYPE = "heartbeat";
    public static final String LIAISON_AGENT = "liaison";
    public static final String UNKNOWN_AGENT = "unknown";

    public static AgentMessage of(String agentType, String message) {
        return new AgentMessage(null, null, agentType, null, message, null, null);
    }

    public boolean isHeartbeat() {
        return HEARTBEAT_TYPE.equalsIgnoreCase(type);
    }

    public boolean isPong() {
        return isHeartbeat() && "pong".equalsIgnoreCase(action);
    }

    public boolean isPing() {
        return isHeartbeat() && "ping".equalsIgnoreCase(action);
    }

    public String agentTypeOrUnknown() {
        return agentType == null || agentType.isBlank() ? UNKNOWN_AGENT : agentType;
    }

    public String validationError() {
        if (message == null || message.isBlank()) {
            return "Missing 'message' field";
        }
        if (LIAISON_AGENT.equalsIgnoreCase(agentType) && (pillar == null || pillar.isBlank())) {
            return "'pillar' is required for liaison agent messages";
        }
        return null;
    }
}
