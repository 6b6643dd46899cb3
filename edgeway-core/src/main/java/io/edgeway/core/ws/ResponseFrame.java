package io.edgeway.core.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseFrame(
    String type,
    String message,
    @JsonProperty("agent_type") String agentType,
    String pillar,
    @JsonProperty("conversation_id") String conversationId,
    Map<String, Object> data,
    Object visualization,
    String action
) {
    public static final String RESPONSE = "response";
    public static final String ERROR = "error";
    public static final String SYSTEM = "system";
    public static final String HEARTBEAT = "heartbeat";

    public static ResponseFrame response(String message, AgentMessage inbound) {
        return new ResponseFrame(
            RESPONSE,
            message,
            inbound == null ? null : inbound.agentType(),
            inbound == null ? null : inbound.pillar(),
            inbound == null ? null : inbound.conversationId(),
            null,
            null,
            null
        );
    }

    public static ResponseFrame error(String message, AgentMessage inbound) {
        return new ResponseFrame(
            ERROR,
            message,
            inbound == null ? AgentMessage.UNKNOWN_AGENT : inbound.agentTypeOrUnknown(),
            inbound == null ? null : inbound.pillar(),
            inbound == null ? null : inbound.conversationId(),
            null,
            null,
            null
        );
    }

    public static ResponseFrame system(String message, Map<String, Object> data) {
        return new ResponseFrame(SYSTEM, message, null, null, null, data, null, null);
    }

    public static ResponseFrame heartbeat(String action) {
        return new ResponseFrame(HEARTBEAT, null, null, null, null, null, null, action);
    }

    public ResponseFrame withDefaultsFrom(AgentMessage inbound) {
        if (inbound == null) {
            return this;
        }
        return new ResponseFrame(
            type == null || type.isBlank() ? RESPONSE : type,
            message,
            agentType == null ? inbound.agentType() : agentType,
            pillar == null ? inbound.pillar() : pillar,
            conversationId == null ? inbound.conversationId() : conversationId,
            data,
            visualization,
            action
        );
    }
}
