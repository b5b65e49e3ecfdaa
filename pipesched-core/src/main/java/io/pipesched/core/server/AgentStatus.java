package io.pipesched.core.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.pipesched.core.agent.Agent;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableAgentStatus.class)
@JsonDeserialize(as = ImmutableAgentStatus.class)
public interface AgentStatus
{
    @JsonProperty("pid")
    long getPid();

    @JsonProperty("type")
    String getType();

    @JsonProperty("host")
    String getHost();

    @JsonProperty("jobId")
    long getJobId();

    static AgentStatus of(Agent agent)
    {
        return ImmutableAgentStatus.builder()
            .pid(agent.getPid())
            .type(agent.getTemplate().getName())
            .host(agent.getHost().getName())
            .jobId(agent.getJob().getId())
            .build();
    }
}
