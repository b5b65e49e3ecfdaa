package io.pipesched.core.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.pipesched.core.host.Host;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableHostStatus.class)
@JsonDeserialize(as = ImmutableHostStatus.class)
public interface HostStatus
{
    @JsonProperty("name")
    String getName();

    @JsonProperty("address")
    String getAddress();

    @JsonProperty("running")
    int getRunningAgents();

    @JsonProperty("max")
    int getMaxAgents();

    static HostStatus of(Host host)
    {
        return ImmutableHostStatus.builder()
            .name(host.getName())
            .address(host.getAddress())
            .runningAgents(host.getRunningAgents())
            .maxAgents(host.getMaxAgents())
            .build();
    }
}
