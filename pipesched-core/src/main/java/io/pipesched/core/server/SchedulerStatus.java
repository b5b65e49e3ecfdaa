package io.pipesched.core.server;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Snapshot of the scheduler published after every tick.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSchedulerStatus.class)
@JsonDeserialize(as = ImmutableSchedulerStatus.class)
public interface SchedulerStatus
{
    @JsonProperty("closing")
    boolean isClosing();

    @JsonProperty("lockout")
    boolean isLockout();

    @JsonProperty("heldJobId")
    Optional<Long> getHeldJobId();

    @JsonProperty("pendingJobs")
    int getPendingJobs();

    @JsonProperty("activeJobs")
    int getActiveJobs();

    @JsonProperty("hosts")
    List<HostStatus> getHosts();

    @JsonProperty("agents")
    List<AgentStatus> getAgents();

    static ImmutableSchedulerStatus.Builder builder()
    {
        return ImmutableSchedulerStatus.builder();
    }

    static SchedulerStatus empty()
    {
        return builder()
            .isClosing(false)
            .isLockout(false)
            .pendingJobs(0)
            .activeJobs(0)
            .build();
    }
}
