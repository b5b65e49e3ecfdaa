package io.pipesched.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobRequest.class)
@JsonDeserialize(as = ImmutableJobRequest.class)
public interface JobRequest
{
    long getId();

    /**
     * Name of the agent template that runs this job.
     */
    String getType();

    static JobRequest of(long id, String type)
    {
        return ImmutableJobRequest.builder()
            .id(id)
            .type(type)
            .build();
    }
}
