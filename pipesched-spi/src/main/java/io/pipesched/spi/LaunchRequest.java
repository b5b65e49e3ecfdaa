package io.pipesched.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface LaunchRequest
{
    long getJobId();

    String getJobType();

    String getCommand();

    String getHostName();

    String getHostAddress();

    String getDirectory();

    @Value.Derived
    default boolean isLocal()
    {
        return "localhost".equals(getHostAddress()) || "127.0.0.1".equals(getHostAddress());
    }

    static ImmutableLaunchRequest.Builder builder()
    {
        return ImmutableLaunchRequest.builder();
    }
}
