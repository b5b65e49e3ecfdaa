package io.pipesched.core.event;

@FunctionalInterface
public interface EventHandler<T>
{
    void handle(T payload)
        throws Exception;
}
