package io.pipesched.core.event;

/**
 * A named hook point. The type parameter is the payload handed to handlers.
 */
public final class Event<T>
{
    public static <T> Event<T> named(String name)
    {
        return new Event<>(name);
    }

    private final String name;

    private Event(String name)
    {
        this.name = name;
    }

    public String getName()
    {
        return name;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
