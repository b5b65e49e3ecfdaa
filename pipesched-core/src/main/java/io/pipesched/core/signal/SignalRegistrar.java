package io.pipesched.core.signal;

/**
 * Installs process-wide OS signal handlers.
 */
public interface SignalRegistrar
{
    /**
     * @param signalName name without the SIG prefix, for example "TERM"
     * @return false if the runtime refused the signal
     */
    boolean register(String signalName, Runnable handler);
}
