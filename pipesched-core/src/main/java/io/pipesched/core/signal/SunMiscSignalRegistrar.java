package io.pipesched.core.signal;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

public class SunMiscSignalRegistrar
        implements SignalRegistrar
{
    private static final Logger logger = LoggerFactory.getLogger(SunMiscSignalRegistrar.class);

    @Inject
    public SunMiscSignalRegistrar()
    { }

    @Override
    public boolean register(String signalName, Runnable handler)
    {
        try {
            Signal.handle(new Signal(signalName), (sig) -> handler.run());
            return true;
        }
        catch (IllegalArgumentException ex) {
            // the JVM reserves some signals, SIGQUIT unless -Xrs is set
            logger.warn("Can't install a handler for SIG{}: {}", signalName, ex.getMessage());
            return false;
        }
    }
}
