package io.pipesched.cli;

public class SystemExitException
        extends Exception
{
    public static final int FATAL = -1;
    public static final int USAGE = 1;

    private final int code;

    public SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    public SystemExitException(int code, String message, Throwable cause)
    {
        super(message, cause);
        this.code = code;
    }

    public static SystemExitException systemExit(String errorMessage)
    {
        if (errorMessage != null) {
            return new SystemExitException(USAGE, errorMessage);
        }
        else {
            return new SystemExitException(0, null);
        }
    }

    public static SystemExitException fatal(String errorMessage)
    {
        return new SystemExitException(FATAL, errorMessage);
    }

    public static SystemExitException fatal(String errorMessage, Throwable cause)
    {
        return new SystemExitException(FATAL, errorMessage, cause);
    }

    public int getCode()
    {
        return code;
    }
}
