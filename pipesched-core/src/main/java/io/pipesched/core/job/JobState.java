package io.pipesched.core.job;

public enum JobState
{
    PENDING,
    ASSIGNED,
    FINISHED,
    FAILED;

    public boolean isDone()
    {
        return this == FINISHED || this == FAILED;
    }
}
