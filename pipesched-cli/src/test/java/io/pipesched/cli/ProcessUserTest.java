package io.pipesched.cli;

import java.io.IOException;
import java.nio.file.FileSystems;
import io.pipesched.core.config.SchedulerConfig;
import org.junit.Assume;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ProcessUserTest
{
    private final ProcessUser processUser = new ProcessUser();

    @Test
    public void noUserConfigured()
        throws Exception
    {
        processUser.check(SchedulerConfig.defaultBuilder().build());
    }

    @Test
    public void currentUserPasses()
        throws Exception
    {
        String user = System.getProperty("user.name");
        try {
            FileSystems.getDefault().getUserPrincipalLookupService().lookupPrincipalByName(user);
        }
        catch (IOException ex) {
            Assume.assumeNoException("current user has no passwd entry", ex);
        }
        processUser.check(SchedulerConfig.defaultBuilder()
                .user(System.getProperty("user.name"))
                .build());
    }

    @Test
    public void unknownUserIsFatal()
    {
        try {
            processUser.check(SchedulerConfig.defaultBuilder()
                    .user("pipesched-no-such-user")
                    .build());
            fail();
        }
        catch (SystemExitException ex) {
            assertThat(ex.getCode(), is(SystemExitException.FATAL));
            assertThat(ex.getMessage(), containsString("pipesched-no-such-user"));
        }
    }

    @Test
    public void unknownGroupIsFatal()
    {
        try {
            processUser.check(SchedulerConfig.defaultBuilder()
                    .group("pipesched-no-such-group")
                    .build());
            fail();
        }
        catch (SystemExitException ex) {
            assertThat(ex.getCode(), is(SystemExitException.FATAL));
        }
    }
}
