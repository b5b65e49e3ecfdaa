package io.pipesched.cli;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.attribute.UserPrincipalLookupService;
import java.nio.file.attribute.UserPrincipalNotFoundException;
import io.pipesched.core.config.SchedulerConfig;

import static io.pipesched.cli.SystemExitException.fatal;

/**
 * Checks that the scheduler runs as the configured user and that the
 * configured group exists. A JVM can't switch its own identity, so the
 * scheduler must be started as that user.
 */
class ProcessUser
{
    private final UserPrincipalLookupService lookup;
    private final String currentUser;

    ProcessUser()
    {
        this(FileSystems.getDefault().getUserPrincipalLookupService(), System.getProperty("user.name"));
    }

    ProcessUser(UserPrincipalLookupService lookup, String currentUser)
    {
        this.lookup = lookup;
        this.currentUser = currentUser;
    }

    void check(SchedulerConfig config)
        throws SystemExitException
    {
        if (config.getGroup().isPresent()) {
            String group = config.getGroup().get();
            try {
                lookup.lookupPrincipalByGroupName(group);
            }
            catch (UserPrincipalNotFoundException ex) {
                throw fatal("Group '" + group + "' does not exist");
            }
            catch (IOException | UnsupportedOperationException ex) {
                throw fatal("Failed to look up group '" + group + "'", ex);
            }
        }

        if (config.getUser().isPresent()) {
            String user = config.getUser().get();
            try {
                lookup.lookupPrincipalByName(user);
            }
            catch (UserPrincipalNotFoundException ex) {
                throw fatal("User '" + user + "' does not exist");
            }
            catch (IOException ex) {
                throw fatal("Failed to look up user '" + user + "'", ex);
            }
            if (!user.equals(currentUser)) {
                throw fatal("Scheduler must run as user '" + user + "' but runs as '" + currentUser + "'");
            }
        }
    }
}
