package io.pipesched.core.lock;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.function.LongPredicate;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pipesched.core.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Locale.ENGLISH;

/**
 * Single-instance lock.
 *
 * The token is a file holding the owner's pid as fixed-width text. The pid
 * is written to a temporary file first and published with a hard link, which
 * fails if the token exists, so two instances starting at the same time can't
 * both own it and nobody sees a half-written token. A token whose pid is
 * invalid or no longer alive is removed when found.
 */
public class ProcessLock
{
    private static final Logger logger = LoggerFactory.getLogger(ProcessLock.class);

    public static final String TOKEN_NAME = "pipesched";
    private static final int TOKEN_WIDTH = 10;
    private static final int EMPTY_TOKEN_RETRIES = 20;
    private static final long EMPTY_TOKEN_WAIT_MILLIS = 100;

    private final Path token;
    private final long selfPid;
    private final LongPredicate liveness;
    private boolean released = false;

    @Inject
    public ProcessLock(SchedulerConfig config)
    {
        this(config.getLockDirectory().resolve(TOKEN_NAME), ProcessHandle.current().pid(), ProcessLock::isAlive);
    }

    @VisibleForTesting
    public ProcessLock(Path token, long selfPid, LongPredicate liveness)
    {
        this.token = token;
        this.selfPid = selfPid;
        this.liveness = liveness;
    }

    public Path getTokenPath()
    {
        return token;
    }

    public long getSelfPid()
    {
        return selfPid;
    }

    /**
     * Takes the lock.
     *
     * @return pid of the owner after this call, which is {@link #getSelfPid()}
     *         on success or the pid of another live instance
     * @throws IOException if the token can't be created or written
     */
    public synchronized long acquire()
        throws IOException
    {
        long owner = queryOwner();
        if (owner != 0) {
            return owner;
        }
        if (!createToken()) {
            // another instance created it between our check and create
            owner = queryOwner();
            if (owner != 0) {
                return owner;
            }
            if (!createToken()) {
                owner = queryOwner();
                if (owner != 0) {
                    return owner;
                }
                throw new IOException("Failed to create scheduler lock " + token + ": token keeps reappearing");
            }
        }
        released = false;
        logger.debug("Acquired scheduler lock {} as pid {}", token, selfPid);
        return selfPid;
    }

    /**
     * Returns the pid of the live owner, or 0 if nobody holds the lock.
     * Invalid and stale tokens are removed.
     */
    public synchronized long queryOwner()
        throws IOException
    {
        Optional<String> read = readToken();
        if (!read.isPresent()) {
            return 0;
        }
        String content = read.get();

        long pid;
        try {
            pid = Long.parseLong(content);
        }
        catch (NumberFormatException ex) {
            pid = 0;
        }

        if (pid < 2) {
            logger.warn("Removing invalid scheduler lock {} (content '{}')", token, content);
            removeIfUnchanged(content);
            return 0;
        }

        if (pid == selfPid || liveness.test(pid)) {
            return pid;
        }

        logger.warn("Removing stale scheduler lock {} held by dead process {}", token, pid);
        removeIfUnchanged(content);
        return 0;
    }

    // An empty token is being written by a process using plain create-then-write.
    // It is given some time before it counts as invalid.
    private Optional<String> readToken()
        throws IOException
    {
        for (int i = 0; ; i++) {
            String content;
            try {
                content = new String(Files.readAllBytes(token), US_ASCII).trim();
            }
            catch (NoSuchFileException ex) {
                return Optional.absent();
            }
            if (!content.isEmpty() || i >= EMPTY_TOKEN_RETRIES) {
                return Optional.of(content);
            }
            logger.debug("Scheduler lock {} is empty, waiting for its owner to write it", token);
            try {
                Thread.sleep(EMPTY_TOKEN_WAIT_MILLIS);
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while reading scheduler lock " + token);
            }
        }
    }

    private void removeIfUnchanged(String content)
        throws IOException
    {
        byte[] current;
        try {
            current = Files.readAllBytes(token);
        }
        catch (NoSuchFileException ex) {
            return;
        }
        // another instance may have replaced it since we read it
        if (new String(current, US_ASCII).trim().equals(content)) {
            Files.deleteIfExists(token);
        }
    }

    /**
     * Removes the token if this process owns it. Calling it again is a no-op.
     */
    public synchronized void release()
        throws IOException
    {
        if (released) {
            return;
        }
        long owner;
        try {
            owner = Long.parseLong(new String(Files.readAllBytes(token), US_ASCII).trim());
        }
        catch (NoSuchFileException ex) {
            released = true;
            return;
        }
        catch (NumberFormatException ex) {
            owner = 0;
        }
        if (owner != selfPid) {
            logger.warn("Not releasing scheduler lock {} owned by pid {}", token, owner);
            return;
        }
        Files.deleteIfExists(token);
        released = true;
        logger.debug("Released scheduler lock {}", token);
    }

    /**
     * Removes the token regardless of its owner. Used after the owner was
     * asked to terminate.
     */
    public synchronized void forceRelease()
        throws IOException
    {
        Files.deleteIfExists(token);
    }

    /**
     * Publishes a token holding our pid.
     *
     * @return false if a token already exists
     */
    private boolean createToken()
        throws IOException
    {
        byte[] content = String.format(ENGLISH, "%-" + TOKEN_WIDTH + "d", selfPid).getBytes(US_ASCII);
        Path dir = token.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, TOKEN_NAME + ".", ".tmp");
        try {
            Files.write(tmp, content);
            Files.createLink(token, tmp);
            return true;
        }
        catch (FileAlreadyExistsException ex) {
            return false;
        }
        finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean isAlive(long pid)
    {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
