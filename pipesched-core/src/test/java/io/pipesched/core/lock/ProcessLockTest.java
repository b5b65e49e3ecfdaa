package io.pipesched.core.lock;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class ProcessLockTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path token;

    @Before
    public void setUp()
    {
        token = folder.getRoot().toPath().resolve(ProcessLock.TOKEN_NAME);
    }

    private static String read(Path path)
        throws Exception
    {
        return new String(Files.readAllBytes(path), US_ASCII);
    }

    @Test
    public void acquireAndRelease()
        throws Exception
    {
        ProcessLock lock = new ProcessLock(token, 1234, pid -> false);

        assertThat(lock.queryOwner(), is(0L));
        assertThat(lock.acquire(), is(1234L));
        assertThat(read(token), is("1234      "));
        assertThat(lock.queryOwner(), is(1234L));

        lock.release();
        assertThat(Files.exists(token), is(false));
        assertThat(lock.queryOwner(), is(0L));

        assertThat(lock.acquire(), is(1234L));
        lock.release();
        assertThat(Files.exists(token), is(false));
    }

    @Test
    public void releaseIsIdempotent()
        throws Exception
    {
        ProcessLock lock = new ProcessLock(token, 1234, pid -> false);
        lock.acquire();
        lock.release();

        // another instance took the lock after us
        ProcessLock other = new ProcessLock(token, 5678, pid -> false);
        assertThat(other.acquire(), is(5678L));

        lock.release();
        assertThat(read(token).trim(), is("5678"));
    }

    @Test
    public void tokenBeingWrittenByAnotherInstanceIsNotTaken()
        throws Exception
    {
        OutputStream out = Files.newOutputStream(token, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(300);
                out.write("4242      ".getBytes(US_ASCII));
                out.close();
            }
            catch (Exception ex) {
                throw new RuntimeException(ex);
            }
        });
        writer.start();

        ProcessLock lock = new ProcessLock(token, 5555, pid -> true);
        long owner = lock.acquire();
        writer.join();

        assertThat(owner, is(4242L));
        assertThat(read(token).trim(), is("4242"));
    }

    @Test
    public void abandonedEmptyTokenIsReplaced()
        throws Exception
    {
        Files.createFile(token);
        ProcessLock lock = new ProcessLock(token, 1234, pid -> true);

        assertThat(lock.acquire(), is(1234L));
        assertThat(read(token).trim(), is("1234"));
    }

    @Test
    public void acquireLeavesOnlyTheToken()
        throws Exception
    {
        ProcessLock lock = new ProcessLock(token, 1234, pid -> false);
        lock.acquire();

        try (Stream<Path> files = Files.list(folder.getRoot().toPath())) {
            assertThat(files.collect(Collectors.toList()), contains(token));
        }
    }

    @Test
    public void liveOwnerKeepsTheLock()
        throws Exception
    {
        Files.write(token, "5678      ".getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 1234, pid -> pid == 5678);

        assertThat(lock.queryOwner(), is(5678L));
        assertThat(lock.acquire(), is(5678L));
        assertThat(read(token).trim(), is("5678"));

        lock.release();
        assertThat(Files.exists(token), is(true));
    }

    @Test
    public void staleTokenIsReplaced()
        throws Exception
    {
        Files.write(token, "5678      ".getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 1234, pid -> false);

        assertThat(lock.acquire(), is(1234L));
        assertThat(read(token).trim(), is("1234"));
    }

    @Test
    public void invalidTokenIsRemoved()
        throws Exception
    {
        Files.write(token, "garbage".getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 1234, pid -> true);

        assertThat(lock.queryOwner(), is(0L));
        assertThat(Files.exists(token), is(false));
    }

    @Test
    public void tokenBelowTwoIsInvalid()
        throws Exception
    {
        Files.write(token, "1".getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 1234, pid -> true);

        assertThat(lock.queryOwner(), is(0L));
        assertThat(Files.exists(token), is(false));
    }

    @Test
    public void forceReleaseRemovesAnyToken()
        throws Exception
    {
        Files.write(token, "5678      ".getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 1234, pid -> true);

        lock.forceRelease();

        assertThat(Files.exists(token), is(false));
    }

    @Test
    public void currentProcessIsAlive()
        throws Exception
    {
        long self = ProcessHandle.current().pid();
        Files.write(token, Long.toString(self).getBytes(US_ASCII));
        ProcessLock lock = new ProcessLock(token, 2, ProcessLockTest::alive);

        assertThat(lock.queryOwner(), is(self));
    }

    private static boolean alive(long pid)
    {
        return ProcessHandle.of(pid).isPresent();
    }
}
