package io.pipesched.cli;

import java.util.List;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class DaemonizerTest
{
    @Test
    public void keepsSystemPropertiesAndHeapSettings()
    {
        List<String> options = Daemonizer.jvmOptions(ImmutableList.of(
                    "-Dpipesched.home=/opt/pipesched",
                    "-Xmx512m",
                    "-agentlib:jdwp=transport=dt_socket,server=y,address=5005",
                    "-javaagent:/tmp/agent.jar",
                    "-ea"));

        assertThat(options, contains("-Dpipesched.home=/opt/pipesched", "-Xmx512m"));
    }

    @Test
    public void commandLinePutsJvmOptionsBeforeMainClass()
    {
        List<String> command = Daemonizer.commandLine(ImmutableList.of("-Dfoo=bar"), "-d", "-p", "8080");

        int option = command.indexOf("-Dfoo=bar");
        int mainClass = command.indexOf(Main.class.getName());
        assertThat(option > 0, is(true));
        assertThat(option < mainClass, is(true));
        assertThat(command.subList(mainClass + 1, command.size()), contains("-p", "8080"));
        assertThat(command, not(hasItem("-d")));
    }
}
