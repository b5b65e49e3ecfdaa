package io.pipesched.core.host;

import java.nio.file.Path;
import java.util.List;
import com.google.common.base.Splitter;
import io.pipesched.core.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface HostDefinition
{
    String LOCALHOST = "localhost";

    String getName();

    String getAddress();

    String getDirectory();

    int getMaxAgents();

    static HostDefinition of(String name, String address, String directory, int maxAgents)
    {
        return ImmutableHostDefinition.builder()
            .name(name)
            .address(address)
            .directory(directory)
            .maxAgents(maxAgents)
            .build();
    }

    /**
     * Parses "address directory max". A localhost entry always runs agents
     * from the local agent directory.
     */
    static HostDefinition parse(String name, String value, Path localAgentDirectory)
    {
        List<String> fields = Splitter.on(' ').omitEmptyStrings().trimResults().splitToList(value);
        if (fields.size() != 3) {
            throw new ConfigException("Host '" + name + "' must be '<address> <directory> <max>' but got '" + value + "'");
        }
        int max;
        try {
            max = Integer.parseInt(fields.get(2));
        }
        catch (NumberFormatException ex) {
            throw new ConfigException("Host '" + name + "' has invalid max agents '" + fields.get(2) + "'", ex);
        }
        if (max < 0) {
            throw new ConfigException("Host '" + name + "' has negative max agents " + max);
        }
        String address = fields.get(0);
        String directory = LOCALHOST.equals(address) ? localAgentDirectory.toString() : fields.get(1);
        return of(name, address, directory, max);
    }
}
