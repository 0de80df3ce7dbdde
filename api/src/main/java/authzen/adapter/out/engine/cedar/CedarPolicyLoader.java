package authzen.adapter.out.engine.cedar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import com.cedarpolicy.model.policy.Policy;
import com.cedarpolicy.model.policy.PolicySet;
import org.jboss.logging.Logger;

import authzen.spi.ProviderException;

/**
 * Loads the {@code *.cedar} files of a directory, one policy per file.
 *
 * <p>The file name is the policy id, so it is what decisions report as their reason.
 */
final class CedarPolicyLoader {

    private static final Logger LOG = Logger.getLogger(CedarPolicyLoader.class);

    static final String POLICY_EXTENSION = ".cedar";

    private CedarPolicyLoader() {}

    static PolicySet load(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ProviderException("Cedar policy path is not a directory: " + directory);
        }
        final List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(POLICY_EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ProviderException("Failed to list Cedar policies in " + directory, e);
        }

        final Set<Policy> policies = new HashSet<>();
        for (final var file : files) {
            try {
                policies.add(new Policy(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString()));
            } catch (IOException e) {
                throw new ProviderException("Failed to read Cedar policy " + file, e);
            }
        }
        LOG.infof("Loaded %d Cedar policies from %s", policies.size(), directory);
        return new PolicySet(policies);
    }
}
