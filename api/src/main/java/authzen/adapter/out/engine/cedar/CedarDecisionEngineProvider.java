package authzen.adapter.out.engine.cedar;

import java.nio.file.Files;
import java.nio.file.Path;

import com.cedarpolicy.BasicAuthorizationEngine;

import authzen.core.port.out.DecisionEngine;
import authzen.spi.DecisionEngineProvider;
import authzen.spi.ProviderConfig;

/**
 * Local Cedar engine over a directory of policy files.
 *
 * <p>Configuration: {@code authzen.engine.cedar.policy-path} - directory of {@code *.cedar} files.
 */
public class CedarDecisionEngineProvider implements DecisionEngineProvider {

    static final String POLICY_PATH_KEY = "authzen.engine.cedar.policy-path";

    @Override
    public String name() {
        return "cedar";
    }

    @Override
    public String description() {
        return "In-process Cedar evaluation of local policy files";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable(ProviderConfig config) {
        return config.get(POLICY_PATH_KEY).map(Path::of).filter(Files::isDirectory).isPresent();
    }

    @Override
    public DecisionEngine create(ProviderConfig config) {
        final var policies = CedarPolicyLoader.load(Path.of(config.getRequired(POLICY_PATH_KEY)));
        return new CedarDecisionEngine(new BasicAuthorizationEngine(), policies);
    }
}
