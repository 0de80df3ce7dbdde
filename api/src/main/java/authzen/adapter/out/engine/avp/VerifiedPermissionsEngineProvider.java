package authzen.adapter.out.engine.avp;

import java.net.URI;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.verifiedpermissions.VerifiedPermissionsAsyncClient;

import authzen.adapter.out.entity.CedarEntityJson;
import authzen.core.port.out.DecisionEngine;
import authzen.spi.DecisionEngineProvider;
import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * Amazon Verified Permissions engine.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code authzen.engine.verified-permissions.policy-store-id} - policy store (required)</li>
 *   <li>{@code authzen.engine.verified-permissions.region} - AWS region, SDK default chain when unset</li>
 *   <li>{@code authzen.engine.verified-permissions.endpoint-override} - endpoint URI</li>
 * </ul>
 */
public class VerifiedPermissionsEngineProvider implements DecisionEngineProvider {

    private static final Logger LOG = Logger.getLogger(VerifiedPermissionsEngineProvider.class);

    static final String POLICY_STORE_KEY = "authzen.engine.verified-permissions.policy-store-id";
    static final String REGION_KEY = "authzen.engine.verified-permissions.region";
    static final String ENDPOINT_KEY = "authzen.engine.verified-permissions.endpoint-override";

    @Override
    public String name() {
        return "verified-permissions";
    }

    @Override
    public String description() {
        return "Amazon Verified Permissions policy store";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean isAvailable(ProviderConfig config) {
        return config.get(POLICY_STORE_KEY).isPresent();
    }

    @Override
    public DecisionEngine create(ProviderConfig config) {
        final var policyStoreId = config.getRequired(POLICY_STORE_KEY);

        final var builder =
                VerifiedPermissionsAsyncClient.builder().httpClientBuilder(NettyNioAsyncHttpClient.builder());
        config.get(REGION_KEY).ifPresent(region -> builder.region(Region.of(region)));
        try {
            config.get(ENDPOINT_KEY).ifPresent(uri -> builder.endpointOverride(URI.create(uri)));
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Invalid " + ENDPOINT_KEY, e);
        }

        LOG.infof("Using Verified Permissions policy store %s", policyStoreId);
        return new VerifiedPermissionsDecisionEngine(
                builder.build(), policyStoreId, new CedarEntityJson(new ObjectMapper()));
    }
}
