package authzen.adapter.out.entity.dynamodb;

import java.net.URI;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;

import authzen.adapter.out.entity.CedarSchemaReader;
import authzen.core.port.out.EntityProvider;
import authzen.core.service.ParentClosure;
import authzen.spi.EntityProviderFactory;
import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * DynamoDB entity provider.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code authzen.entities.dynamodb.table-name} - entity table (required)</li>
 *   <li>{@code authzen.entities.dynamodb.region} - AWS region, SDK default chain when unset</li>
 *   <li>{@code authzen.entities.dynamodb.endpoint-override} - endpoint URI (e.g. DynamoDB Local)</li>
 *   <li>{@code authzen.entities.schema-path} - Cedar JSON schema for action search</li>
 *   <li>{@code authzen.entities.parent-hops} - parent rounds, -1 for the full closure</li>
 * </ul>
 */
public class DynamoDbEntityProviderFactory implements EntityProviderFactory {

    private static final Logger LOG = Logger.getLogger(DynamoDbEntityProviderFactory.class);

    static final String TABLE_NAME_KEY = "authzen.entities.dynamodb.table-name";
    static final String REGION_KEY = "authzen.entities.dynamodb.region";
    static final String ENDPOINT_KEY = "authzen.entities.dynamodb.endpoint-override";
    static final String PARENT_HOPS_KEY = "authzen.entities.parent-hops";

    @Override
    public String name() {
        return "dynamodb";
    }

    @Override
    public String description() {
        return "DynamoDB entity table with batched lookups";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable(ProviderConfig config) {
        return config.get(TABLE_NAME_KEY).isPresent();
    }

    @Override
    public EntityProvider create(ProviderConfig config) {
        final var tableName = config.getRequired(TABLE_NAME_KEY);
        final int parentHops = config.getInt(PARENT_HOPS_KEY).orElse(ParentClosure.UNLIMITED);
        final var schema = new CedarSchemaReader(new ObjectMapper()).load(config);

        final var builder = DynamoDbAsyncClient.builder().httpClientBuilder(NettyNioAsyncHttpClient.builder());
        config.get(REGION_KEY).ifPresent(region -> builder.region(Region.of(region)));
        try {
            config.get(ENDPOINT_KEY).ifPresent(uri -> builder.endpointOverride(URI.create(uri)));
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Invalid " + ENDPOINT_KEY, e);
        }

        LOG.infof("Using DynamoDB entity table %s (parent hops: %d)", tableName, parentHops);
        return new DynamoDbEntityProvider(builder.build(), tableName, schema, parentHops);
    }
}
