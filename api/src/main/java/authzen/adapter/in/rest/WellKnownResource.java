package authzen.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import authzen.adapter.in.dto.WellKnownConfigurationDto;

/**
 * PDP metadata discovery. Endpoint URLs are rooted at the scheme and host the caller used.
 */
@Path("/.well-known/authzen-configuration")
@ApplicationScoped
public class WellKnownResource {

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public WellKnownConfigurationDto configuration(@Context UriInfo uriInfo) {
        var baseUrl = uriInfo.getBaseUri().toString();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return WellKnownConfigurationDto.forBaseUrl(baseUrl);
    }
}
