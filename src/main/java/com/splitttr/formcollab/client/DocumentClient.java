package com.splitttr.formcollab.client;

import com.splitttr.formcollab.message.FieldOperation;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "form-store")
@Path("/api/forms")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface DocumentClient {

    @GET
    @Path("/{id}")
    DocumentResponse getById(@PathParam("id") String id);

    @POST
    @Path("/{id}/operations")
    void applyOperation(@PathParam("id") String id, FieldOperation operation);
}
