package com.splitttr.coedit.client;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Document service API. A collaboration session is keyed by the same document path
 * the document service uses as its id, so the path is passed through unchanged.
 */
@RegisterRestClient(configKey = "document-service")
@Path("/api/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface DocumentClient {

    @GET
    @Path("/{path}")
    DocumentResponse fetch(@PathParam("path") String documentPath);

    @PUT
    @Path("/{path}")
    DocumentResponse saveContent(@PathParam("path") String documentPath, DocumentUpdateRequest request);
}
