package com.splitttr.coedit.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link DocumentStorage} backed by the document service REST API.
 */
@ApplicationScoped
public class RestDocumentStorage implements DocumentStorage {

    private static final Logger LOG = Logger.getLogger(RestDocumentStorage.class);

    @Inject
    @RestClient
    DocumentClient documentClient;

    @Override
    public String loadContent(String documentPath) {
        try {
            DocumentResponse doc = documentClient.fetch(documentPath);
            if (doc == null) {
                throw new StorageUnavailableException("Document service returned no body for " + documentPath, null);
            }
            LOG.debugf("Loaded %s (version %d) from document service", documentPath, doc.version());
            return doc.content() == null ? "" : doc.content();
        } catch (WebApplicationException | ProcessingException e) {
            throw new StorageUnavailableException("Failed to load document " + documentPath, e);
        }
    }

    @Override
    public void persistContent(String documentPath, String content, String userId) {
        try {
            documentClient.saveContent(documentPath, new DocumentUpdateRequest(null, content, userId));
        } catch (WebApplicationException | ProcessingException e) {
            throw new StorageUnavailableException("Failed to persist document " + documentPath, e);
        }
    }
}
