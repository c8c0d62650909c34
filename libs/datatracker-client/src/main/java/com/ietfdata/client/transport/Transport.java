package com.ietfdata.client.transport;

import com.ietfdata.model.error.FetchException;
import com.ietfdata.model.error.NotFoundException;

/**
 * Retrieves raw documents from the Datatracker.
 *
 * <p>This is the only way the rest of the client talks to the network. Implementations are
 * stateless with respect to callers and may be shared between threads.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Fetches the document at a relative path.
     *
     * @param path path plus optional query string, e.g. {@code /api/v1/person/person/?name=x}
     * @return the raw response body
     * @throws NotFoundException if the service reports the resource absent
     * @throws FetchException    on timeouts, connection failures and non-success status codes
     */
    String fetch(String path);
}
