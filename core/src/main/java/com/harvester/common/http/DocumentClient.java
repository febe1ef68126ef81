package com.harvester.common.http;

import java.io.IOException;
import java.nio.file.Path;

public interface DocumentClient {

    /**
     * GET a document, following redirects. Non-success statuses are returned, not thrown.
     *
     * @throws TransportException if no response could be obtained
     */
    FetchedDocument get(String url) throws TransportException;

    /**
     * GET a binary resource and store it at {@code target}. The file only appears
     * once the body was received completely.
     *
     * @throws TransportException on transport failure or a non-success status
     * @throws IOException        if the local write fails
     */
    void download(String url, Path target) throws IOException;
}
