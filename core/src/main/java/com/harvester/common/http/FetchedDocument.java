package com.harvester.common.http;

import java.util.Map;

/**
 * Response of a document GET.
 *
 * @param url     final URL after redirects
 * @param status  HTTP status code
 * @param body    decoded body, empty if the server sent none
 * @param headers response headers, lower case names, first value only
 */
public record FetchedDocument(
        String url,
        int status,
        String body,
        Map<String, String> headers
) {
    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase());
    }
}
