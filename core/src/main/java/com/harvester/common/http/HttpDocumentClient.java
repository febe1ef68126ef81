package com.harvester.common.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * {@link DocumentClient} on top of HttpURLConnection.
 */
public class HttpDocumentClient implements DocumentClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpDocumentClient.class);
    private static final int MAX_REDIRECTS = 5;

    private final String userAgent;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public HttpDocumentClient(String userAgent, int connectTimeoutMs, int readTimeoutMs) {
        this.userAgent = userAgent;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public FetchedDocument get(String url) throws TransportException {
        HttpURLConnection conn = null;
        try {
            conn = open(url);
            int status = conn.getResponseCode();
            String finalUrl = conn.getURL().toString();

            InputStream in = (status >= 400) ? conn.getErrorStream() : conn.getInputStream();
            String body = "";
            if (in != null) {
                if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
                    in = new GZIPInputStream(in);
                }
                try (InputStream stream = in) {
                    body = new String(stream.readAllBytes(), charsetOf(conn.getContentType()));
                }
            }
            return new FetchedDocument(finalUrl, status, body, headersOf(conn));
        } catch (TransportException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new TransportException(url, e);
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    @Override
    public void download(String url, Path target) throws IOException {
        HttpURLConnection conn = null;
        Path partial = null;
        try {
            try {
                conn = open(url);
                int status = conn.getResponseCode();
                if (status < 200 || status >= 300) {
                    throw new TransportException(url, status);
                }
            } catch (TransportException e) {
                throw e;
            } catch (IOException | IllegalArgumentException e) {
                throw new TransportException(url, e);
            }

            Path dir = target.toAbsolutePath().getParent();
            partial = Files.createTempFile(dir, target.getFileName().toString(), ".part");
            try (InputStream in = openBody(conn, url);
                 OutputStream out = Files.newOutputStream(partial)) {
                byte[] buffer = new byte[8192];
                int count;
                while ((count = read(in, buffer, url)) != -1) {
                    out.write(buffer, 0, count);
                }
            }
            moveIntoPlace(partial, target);
        } finally {
            if (partial != null) Files.deleteIfExists(partial);
            if (conn != null) conn.disconnect();
        }
    }

    private HttpURLConnection open(String url) throws IOException {
        String current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HttpURLConnection conn = (HttpURLConnection) URI.create(current).toURL().openConnection();
            conn.setRequestMethod("GET");
            conn.setRequestProperty("User-Agent", userAgent);
            conn.setRequestProperty("Accept-Encoding", "gzip");
            conn.setConnectTimeout(connectTimeoutMs);
            conn.setReadTimeout(readTimeoutMs);
            // Followed manually so that http -> https hops work too
            conn.setInstanceFollowRedirects(false);

            int status = conn.getResponseCode();
            if (!isRedirect(status)) {
                return conn;
            }
            String location = conn.getHeaderField("Location");
            conn.disconnect();
            if (location == null) {
                throw new TransportException(current, status);
            }
            logger.debug("Redirect {} -> {}", current, location);
            current = URI.create(current).resolve(location).toString();
        }
        throw new TransportException(url, new IOException("Too many redirects (" + MAX_REDIRECTS + ")"));
    }

    private InputStream openBody(HttpURLConnection conn, String url) throws TransportException {
        try {
            InputStream in = conn.getInputStream();
            if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
                in = new GZIPInputStream(in);
            }
            return in;
        } catch (IOException e) {
            throw new TransportException(url, e);
        }
    }

    private int read(InputStream in, byte[] buffer, String url) throws TransportException {
        try {
            return in.read(buffer);
        } catch (IOException e) {
            throw new TransportException(url, e);
        }
    }

    private void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static Map<String, String> headersOf(HttpURLConnection conn) {
        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, List<String>> e : conn.getHeaderFields().entrySet()) {
            if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) continue;
            headers.put(e.getKey().toLowerCase(), e.getValue().get(0));
        }
        return headers;
    }

    private static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String p = part.trim();
                if (p.toLowerCase().startsWith("charset=")) {
                    try {
                        return Charset.forName(p.substring("charset=".length()).replace("\"", "").trim());
                    } catch (Exception e) {
                        logger.debug("Unknown charset in '{}', falling back to UTF-8", contentType);
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
