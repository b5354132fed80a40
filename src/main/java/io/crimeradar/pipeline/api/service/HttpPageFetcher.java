package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.exception.ErrorCategory;
import io.crimeradar.pipeline.api.exception.PageFetchException;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Blocking HTTP GET shared by feed ingestion and article text extraction.
 * Every failure is reported as a {@link PageFetchException} carrying its
 * {@link ErrorCategory}.
 */
@Component
public class HttpPageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpPageFetcher.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final PipelineConfig pipelineConfig;

    public HttpPageFetcher(PipelineConfig pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    public String fetch(String url, String accept) throws PageFetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw new PageFetchException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            connection = (HttpURLConnection) URI.create(url.trim()).toURL().openConnection();
            configureConnection(connection, accept);
            connection.connect();

            validateHttpResponse(connection, url);

            return readBody(connection);

        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new PageFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new PageFetchException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new PageFetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new PageFetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new PageFetchException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new PageFetchException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection, String accept) {
        connection.setConnectTimeout(pipelineConfig.http().connectTimeout());
        connection.setReadTimeout(pipelineConfig.http().readTimeout());

        connection.setRequestProperty("User-Agent", getNextUserAgent());
        connection.setRequestProperty("Accept", accept);
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9,pt-BR;q=0.8");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, PageFetchException {
        int responseCode = connection.getResponseCode();

        if (responseCode >= 400) {
            ErrorCategory category = ErrorCategory.fromStatus(responseCode);
            throw new PageFetchException(
                    String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                    category
            );
        }
        logger.debug("Fetched {} ({}, {})", url, responseCode, connection.getContentType());
    }

    private String readBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();

        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        try (InputStream in = inputStream) {
            return new String(in.readAllBytes(), charsetOf(connection.getContentType()));
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String trimmed = part.trim().toLowerCase(Locale.ROOT);
                if (trimmed.startsWith("charset=")) {
                    try {
                        return Charset.forName(trimmed.substring("charset=".length()).replace("\"", ""));
                    } catch (IllegalArgumentException e) {
                        logger.debug("Unsupported charset in '{}', using UTF-8", contentType);
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private String getNextUserAgent() {
        List<String> userAgents = pipelineConfig.http().userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }
}
