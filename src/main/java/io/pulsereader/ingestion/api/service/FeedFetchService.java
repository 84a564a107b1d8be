package io.pulsereader.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.pulsereader.ingestion.api.exception.ErrorCategory;
import io.pulsereader.ingestion.api.exception.FeedFetchException;
import io.pulsereader.ingestion.api.util.LinkCanonicalizer;
import io.pulsereader.ingestion.config.HttpConfig;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.domain.FeedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Fetches a single RSS or Atom feed and turns its entries into {@link FeedItem}s.
 * One call to {@link #fetch(String)} issues at most one HTTP request; nothing is retried.
 */
@Service
public class FeedFetchService {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetchService.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final HttpConfig http;
    private final Clock clock;

    public FeedFetchService(IngestionConfig config, Clock clock) {
        this.http = config.http();
        this.clock = clock;
    }

    /**
     * Fetch and parse a feed.
     *
     * @param url feed URL
     * @return parsed items, or a failure with its category; never throws
     */
    public FeedFetchResult fetch(String url) {
        try {
            List<FeedItem> items = fetchWithErrorHandling(url);
            logger.info("Fetched feed {}: {} items", url, items.size());
            return FeedFetchResult.success(items);

        } catch (FeedFetchException e) {
            logFailure(url, e);
            return FeedFetchResult.failure(e.getMessage(), e.getCategory(), e.isRequestIssued());

        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching feed {}: {}", url, e.getMessage(), e);
            return FeedFetchResult.failure("Unexpected error: " + e.getMessage(), ErrorCategory.UNKNOWN, true);
        }
    }

    private List<FeedItem> fetchWithErrorHandling(String url) throws FeedFetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.isBlank()) {
                throw new FeedFetchException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            URI uri = new URI(url.trim());
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw new FeedFetchException("Unsupported URL scheme: " + url, ErrorCategory.INVALID_URL);
            }

            connection = (HttpURLConnection) uri.toURL().openConnection();
            configureConnection(connection);
            connection.connect();

            validateHttpResponse(connection, url);

            return parseFeed(readBody(connection), connection.getContentType());

        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new FeedFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedFetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedFetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedFetchException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(http.connectTimeout());
        connection.setReadTimeout(http.readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                return;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedFetchException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedFetchException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedFetchException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new FeedFetchException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedFetchException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedFetchException("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode < 200 || responseCode >= 300) {
                    throw new FeedFetchException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                            responseCode >= 500 ? ErrorCategory.SERVER_ERROR : ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    private byte[] readBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();
        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }
        try (InputStream in = inputStream) {
            return in.readAllBytes();
        }
    }

    List<FeedItem> parseFeed(byte[] body, String contentType) throws FeedFetchException {
        if (body.length == 0) {
            throw new FeedFetchException("Empty response body", ErrorCategory.PARSE_ERROR);
        }

        SyndFeed feed;
        try (XmlReader reader = openReader(body, contentType)) {
            feed = new SyndFeedInput().build(reader);
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedFetchException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading feed: " + e.getMessage(), e, ErrorCategory.IO_ERROR);
        }

        if (feed == null) {
            throw new FeedFetchException("Feed is null", ErrorCategory.PARSE_ERROR);
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed has no entries");
            return List.of();
        }

        Instant fetchedAt = clock.instant();
        return feed.getEntries().stream()
                .map(entry -> convertToItem(entry, fetchedAt))
                .filter(Objects::nonNull)
                .toList();
    }

    private XmlReader openReader(byte[] body, String contentType) throws IOException {
        InputStream in = new ByteArrayInputStream(body);
        return contentType == null ? new XmlReader(in) : new XmlReader(in, contentType, true);
    }

    private FeedItem convertToItem(SyndEntry entry, Instant fetchedAt) {
        if (entry == null) {
            return null;
        }

        String title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";
        Optional<String> link = LinkCanonicalizer.canonicalize(resolveLink(entry));

        if (title.isBlank() || link.isEmpty()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, entry.getLink());
            return null;
        }

        return new FeedItem(title, resolveDescription(entry), link.get(), resolvePublishedAt(entry, fetchedAt));
    }

    private String resolveLink(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink();
        }
        if (entry.getLinks() != null) {
            for (SyndLink link : entry.getLinks()) {
                if (link.getHref() != null && (link.getRel() == null || "alternate".equals(link.getRel()))) {
                    return link.getHref();
                }
            }
        }
        return entry.getUri();
    }

    private Instant resolvePublishedAt(SyndEntry entry, Instant fallback) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : fallback;
    }

    private String resolveDescription(SyndEntry entry) {
        String raw = null;
        if (entry.getDescription() != null) {
            raw = entry.getDescription().getValue();
        }
        if ((raw == null || raw.isBlank()) && entry.getContents() != null) {
            raw = entry.getContents().stream()
                    .map(SyndContent::getValue)
                    .filter(value -> value != null && !value.isBlank())
                    .findFirst()
                    .orElse(null);
        }

        String description = cleanText(raw);
        if (description.isEmpty()) {
            return null;
        }
        return description.length() > http.maxDescriptionLength()
                ? description.substring(0, http.maxDescriptionLength())
                : description;
    }

    private void logFailure(String url, FeedFetchException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED ->
                    logger.warn("Temporary error for {}: {}", url, e.getMessage());
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED, INVALID_URL, DNS_ERROR ->
                    logger.error("Permanent error for {}: {}", url, e.getMessage());
            case PARSE_ERROR -> logger.warn("Parse error for {}: {}", url, e.getMessage());
            default -> logger.error("Failed to fetch {}: {} (category: {})", url, e.getMessage(), e.getCategory());
        }
    }

    private String nextUserAgent() {
        List<String> userAgents = http.userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isFeedContentType(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }

    static String cleanText(String text) {
        if (text == null) return "";

        return text
                .replaceAll("<[^>]+>", " ")           // Remove HTML tags
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&")
                .replaceAll("&#?[a-zA-Z0-9]+;", " ")  // Drop remaining entities
                .replaceAll("\\s+", " ")              // Normalize whitespace
                .trim();
    }
}
