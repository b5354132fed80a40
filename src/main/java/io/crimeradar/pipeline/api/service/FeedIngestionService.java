package io.crimeradar.pipeline.api.service;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.crimeradar.pipeline.api.dto.CandidateItem;
import io.crimeradar.pipeline.api.exception.ErrorCategory;
import io.crimeradar.pipeline.api.exception.PageFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

@Service
public class FeedIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(FeedIngestionService.class);

    private static final String FEED_ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";

    private final HttpPageFetcher pageFetcher;
    private final Clock clock;

    public FeedIngestionService(HttpPageFetcher pageFetcher, Clock clock) {
        this.pageFetcher = pageFetcher;
        this.clock = clock;
    }

    /**
     * Fetch and parse one feed, keeping entries that have both a link and a
     * title and were published at or after {@code since}. Entries without a
     * timestamp count as published now.
     *
     * @param url feed URL
     * @param since minimum publish timestamp
     * @return candidate items in feed order (empty if the feed is unusable)
     * @throws PageFetchException on transient network failures, so the call can be retried
     */
    @Retryable(
            retryFor = PageFetchException.class,
            maxAttemptsExpression = "#{@pipelineProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@pipelineProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public List<CandidateItem> parseFeed(String url, Instant since) throws PageFetchException {
        logger.debug("Parsing feed from: {}", url);

        String xmlContent;
        try {
            xmlContent = pageFetcher.fetch(url, FEED_ACCEPT);
        } catch (PageFetchException e) {
            if (e.isTransient()) {
                logger.warn("Temporary error for {}: {} (category: {})", url, e.getMessage(), e.getCategory());
                throw e;
            }
            logger.error("Permanent error for {}: {} (category: {})", url, e.getMessage(), e.getCategory());
            return Collections.emptyList();
        }

        return parseFeedContent(url, xmlContent, since);
    }

    @Recover
    public List<CandidateItem> recoverFeed(PageFetchException e, String url, Instant since) {
        logger.error("Giving up on feed {} after retries: {}", url, e.getMessage());
        return Collections.emptyList();
    }

    List<CandidateItem> parseFeedContent(String url, String xmlContent, Instant since) {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xmlContent));
        } catch (FeedException | IllegalArgumentException e) {
            logger.warn("Parse error for {}: {} (category: {})", url, e.getMessage(), ErrorCategory.PARSE_ERROR);
            return Collections.emptyList();
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed {} has no entries", url);
            return Collections.emptyList();
        }

        return feed.getEntries().stream()
                .map(entry -> convertToCandidate(entry, since))
                .filter(Objects::nonNull)
                .toList();
    }

    private CandidateItem convertToCandidate(SyndEntry entry, Instant since) {
        if (entry == null) {
            return null;
        }

        var title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";
        var link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        Instant publishedAt;
        if (published != null) {
            publishedAt = published.toInstant();
            if (since != null && publishedAt.isBefore(since)) {
                return null;
            }
        } else {
            publishedAt = clock.instant();
        }

        return new CandidateItem(link, title, publishedAt);
    }

    private String cleanText(String text) {
        return text
                .replaceAll("<[^>]+>", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
