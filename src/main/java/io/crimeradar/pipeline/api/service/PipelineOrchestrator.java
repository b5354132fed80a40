package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.AggregatedPoint;
import io.crimeradar.pipeline.api.dto.CandidateItem;
import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.api.dto.ExtractedDocument;
import io.crimeradar.pipeline.api.dto.GeoLocation;
import io.crimeradar.pipeline.api.dto.ItemOutcome;
import io.crimeradar.pipeline.api.dto.MinHashSignature;
import io.crimeradar.pipeline.api.dto.RunRequest;
import io.crimeradar.pipeline.api.dto.RunStatistics;
import io.crimeradar.pipeline.api.dto.StageResult;
import io.crimeradar.pipeline.api.exception.PageFetchException;
import io.crimeradar.pipeline.api.exception.TextExtractionException;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs candidate items one at a time through extraction, scoring,
 * near-duplicate filtering, location resolution and storage, then aggregates
 * and renders everything stored so far.
 * <p>
 * A failure inside one item ends only that item. Runs are serialised.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final FeedIngestionService feedIngestionService;
    private final ArticleTextExtractor textExtractor;
    private final LanguageDetector languageDetector;
    private final RelevanceScorer relevanceScorer;
    private final SignatureBuilder signatureBuilder;
    private final PlaceExtractorRegistry placeExtractors;
    private final LocationSelector locationSelector;
    private final EventStore eventStore;
    private final SpatialAggregator spatialAggregator;
    private final HeatmapRenderer heatmapRenderer;
    private final EventPublisherService eventPublisher;
    private final PipelineConfig pipelineConfig;
    private final Clock clock;

    public PipelineOrchestrator(FeedIngestionService feedIngestionService,
                                ArticleTextExtractor textExtractor,
                                LanguageDetector languageDetector,
                                RelevanceScorer relevanceScorer,
                                SignatureBuilder signatureBuilder,
                                PlaceExtractorRegistry placeExtractors,
                                LocationSelector locationSelector,
                                EventStore eventStore,
                                SpatialAggregator spatialAggregator,
                                HeatmapRenderer heatmapRenderer,
                                EventPublisherService eventPublisher,
                                PipelineConfig pipelineConfig,
                                Clock clock) {
        this.feedIngestionService = feedIngestionService;
        this.textExtractor = textExtractor;
        this.languageDetector = languageDetector;
        this.relevanceScorer = relevanceScorer;
        this.signatureBuilder = signatureBuilder;
        this.placeExtractors = placeExtractors;
        this.locationSelector = locationSelector;
        this.eventStore = eventStore;
        this.spatialAggregator = spatialAggregator;
        this.heatmapRenderer = heatmapRenderer;
        this.eventPublisher = eventPublisher;
        this.pipelineConfig = pipelineConfig;
        this.clock = clock;
    }

    public RunRequest defaultRequest() {
        return new RunRequest(
                pipelineConfig.getEnabledSourceUrls(),
                pipelineConfig.processing().since(),
                pipelineConfig.processing().maxItems()
        );
    }

    public synchronized RunStatistics run(RunRequest request) {
        RunRequest effective = withDefaults(request);
        RunContext context = RunContext.start(pipelineConfig.dedup(), clock.instant());

        logger.info("Starting run {} for {} feeds (since {}, max {} items)",
                context.runId(), effective.feedUrls().size(), effective.since(), effective.maxItems());

        List<CandidateItem> items = collectCandidates(effective);
        boolean interrupted = false;

        for (CandidateItem item : items) {
            ItemOutcome outcome = processItem(item, context);
            context.record(outcome);
            logger.debug("Item {} -> {}", item.link(), outcome);

            if (outcome == ItemOutcome.SAVED && !pauseAfterSavedItem()) {
                interrupted = true;
                break;
            }
        }

        List<AggregatedPoint> points = List.of();
        String artifact = null;
        if (interrupted) {
            // interrupt flag stays set for the caller; aggregation and rendering are skipped
            logger.warn("Run {} interrupted after {} items, skipping aggregation and rendering",
                    context.runId(), context.itemsProcessed());
        } else {
            points = spatialAggregator.aggregate();
            artifact = render(points);
        }

        Instant completedAt = clock.instant();
        RunStatistics statistics = new RunStatistics(
                context.runId(),
                context.itemsProcessed(),
                context.count(ItemOutcome.SAVED),
                points.size(),
                artifact,
                context.outcomes(),
                Duration.between(context.startedAt(), completedAt).toMillis(),
                completedAt
        );

        eventPublisher.publishRunCompleted(statistics);

        logger.info("Run {} completed: {} processed, {} saved, {} points ({})",
                statistics.runId(), statistics.itemsProcessed(), statistics.itemsSaved(),
                statistics.aggregatedPoints(), statistics.outcomes());
        return statistics;
    }

    ItemOutcome processItem(CandidateItem item, RunContext context) {
        try {
            StageResult<ExtractedDocument> extracted = extract(item);
            if (extracted.isStopped()) return stop(item, extracted);
            ExtractedDocument document = extracted.value();

            StageResult<Double> scored = score(document);
            if (scored.isStopped()) return stop(item, scored);
            double score = scored.value();

            StageResult<MinHashSignature> unique = filterDuplicate(item, document, context);
            if (unique.isStopped()) return stop(item, unique);

            StageResult<GeoLocation> located = locate(document);
            if (located.isStopped()) return stop(item, located);

            save(item, document, score, located.value());
            return ItemOutcome.SAVED;

        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}: {}", item.link(), e.getMessage(), e);
            return ItemOutcome.FAILED;
        }
    }

    private List<CandidateItem> collectCandidates(RunRequest request) {
        List<CandidateItem> items = new ArrayList<>();

        for (String feedUrl : request.feedUrls()) {
            try {
                List<CandidateItem> feedItems = feedIngestionService.parseFeed(feedUrl, request.since());
                items.addAll(feedItems);
                logger.info("Feed {}: {} candidate items", feedUrl, feedItems.size());
            } catch (PageFetchException e) {
                logger.warn("Feed {} unavailable: {} (category: {})", feedUrl, e.getMessage(), e.getCategory());
            } catch (RuntimeException e) {
                logger.error("Failed to read feed {}: {}", feedUrl, e.getMessage());
            }
        }

        return items.size() > request.maxItems() ? items.subList(0, request.maxItems()) : items;
    }

    private StageResult<ExtractedDocument> extract(CandidateItem item) {
        String text;
        try {
            text = textExtractor.extractText(item.link());
        } catch (TextExtractionException e) {
            return StageResult.stop(ItemOutcome.FAILED, e.getCategory() + ": " + e.getMessage());
        }

        return StageResult.next(new ExtractedDocument(text, detectLanguage(text)));
    }

    private String detectLanguage(String text) {
        try {
            return languageDetector.detect(text);
        } catch (RuntimeException e) {
            logger.warn("Language detection failed, using {}: {}",
                    pipelineConfig.keywords().defaultLanguage(), e.getMessage());
            return pipelineConfig.keywords().defaultLanguage();
        }
    }

    private StageResult<Double> score(ExtractedDocument document) {
        double score = relevanceScorer.score(document.text(), document.language());
        double threshold = pipelineConfig.processing().relevanceThreshold();

        if (score < threshold) {
            return StageResult.stop(ItemOutcome.REJECTED_LOW_SCORE,
                    String.format("score %.3f below %.2f", score, threshold));
        }
        return StageResult.next(score);
    }

    private StageResult<MinHashSignature> filterDuplicate(CandidateItem item, ExtractedDocument document,
                                                          RunContext context) {
        MinHashSignature signature = signatureBuilder.build(document.text());
        NearDuplicateIndex index = context.duplicateIndex();

        if (index.query(signature)) {
            return StageResult.stop(ItemOutcome.DUPLICATE_REJECTED, "near-duplicate of an earlier item");
        }

        String key = DigestUtils.sha1Hex(item.link());
        if (index.contains(key)) {
            return StageResult.stop(ItemOutcome.DUPLICATE_REJECTED, "link already seen in this run");
        }
        index.insert(key, signature);
        return StageResult.next(signature);
    }

    private StageResult<GeoLocation> locate(ExtractedDocument document) {
        List<String> candidates = placeExtractors.extractPlaces(document.text(), document.language());
        if (candidates.isEmpty()) {
            return StageResult.stop(ItemOutcome.PLACE_UNRESOLVED, "no place names found");
        }

        Optional<GeoLocation> location = locationSelector.select(candidates);
        return location
                .map(StageResult::next)
                .orElseGet(() -> StageResult.stop(ItemOutcome.PLACE_UNRESOLVED, "no candidate geocoded: " + candidates));
    }

    private void save(CandidateItem item, ExtractedDocument document, double score, GeoLocation location) {
        CrimeEvent event = CrimeEvent.create(item, document, score, location, clock.instant());

        if (eventStore.insertIfNew(event)) {
            eventPublisher.publishEventSaved(event,
                    relevanceScorer.matchedKeywords(document.text(), document.language()));
        } else {
            logger.debug("Link {} was stored by an earlier run", item.link());
        }
    }

    private ItemOutcome stop(CandidateItem item, StageResult<?> result) {
        if (result.outcome() == ItemOutcome.FAILED) {
            logger.warn("Item {} failed: {}", item.link(), result.reason());
        } else {
            logger.debug("Item {} dropped ({}): {}", item.link(), result.outcome(), result.reason());
        }
        return result.outcome();
    }

    private boolean pauseAfterSavedItem() {
        Duration delay = pipelineConfig.processing().itemDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) return true;

        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String render(List<AggregatedPoint> points) {
        try {
            return heatmapRenderer.render(points);
        } catch (IOException | RuntimeException e) {
            logger.error("Rendering {} points failed: {}", points.size(), e.getMessage(), e);
            return null;
        }
    }

    private RunRequest withDefaults(RunRequest request) {
        RunRequest defaults = defaultRequest();
        if (request == null) return defaults;

        return new RunRequest(
                request.feedUrls() != null && !request.feedUrls().isEmpty() ? request.feedUrls() : defaults.feedUrls(),
                request.since() != null ? request.since() : defaults.since(),
                request.maxItems() > 0 ? request.maxItems() : defaults.maxItems()
        );
    }
}
