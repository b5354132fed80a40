package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.PipelineConfigFixtures;
import io.crimeradar.pipeline.api.dto.AggregatedPoint;
import io.crimeradar.pipeline.api.dto.CandidateItem;
import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.api.dto.GeoLocation;
import io.crimeradar.pipeline.api.dto.ItemOutcome;
import io.crimeradar.pipeline.api.dto.RunRequest;
import io.crimeradar.pipeline.api.dto.RunStatistics;
import io.crimeradar.pipeline.api.exception.ErrorCategory;
import io.crimeradar.pipeline.api.exception.PageFetchException;
import io.crimeradar.pipeline.api.exception.TextExtractionException;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");
    private static final String FEED = "https://feeds.example/world.xml";
    private static final GeoLocation LONDON = new GeoLocation(51.5074, -0.1278, "London");

    @Mock
    private FeedIngestionService feedIngestionService;
    @Mock
    private ArticleTextExtractor textExtractor;
    @Mock
    private LocationSelector locationSelector;
    @Mock
    private EventStore eventStore;
    @Mock
    private SpatialAggregator spatialAggregator;
    @Mock
    private HeatmapRenderer heatmapRenderer;
    @Mock
    private EventPublisherService eventPublisher;

    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        PipelineConfig config = PipelineConfigFixtures.pipelineConfig();

        orchestrator = new PipelineOrchestrator(
                feedIngestionService,
                textExtractor,
                new StopwordLanguageDetector(config),
                new RelevanceScorer(config),
                new SignatureBuilder(config),
                new PlaceExtractorRegistry(config),
                locationSelector,
                eventStore,
                spatialAggregator,
                heatmapRenderer,
                eventPublisher,
                config,
                Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(spatialAggregator.aggregate()).thenReturn(List.of(new AggregatedPoint(51.507, -0.128, 1)));
        lenient().when(heatmapRenderer.render(anyList())).thenReturn("/tmp/heatmap.html");
    }

    @Test
    @DisplayName("Should save a relevant, located item with a full score")
    void shouldSaveRelevantItem() throws Exception {
        CandidateItem item = item(1);
        givenFeed(item);
        when(textExtractor.extractText(item.link())).thenReturn(story("London", "alpha"));
        when(locationSelector.select(List.of("London"))).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true);

        RunStatistics statistics = orchestrator.run(request());

        ArgumentCaptor<CrimeEvent> saved = ArgumentCaptor.forClass(CrimeEvent.class);
        verify(eventStore).insertIfNew(saved.capture());
        assertThat(saved.getValue().score()).isEqualTo(1.0);
        assertThat(saved.getValue().language()).isEqualTo("en");
        assertThat(saved.getValue().latitude()).isEqualTo(51.5074);
        assertThat(saved.getValue().placeLabel()).isEqualTo("London");
        assertThat(saved.getValue().ingestedAt()).isEqualTo(NOW);

        verify(eventPublisher).publishEventSaved(eq(saved.getValue()), anySet());
        assertThat(statistics.itemsProcessed()).isEqualTo(1);
        assertThat(statistics.itemsSaved()).isEqualTo(1);
        assertThat(statistics.aggregatedPoints()).isEqualTo(1);
        assertThat(statistics.renderingArtifact()).isEqualTo("/tmp/heatmap.html");
        assertThat(statistics.runId()).startsWith("RUN-");
    }

    @Test
    @DisplayName("Should save only the first of two items with identical text")
    void shouldRejectRepublishedStory() throws Exception {
        CandidateItem original = item(1);
        CandidateItem republished = item(2);
        givenFeed(original, republished);
        String text = story("London", "wire");
        when(textExtractor.extractText(original.link())).thenReturn(text);
        when(textExtractor.extractText(republished.link())).thenReturn(text);
        when(locationSelector.select(anyList())).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true);

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.itemsProcessed()).isEqualTo(2);
        assertThat(statistics.itemsSaved()).isEqualTo(1);
        assertThat(statistics.countOf(ItemOutcome.DUPLICATE_REJECTED)).isEqualTo(1);
        verify(eventStore, times(1)).insertIfNew(any());
        verify(locationSelector, times(1)).select(anyList());
    }

    @Test
    @DisplayName("Should keep unrelated stories apart")
    void shouldSaveDistinctStories() throws Exception {
        givenFeed(item(1), item(2));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("London", "alpha"));
        when(textExtractor.extractText(item(2).link())).thenReturn(story("Chicago", "omega"));
        when(locationSelector.select(anyList())).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true);

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.itemsSaved()).isEqualTo(2);
        verify(eventStore, times(2)).insertIfNew(any());
    }

    @Test
    @DisplayName("Should never save an item without place names")
    void shouldNotSaveWithoutPlaceNames() throws Exception {
        givenFeed(item(1));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("somewhere unnamed", "alpha"));

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.countOf(ItemOutcome.PLACE_UNRESOLVED)).isEqualTo(1);
        assertThat(statistics.itemsSaved()).isZero();
        verify(locationSelector, never()).select(anyList());
        verify(eventStore, never()).insertIfNew(any());
    }

    @Test
    @DisplayName("Should never save an item whose places do not geocode")
    void shouldNotSaveWhenGeocodingFails() throws Exception {
        givenFeed(item(1));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("London", "alpha"));
        when(locationSelector.select(List.of("London"))).thenReturn(Optional.empty());

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.countOf(ItemOutcome.PLACE_UNRESOLVED)).isEqualTo(1);
        verify(eventStore, never()).insertIfNew(any());
        verify(eventPublisher, never()).publishEventSaved(any(), anySet());
    }

    @Test
    @DisplayName("Should reject items that score below the threshold")
    void shouldRejectLowScore() throws Exception {
        givenFeed(item(1));
        when(textExtractor.extractText(item(1).link()))
                .thenReturn("The weather in London was sunny and the parks were full of visitors.");

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.countOf(ItemOutcome.REJECTED_LOW_SCORE)).isEqualTo(1);
        verify(locationSelector, never()).select(anyList());
    }

    @Test
    @DisplayName("Should carry on with later items when one item fails")
    void shouldIsolateItemFailures() throws Exception {
        givenFeed(item(1), item(2), item(3));
        when(textExtractor.extractText(item(1).link()))
                .thenThrow(new TextExtractionException("HTTP 404", ErrorCategory.NOT_FOUND));
        when(textExtractor.extractText(item(2).link())).thenReturn(story("Chicago", "beta"));
        when(textExtractor.extractText(item(3).link())).thenReturn(story("London", "gamma"));
        when(locationSelector.select(List.of("Chicago"))).thenThrow(new IllegalStateException("boom"));
        when(locationSelector.select(List.of("London"))).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true);

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.itemsProcessed()).isEqualTo(3);
        assertThat(statistics.countOf(ItemOutcome.FAILED)).isEqualTo(2);
        assertThat(statistics.itemsSaved()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count an already stored link as saved without republishing it")
    void shouldNotRepublishExistingLink() throws Exception {
        givenFeed(item(1));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("London", "alpha"));
        when(locationSelector.select(anyList())).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(false);

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.itemsSaved()).isEqualTo(1);
        verify(eventPublisher, never()).publishEventSaved(any(), anySet());
    }

    @Test
    @DisplayName("Should skip unavailable feeds and cap the number of items")
    void shouldSkipBrokenFeedsAndCapItems() throws Exception {
        String broken = "https://feeds.example/broken.xml";
        when(feedIngestionService.parseFeed(eq(broken), any()))
                .thenThrow(new PageFetchException("Read timed out", ErrorCategory.TIMEOUT));
        when(feedIngestionService.parseFeed(eq(FEED), any())).thenReturn(List.of(item(1), item(2), item(3)));
        when(textExtractor.extractText(any()))
                .thenThrow(new TextExtractionException("HTTP 410", ErrorCategory.HTTP_ERROR));

        RunStatistics statistics = orchestrator.run(
                new RunRequest(List.of(broken, FEED), Instant.parse("2024-01-01T00:00:00Z"), 2));

        assertThat(statistics.itemsProcessed()).isEqualTo(2);
        verify(textExtractor, never()).extractText(item(3).link());
    }

    @Test
    @DisplayName("Should finish the run when rendering fails")
    void shouldCompleteWithoutArtifact() throws Exception {
        givenFeed();
        when(heatmapRenderer.render(anyList())).thenThrow(new IOException("disk full"));

        RunStatistics statistics = orchestrator.run(request());

        assertThat(statistics.renderingArtifact()).isNull();
        assertThat(statistics.itemsProcessed()).isZero();
        verify(eventPublisher).publishRunCompleted(statistics);
    }

    @Test
    @DisplayName("Should fall back to configured feeds for an empty request")
    void shouldUseDefaultsForEmptyRequest() throws Exception {
        when(feedIngestionService.parseFeed(any(), any())).thenReturn(List.of());

        orchestrator.run(null);

        verify(feedIngestionService).parseFeed("https://g1.globo.com/rss/g1/", Instant.parse("2024-01-01T00:00:00Z"));
        verify(feedIngestionService).parseFeed("https://feeds.bbci.co.uk/news/world/rss.xml", Instant.parse("2024-01-01T00:00:00Z"));
        verify(feedIngestionService, never()).parseFeed(eq("https://disabled.example/rss"), any());
    }

    @Test
    @DisplayName("Should start every run with an empty duplicate index")
    void shouldNotCarryDuplicatesAcrossRuns() throws Exception {
        givenFeed(item(1));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("London", "alpha"));
        when(locationSelector.select(anyList())).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true, false);

        RunStatistics first = orchestrator.run(request());
        RunStatistics second = orchestrator.run(request());

        assertThat(first.countOf(ItemOutcome.DUPLICATE_REJECTED)).isZero();
        assertThat(second.countOf(ItemOutcome.DUPLICATE_REJECTED)).isZero();
        assertThat(first.runId()).isNotEqualTo(second.runId());
        verify(eventStore, times(2)).insertIfNew(any());
    }

    @Test
    @DisplayName("Should stop without aggregating or rendering when interrupted between items")
    void shouldSkipAggregationWhenInterrupted() throws Exception {
        PipelineConfig config = PipelineConfigFixtures.withItemDelay(
                PipelineConfigFixtures.pipelineConfig(), Duration.ofSeconds(5));
        PipelineOrchestrator delayed = new PipelineOrchestrator(
                feedIngestionService,
                textExtractor,
                new StopwordLanguageDetector(config),
                new RelevanceScorer(config),
                new SignatureBuilder(config),
                new PlaceExtractorRegistry(config),
                locationSelector,
                eventStore,
                spatialAggregator,
                heatmapRenderer,
                eventPublisher,
                config,
                Clock.fixed(NOW, ZoneOffset.UTC));
        givenFeed(item(1), item(2));
        when(textExtractor.extractText(item(1).link())).thenReturn(story("London", "alpha"));
        when(locationSelector.select(anyList())).thenReturn(Optional.of(LONDON));
        when(eventStore.insertIfNew(any())).thenReturn(true);

        RunStatistics statistics;
        boolean stillInterrupted;
        Thread.currentThread().interrupt();
        try {
            statistics = delayed.run(request());
        } finally {
            stillInterrupted = Thread.interrupted();
        }

        assertThat(stillInterrupted).isTrue();
        assertThat(statistics.itemsProcessed()).isEqualTo(1);
        assertThat(statistics.itemsSaved()).isEqualTo(1);
        assertThat(statistics.aggregatedPoints()).isZero();
        assertThat(statistics.renderingArtifact()).isNull();
        verify(textExtractor, never()).extractText(item(2).link());
        verify(spatialAggregator, never()).aggregate();
        verify(heatmapRenderer, never()).render(anyList());
        verify(eventPublisher).publishRunCompleted(statistics);
    }

    private void givenFeed(CandidateItem... items) throws PageFetchException {
        when(feedIngestionService.parseFeed(eq(FEED), any())).thenReturn(List.of(items));
    }

    private static RunRequest request() {
        return new RunRequest(List.of(FEED), Instant.parse("2024-01-01T00:00:00Z"), 300);
    }

    private static CandidateItem item(int n) {
        return new CandidateItem("https://news.example/story-" + n, "Story " + n, NOW.minusSeconds(3600));
    }

    /**
     * English story over 2000 characters naming five crime keywords. Stories
     * with different tags share only a handful of words.
     */
    private static String story(String place, String tag) {
        String body = IntStream.range(0, 250)
                .mapToObj(i -> tag + "detail" + i)
                .collect(Collectors.joining(" "));
        return "The police in " + place + " said a murder, a robbery, an assault, a kidnapping and a shooting "
                + "were reported overnight. " + body;
    }
}
