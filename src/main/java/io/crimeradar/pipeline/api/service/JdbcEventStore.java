package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.api.exception.PipelineInitializationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Repository
public class JdbcEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS news_events (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                link VARCHAR NOT NULL,
                title VARCHAR,
                published_at TIMESTAMP WITH TIME ZONE,
                lang VARCHAR(16),
                score DOUBLE PRECISION,
                lat DOUBLE PRECISION,
                lon DOUBLE PRECISION,
                place VARCHAR,
                created_at TIMESTAMP WITH TIME ZONE,
                CONSTRAINT uq_news_events_link UNIQUE (link)
            )""";

    private static final String INSERT = """
            INSERT INTO news_events (link, title, published_at, lang, score, lat, lon, place, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String SELECT_ALL = """
            SELECT link, title, published_at, lang, score, lat, lon, place, created_at
            FROM news_events ORDER BY id""";

    private static final RowMapper<CrimeEvent> EVENT_MAPPER = JdbcEventStore::mapEvent;

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void ensureSchema() {
        try {
            jdbcTemplate.execute(CREATE_TABLE);
            logger.info("Event store ready with {} events", count());
        } catch (DataAccessException e) {
            throw new PipelineInitializationException("Cannot initialise event store schema", e);
        }
    }

    @Override
    public boolean insertIfNew(CrimeEvent event) {
        try {
            jdbcTemplate.update(INSERT,
                    event.link(),
                    event.title(),
                    toTimestamp(event.publishedAt()),
                    event.language(),
                    event.score(),
                    event.latitude(),
                    event.longitude(),
                    event.placeLabel(),
                    toTimestamp(event.ingestedAt()));
            return true;
        } catch (DuplicateKeyException e) {
            logger.debug("Event already stored for link: {}", event.link());
            return false;
        }
    }

    @Override
    public List<CrimeEvent> findAll() {
        return jdbcTemplate.query(SELECT_ALL, EVENT_MAPPER);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM news_events", Long.class);
        return count != null ? count : 0L;
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static CrimeEvent mapEvent(ResultSet rs, int rowNum) throws SQLException {
        return new CrimeEvent(
                rs.getString("link"),
                rs.getString("title"),
                toInstant(rs.getObject("published_at", OffsetDateTime.class)),
                rs.getString("lang"),
                rs.getDouble("score"),
                rs.getDouble("lat"),
                rs.getDouble("lon"),
                rs.getString("place"),
                toInstant(rs.getObject("created_at", OffsetDateTime.class))
        );
    }
}
