package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.exception.ErrorCategory;
import io.crimeradar.pipeline.api.exception.PageFetchException;
import io.crimeradar.pipeline.api.exception.TextExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces an article page to the text of its main content. The {@code <article>}
 * element wins when present, otherwise the page's paragraphs are joined, otherwise
 * the whole body is used.
 */
@Service
public class HttpArticleTextExtractor implements ArticleTextExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HttpArticleTextExtractor.class);

    private static final String HTML_ACCEPT = "text/html, application/xhtml+xml, */*;q=0.8";

    private static final Pattern NOISE = Pattern.compile(
            "(?is)<(script|style|noscript|nav|header|footer|aside|form|iframe|svg)\\b[^>]*>.*?</\\1\\s*>");
    private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?-->");
    private static final Pattern ARTICLE = Pattern.compile("(?is)<article\\b[^>]*>(.*?)</article\\s*>");
    private static final Pattern PARAGRAPH = Pattern.compile("(?is)<p\\b[^>]*>(.*?)</p\\s*>");
    private static final Pattern BODY = Pattern.compile("(?is)<body\\b[^>]*>(.*)</body\\s*>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern NAMED_ENTITY = Pattern.compile("&[a-zA-Z][a-zA-Z0-9]*;");

    private static final Map<String, String> ENTITIES = Map.of(
            "&amp;", "&",
            "&lt;", "<",
            "&gt;", ">",
            "&quot;", "\"",
            "&apos;", "'",
            "&nbsp;", " "
    );

    private final HttpPageFetcher pageFetcher;

    public HttpArticleTextExtractor(HttpPageFetcher pageFetcher) {
        this.pageFetcher = pageFetcher;
    }

    @Override
    public String extractText(String link) throws TextExtractionException {
        String html;
        try {
            html = pageFetcher.fetch(link, HTML_ACCEPT);
        } catch (PageFetchException e) {
            throw new TextExtractionException(e.getMessage(), e, e.getCategory());
        }

        String text = toReadableText(html);
        if (text.isEmpty()) {
            throw new TextExtractionException("No readable text at: " + link, ErrorCategory.EMPTY_CONTENT);
        }
        logger.debug("Extracted {} characters from {}", text.length(), link);
        return text;
    }

    static String toReadableText(String html) {
        if (html == null || html.isBlank()) return "";

        String cleaned = COMMENT.matcher(html).replaceAll(" ");
        cleaned = NOISE.matcher(cleaned).replaceAll(" ");

        String content = mainContent(cleaned);

        return decodeEntities(TAG.matcher(content).replaceAll(" "))
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String mainContent(String html) {
        Matcher article = ARTICLE.matcher(html);
        List<String> articles = new ArrayList<>();
        while (article.find()) {
            articles.add(article.group(1));
        }
        if (!articles.isEmpty()) {
            return String.join(" ", articles);
        }

        Matcher paragraph = PARAGRAPH.matcher(html);
        List<String> paragraphs = new ArrayList<>();
        while (paragraph.find()) {
            paragraphs.add(paragraph.group(1));
        }
        if (!paragraphs.isEmpty()) {
            return String.join(" ", paragraphs);
        }

        Matcher body = BODY.matcher(html);
        return body.find() ? body.group(1) : html;
    }

    private static String decodeEntities(String text) {
        String decoded = text;
        for (Map.Entry<String, String> entity : ENTITIES.entrySet()) {
            decoded = decoded.replace(entity.getKey(), entity.getValue());
        }

        Matcher numeric = NUMERIC_ENTITY.matcher(decoded);
        StringBuilder sb = new StringBuilder();
        while (numeric.find()) {
            int codePoint;
            try {
                codePoint = Integer.parseInt(numeric.group(2), numeric.group(1).isEmpty() ? 10 : 16);
            } catch (NumberFormatException e) {
                codePoint = ' ';
            }
            String replacement = Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : " ";
            numeric.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        numeric.appendTail(sb);

        return NAMED_ENTITY.matcher(sb.toString()).replaceAll(" ");
    }
}
