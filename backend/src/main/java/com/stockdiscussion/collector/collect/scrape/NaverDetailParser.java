package com.stockdiscussion.collector.collect.scrape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses the mobile discussion detail page and the comment box JSONP feed.
 */
@Component
public class NaverDetailParser {
    private static final String DETAIL_QUERY_URL = "/discussion/detail";
    private static final Pattern JSONP_PREFIX = Pattern.compile("^[^(]*\\(");
    private static final Pattern JSONP_SUFFIX = Pattern.compile("\\);?\\s*$");
    private static final DateTimeFormatter COMMENT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;

    public NaverDetailParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record NaverPost(
        String title,
        String content,
        String authorName,
        long likes,
        long dislikes,
        String writtenAt
    ) {
        public String fullContent() {
            if (title == null || title.isBlank()) {
                return content;
            }
            return content == null || content.isBlank() ? title : title + "\n\n" + content;
        }
    }

    /**
     * Reads the post out of the page's {@code __NEXT_DATA__} state. Empty when the page carries no
     * discussion payload (deleted post, layout change).
     */
    public Optional<NaverPost> parseDetail(String html) throws JsonProcessingException {
        Document document = Jsoup.parse(html == null ? "" : html);
        Element script = document.selectFirst("script#__NEXT_DATA__");
        if (script == null) {
            return Optional.empty();
        }
        JsonNode root = objectMapper.readTree(script.data());
        JsonNode result = null;
        for (JsonNode query : root.path("props").path("pageProps").path("dehydratedState").path("queries")) {
            JsonNode queryKey = query.path("queryKey");
            if (queryKey.size() > 0 && DETAIL_QUERY_URL.equals(queryKey.get(0).path("url").asText(null))) {
                result = query.path("state").path("data").path("result");
                break;
            }
        }
        if (result == null || result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }

        String title = textOrNull(result, "title");
        if (title == null) {
            title = textOrNull(result, "subject");
        }
        String content = "";
        String contentHtml = textOrNull(result, "contentHtml");
        if (contentHtml != null) {
            content = htmlToText(contentHtml);
        } else {
            String contentJson = textOrNull(result, "contentJsonSwReplaced");
            if (contentJson != null) {
                content = summaryFromContentJson(contentJson);
            }
        }
        return Optional.of(new NaverPost(
            title,
            content,
            result.path("writer").path("nickname").asText(""),
            result.path("recommendCount").asLong(0),
            result.path("notRecommendCount").asLong(0),
            textOrNull(result, "writtenAt")
        ));
    }

    /**
     * Converts the JSONP comment list into the JSON array stored with the post. Returns {@code "[]"}
     * when the feed reports failure.
     */
    public String parseCommentsJsonp(String jsonp, ZoneId zone) throws JsonProcessingException {
        if (jsonp == null || jsonp.isBlank()) {
            return "[]";
        }
        String json = JSONP_SUFFIX.matcher(JSONP_PREFIX.matcher(jsonp.trim()).replaceFirst("")).replaceFirst("");
        JsonNode root = objectMapper.readTree(json);
        ArrayNode comments = objectMapper.createArrayNode();
        if (!root.path("success").asBoolean(false)) {
            return objectMapper.writeValueAsString(comments);
        }
        int index = 1;
        for (JsonNode comment : root.path("result").path("commentList")) {
            ObjectNode entry = comments.addObject();
            entry.put("index", index++);
            entry.put("author", comment.path("userName").asText(""));
            entry.put("text", comment.path("contents").asText(""));
            Instant regTime = TimestampParser.parse(comment.path("regTime").asText(null), zone);
            if (regTime == null) {
                entry.putNull("date");
            } else {
                entry.put("date", COMMENT_DATE.withZone(zone).format(regTime));
            }
            entry.put("likes", comment.path("sympathyCount").asLong(0));
            entry.put("dislikes", comment.path("antipathyCount").asLong(0));
        }
        return objectMapper.writeValueAsString(comments);
    }

    static String htmlToText(String html) {
        Document document = Jsoup.parseBodyFragment(html);
        Document.OutputSettings settings = new Document.OutputSettings().prettyPrint(false);
        document.outputSettings(settings);
        document.select("br").after("\\n");
        document.select("p, div, li").before("\\n");
        String cleaned = Jsoup.clean(document.body().html().replace("\\n", "\n"), "", Safelist.none(), settings);
        return Arrays.stream(Parser.unescapeEntities(cleaned, false).split("\n"))
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));
    }

    private String summaryFromContentJson(String contentJson) {
        try {
            String summaryHtml = objectMapper.readTree(contentJson).path("contentSummary").asText("");
            return summaryHtml.isBlank() ? "" : htmlToText(summaryHtml);
        } catch (JsonProcessingException e) {
            return contentJson;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
