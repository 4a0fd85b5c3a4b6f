package com.stockdiscussion.collector.collect.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class NaverDetailParserTest {
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NaverDetailParser parser = new NaverDetailParser(objectMapper);

    @Test
    void readsPostFromNextDataQuery() throws Exception {
        String html = Files.readString(Path.of("src/test/resources/fixtures/naver-discussion-detail.html"));

        Optional<NaverDetailParser.NaverPost> parsed = parser.parseDetail(html);

        assertThat(parsed).isPresent();
        NaverDetailParser.NaverPost post = parsed.get();
        assertThat(post.title()).isEqualTo("막판 매수");
        assertThat(post.authorName()).isEqualTo("주주****");
        assertThat(post.likes()).isEqualTo(3);
        assertThat(post.dislikes()).isEqualTo(1);
        assertThat(post.writtenAt()).isEqualTo("2025-11-15T23:59:10");
        assertThat(post.content())
            .contains("종가에 들어갔습니다.")
            .contains("기대&응원")
            .contains("화이팅")
            .doesNotContain("<");
        assertThat(post.fullContent()).startsWith("막판 매수\n\n");
    }

    @Test
    void pageWithoutDiscussionPayloadIsEmpty() throws Exception {
        assertThat(parser.parseDetail("<html><body>삭제된 게시글입니다.</body></html>")).isEmpty();
    }

    @Test
    void convertsCommentFeedToStoredArray() throws Exception {
        String jsonp = Files.readString(Path.of("src/test/resources/fixtures/naver-comments.jsonp"));

        JsonNode comments = objectMapper.readTree(parser.parseCommentsJsonp(jsonp, SEOUL));

        assertThat(comments.isArray()).isTrue();
        assertThat(comments.size()).isEqualTo(2);
        JsonNode first = comments.get(0);
        assertThat(first.path("index").asInt()).isEqualTo(1);
        assertThat(first.path("author").asText()).isEqualTo("댓글****");
        assertThat(first.path("text").asText()).isEqualTo("동의합니다");
        assertThat(first.path("date").asText()).isEqualTo("2025-11-16 00:10:05");
        assertThat(first.path("likes").asLong()).isEqualTo(4);
        assertThat(comments.get(1).path("dislikes").asLong()).isEqualTo(2);
    }

    @Test
    void failedCommentFeedIsEmptyArray() throws Exception {
        String jsonp = "jQuery123({\"success\":false,\"code\":\"3999\",\"message\":\"error\"});";

        assertThat(parser.parseCommentsJsonp(jsonp, SEOUL)).isEqualTo("[]");
        assertThat(parser.parseCommentsJsonp("", SEOUL)).isEqualTo("[]");
    }

    @Test
    void htmlToTextKeepsLineBreaks() {
        assertThat(NaverDetailParser.htmlToText("<div>첫 줄<br>둘째 줄</div>")).isEqualTo("첫 줄\n둘째 줄");
    }
}
