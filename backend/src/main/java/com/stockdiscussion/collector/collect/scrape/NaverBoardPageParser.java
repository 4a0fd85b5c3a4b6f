package com.stockdiscussion.collector.collect.scrape;

import com.stockdiscussion.collector.collect.model.DateRange;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads one page of the finance.naver.com discussion board ({@code table.type2}).
 */
public final class NaverBoardPageParser {
    private static final Pattern NID_PATTERN = Pattern.compile("nid=(\\d+)");
    private static final DateTimeFormatter BOARD_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private NaverBoardPageParser() {
    }

    /**
     * @param postIds ids on this page that fall inside the range and were not already seen
     * @param reachedRangeStart a post older than the range start was found; later pages are older still
     * @param hasValidRows the page had at least one post row, seen or not
     */
    public record BoardPage(List<Long> postIds, boolean reachedRangeStart, boolean hasValidRows, String stockName) {
    }

    public static BoardPage parse(String html, DateRange range, LocalDate today, Set<Long> seen) {
        Document document = Jsoup.parse(html == null ? "" : html);
        String stockName = extractStockName(document);
        Element table = document.selectFirst("table.type2");
        if (table == null) {
            return new BoardPage(List.of(), false, false, stockName);
        }

        List<Long> postIds = new ArrayList<>();
        boolean reachedRangeStart = false;
        boolean hasValidRows = false;
        for (Element row : table.select("tbody tr")) {
            if (row.hasClass("blank_row") || row.html().contains("u_cbox_cleanbot")) {
                continue;
            }
            Elements cells = row.select("td");
            if (cells.size() < 6) {
                continue;
            }
            Element titleLink = cells.get(1).selectFirst("a");
            if (titleLink == null) {
                continue;
            }
            Matcher matcher = NID_PATTERN.matcher(titleLink.attr("href"));
            if (!matcher.find()) {
                continue;
            }
            hasValidRows = true;

            long postId = Long.parseLong(matcher.group(1));
            if (seen.contains(postId)) {
                continue;
            }

            LocalDate postDate = parseBoardDate(cells.get(0).text(), today);
            if (postDate != null) {
                if (range.isAfterEnd(postDate)) {
                    continue;
                }
                if (range.isBeforeStart(postDate)) {
                    reachedRangeStart = true;
                    break;
                }
            }
            postIds.add(postId);
        }
        return new BoardPage(postIds, reachedRangeStart, hasValidRows, stockName);
    }

    /**
     * Board rows show {@code yyyy.MM.dd HH:mm}, or a bare {@code HH:mm} for posts written today.
     */
    static LocalDate parseBoardDate(String cellText, LocalDate today) {
        String value = cellText == null ? "" : cellText.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (value.contains(":") && !value.contains(".")) {
            return today;
        }
        String datePart = value.split("\\s+")[0];
        try {
            return LocalDate.parse(datePart, BOARD_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String extractStockName(Document document) {
        Element name = document.selectFirst("div.wrap_company h2 a");
        if (name == null) {
            return null;
        }
        String text = name.text().trim();
        return text.isEmpty() ? null : text;
    }
}
