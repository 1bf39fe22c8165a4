package com.npssenti.crawler.service.discovery;

import com.npssenti.crawler.service.extract.PublishDateResolver;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Board listing parsers, one per supported community site. Each returns thread links in page
 * order with whatever title, author and date the listing row shows.
 */
@Component
public class ForumListingParser {

    public static final Set<String> SUPPORTED_SITES =
            Set.of("dcinside", "bobaedream", "fmkorea", "mlbpark", "theqoo", "ppomppu");

    private static final Pattern THEQOO_THREAD = Pattern.compile("/square/\\d+");
    private static final Pattern FMKOREA_THREAD = Pattern.compile("(document_srl=\\d+)|(^|/)\\d{6,}(\\?|$)");

    public boolean supports(String site) {
        return SUPPORTED_SITES.contains(site);
    }

    /** Query parameter carrying the listing page number */
    public String pageParameter(String site) {
        return "mlbpark".equals(site) ? "p" : "page";
    }

    public List<ListingEntry> parse(String site, String baseUrl, String html) {
        Document page = Jsoup.parse(html, baseUrl);
        return switch (site) {
            case "dcinside" -> dcinside(page);
            case "bobaedream" -> rows(page, "a[href*=\"/board/bbs_view?\"], a[href*=\"/view?code=\"]", null,
                    "td.author, td.writer, td.name", "td.date, td.regdate, td.time");
            case "fmkorea" -> rows(page, "td.title a[href], h3.title a[href], a[href*=\"document_srl=\"]",
                    FMKOREA_THREAD, "td.author, .author", "td.time, .regdate");
            case "mlbpark" -> mlbpark(page);
            case "theqoo" -> rows(page, "a[href*=\"/square/\"]", THEQOO_THREAD,
                    "td.nik, td.author, td.name", "td.time, td.date");
            case "ppomppu" -> rows(page, "a[href*=\"view.php?id=\"]", null,
                    "td.name, td.author, td.writer", "td.date, td.regdate, td.time");
            default -> throw new IllegalArgumentException("No listing parser for forum site: " + site);
        };
    }

    /**
     * @param publishedHint parsed listing date, null when the row shows only a time or nothing
     */
    public record ListingEntry(String url, String title, String author, Instant publishedHint) {}

    // ── Site parsers ─────────────────────────────────────────────────────────

    private List<ListingEntry> dcinside(Document page) {
        List<ListingEntry> items = new ArrayList<>();
        for (Element a : page.select("td.gall_tit a[href]")) {
            if (!a.attr("href").contains("/board/view/")) {
                continue;
            }
            Element row = a.closest("tr");
            String author = null;
            Instant date = null;
            if (row != null) {
                Element writer = row.selectFirst("td.gall_writer");
                author = writer == null ? null : blankToNull(writer.text());
                Element dateCell = row.selectFirst("td.gall_date");
                if (dateCell != null) {
                    // the title attribute carries the full timestamp, the cell text only MM.dd
                    String raw = dateCell.hasAttr("title") ? dateCell.attr("title") : dateCell.text();
                    date = PublishDateResolver.parse(raw);
                }
            }
            items.add(new ListingEntry(a.absUrl("href"), blankToNull(a.text()), author, date));
        }
        if (items.isEmpty()) {
            for (Element a : page.select("a[href*=\"/board/view/\"]")) {
                items.add(new ListingEntry(a.absUrl("href"), blankToNull(a.text()), null, null));
            }
        }
        return items;
    }

    private List<ListingEntry> mlbpark(Document page) {
        List<ListingEntry> items = new ArrayList<>();
        for (Element a : page.select("a[href*=\"/mp/b.php\"]")) {
            String href = a.attr("href");
            if (!href.contains("m=view") && !href.contains("idx=")) {
                continue;
            }
            items.add(entry(a, "td.nikcon, td.author, td.name", "td.date, td.time"));
        }
        return items;
    }

    private List<ListingEntry> rows(Document page, String linkSelector, Pattern hrefFilter,
                                    String authorSelector, String dateSelector) {
        List<ListingEntry> items = new ArrayList<>();
        for (Element a : page.select(linkSelector)) {
            if (hrefFilter != null && !hrefFilter.matcher(a.attr("href")).find()) {
                continue;
            }
            items.add(entry(a, authorSelector, dateSelector));
        }
        return items;
    }

    private static ListingEntry entry(Element link, String authorSelector, String dateSelector) {
        Element row = link.closest("tr");
        if (row == null) {
            row = link.closest("li");
        }
        String author = null;
        Instant date = null;
        if (row != null) {
            Element au = row.selectFirst(authorSelector);
            author = au == null ? null : blankToNull(au.text());
            Element dt = row.selectFirst(dateSelector);
            date = dt == null ? null : PublishDateResolver.parse(dt.text());
        }
        return new ListingEntry(link.absUrl("href"), blankToNull(link.text()), author, date);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
