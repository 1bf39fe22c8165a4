package com.npssenti.crawler.service.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Main-content extraction with jsoup.
 *
 * Boilerplate elements are removed first; then the first known article/post container wins,
 * otherwise the block holding the most paragraph text, otherwise the whole body.
 */
@Component
public class HtmlContentExtractor {

    private static final String BOILERPLATE =
            "script, style, noscript, nav, header, footer, aside, form, iframe, svg, button";

    private static final List<String> CONTENT_SELECTORS = List.of(
            "[itemprop=articleBody]",
            "#dic_area",
            "#articleBody",
            "#articleBodyContents",
            ".article_body",
            ".article-body",
            ".news_end",
            // forums
            ".write_div",
            ".view_content",
            ".bodyCont",
            ".ar_txt",
            ".xe_content",
            ".rd_body",
            ".board_main_view",
            "article",
            "main");

    private static final List<String> COMMENT_SELECTORS = List.of(
            ".cmt_list .usertxt",
            ".comment_box .usertxt",
            ".reply_content",
            ".comment-content",
            ".comment_content",
            ".cmt_txt",
            ".xe_content.comment",
            ".fdb_itm .xe_content",
            ".comment .txt");

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "br", "li", "tr", "h1", "h2", "h3", "h4", "h5", "h6",
            "blockquote", "pre", "section", "article", "dd", "dt", "table");

    private static final int MIN_BLOCK_CHARS = 100;

    /**
     * @param html       decoded page
     * @param baseUrl    used to resolve relative links
     * @param commentMax how many visible comments to append; 0 for news pages
     */
    public HtmlContent extract(String html, String baseUrl, int commentMax) {
        Document page = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);

        String title = title(page);
        List<String> authors = authors(page);

        // Comments are read before boilerplate removal; some boards render them inside <form>
        List<String> comments = commentMax > 0 ? comments(page, commentMax) : List.of();

        Document cleaned = page.clone();
        cleaned.select(BOILERPLATE).remove();
        for (String selector : COMMENT_SELECTORS) {
            cleaned.select(selector).remove();
        }

        String body = blockText(mainContent(cleaned));
        if (!comments.isEmpty()) {
            body = body + "\n\n" + String.join("\n", comments);
        }
        return new HtmlContent(title, body.trim(), authors, comments.size(), page);
    }

    /**
     * @param page the parsed page before cleanup, for metadata lookups
     */
    public record HtmlContent(String title, String text, List<String> authors, int commentCount, Document page) {}

    // ── Internal ─────────────────────────────────────────────────────────────

    private static String title(Document page) {
        String title = attr(page, "meta[property=og:title]", "content");
        if (title == null) {
            title = attr(page, "meta[name=title]", "content");
        }
        if (title == null && !page.title().isBlank()) {
            title = page.title().trim();
        }
        if (title == null) {
            Element h1 = page.selectFirst("h1");
            title = h1 == null || h1.text().isBlank() ? null : h1.text().trim();
        }
        return title;
    }

    private static List<String> authors(Document page) {
        Set<String> authors = new LinkedHashSet<>();
        for (Element meta : page.select("meta[name=author], meta[property=article:author], meta[name=byl]")) {
            String value = meta.attr("content").trim();
            if (!value.isEmpty()) {
                authors.add(value);
            }
        }
        return new ArrayList<>(authors);
    }

    private static List<String> comments(Document page, int max) {
        Set<String> seen = new LinkedHashSet<>();
        for (String selector : COMMENT_SELECTORS) {
            for (Element el : page.select(selector)) {
                String text = el.text().trim();
                if (!text.isEmpty()) {
                    seen.add(text);
                }
                if (seen.size() >= max) {
                    return new ArrayList<>(seen);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    private static Element mainContent(Document page) {
        for (String selector : CONTENT_SELECTORS) {
            Element el = page.selectFirst(selector);
            if (el != null && el.text().length() >= MIN_BLOCK_CHARS) {
                return el;
            }
        }

        Element best = null;
        int bestScore = 0;
        for (Element block : page.select("div, section, td")) {
            int score = 0;
            for (Element p : block.children()) {
                if (p.tagName().equals("p")) {
                    score += p.text().length();
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = block;
            }
        }
        if (best != null && bestScore >= MIN_BLOCK_CHARS) {
            return best;
        }
        return page.body() != null ? page.body() : page;
    }

    /** Visible text with one line per block element. */
    static String blockText(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    sb.append(((TextNode) node).text());
                } else if (node instanceof Element && BLOCK_TAGS.contains(((Element) node).normalName())) {
                    sb.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && BLOCK_TAGS.contains(((Element) node).normalName())) {
                    sb.append('\n');
                }
            }
        }, root);

        StringBuilder out = new StringBuilder();
        for (String line : sb.toString().split("\n")) {
            String collapsed = line.replaceAll("[\\s\\u00A0]+", " ").trim();
            if (!collapsed.isEmpty()) {
                if (out.length() > 0) {
                    out.append('\n');
                }
                out.append(collapsed);
            }
        }
        return out.toString();
    }

    private static String attr(Document page, String selector, String attr) {
        Element el = page.selectFirst(selector);
        if (el == null) {
            return null;
        }
        String value = el.attr(attr).trim();
        return value.isEmpty() ? null : value;
    }
}
