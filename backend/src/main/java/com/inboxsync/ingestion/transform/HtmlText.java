package com.inboxsync.ingestion.transform;

import com.inboxsync.domain.RowRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * HTML to single-line text: parses with jsoup, drops script/style elements, keeps the visible text
 * with entities decoded, collapses whitespace.
 */
final class HtmlText {

    private HtmlText() {
    }

    static String toText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        doc.select("script,style").remove();
        return collapse(doc.text());
    }

    static String collapse(String text) {
        return RowRecord.singleLine(text);
    }
}
