package com.inboxsync.ingestion.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxsync.domain.ItemIdentity;
import com.inboxsync.domain.RowRecord;
import com.inboxsync.ingestion.config.SyncJobProperties;
import com.inboxsync.ingestion.source.RawItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Gmail {@code format=full} message to row. Prefers the first text/plain part anywhere in the MIME tree,
 * falls back to the first text/html part converted to text.
 */
@Component
public class GmailMessageTransformer implements Transformer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final ZoneId zone;

    @Autowired
    public GmailMessageTransformer(SyncJobProperties jobProperties) {
        this(resolveZone(jobProperties.getTimeZone()));
    }

    GmailMessageTransformer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public RowRecord transform(RawItem item) {
        ItemIdentity id = item.id();
        JsonNode message = item.content();
        if (message == null || !message.path("payload").isObject()) {
            throw new MalformedContentException(id, "missing payload");
        }
        JsonNode payload = message.path("payload");
        JsonNode headers = payload.path("headers");
        String from = header(headers, "From");
        String subject = header(headers, "Subject");
        String date = formatDate(id, message.path("internalDate"));
        String content = body(id, payload);
        return new RowRecord(from, subject, date, content);
    }

    private String formatDate(ItemIdentity id, JsonNode internalDate) {
        if (internalDate.isMissingNode() || internalDate.isNull()) {
            throw new MalformedContentException(id, "missing internalDate");
        }
        long epochMs;
        try {
            epochMs = Long.parseLong(internalDate.asText().strip());
        } catch (NumberFormatException e) {
            throw new MalformedContentException(id, "internalDate is not epoch millis: " + internalDate.asText(), e);
        }
        return DATE_FORMAT.format(Instant.ofEpochMilli(epochMs).atZone(zone));
    }

    private static String header(JsonNode headers, String name) {
        for (JsonNode h : headers) {
            if (name.equalsIgnoreCase(h.path("name").asText())) {
                return h.path("value").asText("");
            }
        }
        return "";
    }

    private static String body(ItemIdentity id, JsonNode payload) {
        JsonNode parts = payload.path("parts");
        if (parts.isArray() && !parts.isEmpty()) {
            BodyCandidates found = new BodyCandidates();
            walk(id, parts, found);
            if (found.plain != null) {
                return found.plain;
            }
            return found.html != null ? found.html : "";
        }
        String single = textOf(id, payload);
        if (single != null && !single.isEmpty()) {
            return single;
        }
        return RowRecord.singleLine(decode(id, payload.path("body").path("data").asText(null)));
    }

    private static void walk(ItemIdentity id, JsonNode parts, BodyCandidates found) {
        for (JsonNode part : parts) {
            String mime = part.path("mimeType").asText("");
            String text = textOf(id, part);
            if (text != null && !text.isEmpty()) {
                if (mime.startsWith("text/plain") && found.plain == null) {
                    found.plain = text;
                } else if (mime.startsWith("text/html") && found.html == null) {
                    found.html = text;
                }
            }
            JsonNode nested = part.path("parts");
            if (nested.isArray()) {
                walk(id, nested, found);
            }
        }
    }

    /** Decoded text for text/plain or text/html parts with inline data; null otherwise. */
    private static String textOf(ItemIdentity id, JsonNode part) {
        String mime = part.path("mimeType").asText("");
        String data = part.path("body").path("data").asText(null);
        if (data == null || data.isEmpty()) {
            return null;
        }
        if (mime.startsWith("text/plain")) {
            return RowRecord.singleLine(decode(id, data));
        }
        if (mime.startsWith("text/html")) {
            return HtmlText.toText(decode(id, data));
        }
        return null;
    }

    /** base64url, padding optional. */
    static String decode(ItemIdentity id, String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return "";
        }
        try {
            byte[] bytes = Base64.getUrlDecoder().decode(encoded.strip());
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedContentException(id, "body is not base64url", e);
        }
    }

    private static ZoneId resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.strip());
    }

    private static final class BodyCandidates {
        private String plain;
        private String html;
    }
}
