package com.inboxsync.ingestion.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxsync.common.RemoteCallException;
import com.inboxsync.domain.ItemIdentity;
import com.inboxsync.domain.RowRecord;
import com.inboxsync.ingestion.adapter.GoogleApiExecutor;
import com.inboxsync.ingestion.config.SheetsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Google Sheets sink. Rows go to the rows tab (From, Subject, Date, Content); synchronized message ids go
 * to the identities tab, one per row below a "messageId" header. Both tabs are created with headers on
 * first use when missing.
 */
@Component
@Slf4j
public class SheetsSinkAdapter implements SinkAdapter {

    static final List<String> ROW_HEADERS = List.of("From", "Subject", "Date", "Content");
    static final String IDENTITY_HEADER = "messageId";

    private final SheetsClient sheetsClient;
    private final GoogleApiExecutor googleApi;
    private final ObjectMapper objectMapper;
    private final String spreadsheetId;
    private final String rowsTab;
    private final String identitiesTab;

    private volatile boolean layoutReady;

    public SheetsSinkAdapter(SheetsClient sheetsClient, GoogleApiExecutor googleApi,
                             SheetsProperties properties, ObjectMapper objectMapper) {
        String id = properties.getSpreadsheetId();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException(
                    "Spreadsheet id not configured. Set inboxsync.sheets.spreadsheet-id or the SPREADSHEET_ID environment variable.");
        }
        this.sheetsClient = sheetsClient;
        this.googleApi = googleApi;
        this.objectMapper = objectMapper;
        this.spreadsheetId = id.strip();
        this.rowsTab = properties.getRowsTab();
        this.identitiesTab = properties.getIdentitiesTab();
    }

    @Override
    public List<ItemIdentity> readIdentities() {
        ensureLayout();
        String json = googleApi.call("sheets.values.get " + identitiesTab,
                () -> sheetsClient.getValues(spreadsheetId, identitiesTab + "!A2:A"));
        List<ItemIdentity> ids = new ArrayList<>();
        for (JsonNode row : parse(json, "values.get").path("values")) {
            String cell = row.path(0).asText("");
            if (!cell.isBlank()) {
                ids.add(ItemIdentity.of(cell));
            }
        }
        return ids;
    }

    @Override
    public void appendRows(List<RowRecord> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        ensureLayout();
        List<List<String>> values = rows.stream().map(RowRecord::cells).toList();
        log.debug("Appending {} row(s) to '{}'", values.size(), rowsTab);
        String json = googleApi.call("sheets.values.append " + rowsTab,
                () -> sheetsClient.appendValues(spreadsheetId, rowsTab + "!A2", values));
        logUpdatedRows(json, rowsTab, values.size());
    }

    @Override
    public void appendIdentities(List<ItemIdentity> identities) {
        if (identities == null || identities.isEmpty()) {
            return;
        }
        ensureLayout();
        List<List<String>> values = identities.stream().map(id -> List.of(id.value())).toList();
        String json = googleApi.call("sheets.values.append " + identitiesTab,
                () -> sheetsClient.appendValues(spreadsheetId, identitiesTab + "!A2", values));
        logUpdatedRows(json, identitiesTab, values.size());
    }

    /**
     * Adds missing tabs and writes their header rows. Idempotent; checked once per process.
     */
    synchronized void ensureLayout() {
        if (layoutReady) {
            return;
        }
        String json = googleApi.call("sheets.get", () -> sheetsClient.getSheetTitles(spreadsheetId));
        Set<String> titles = new HashSet<>();
        for (JsonNode sheet : parse(json, "spreadsheets.get").path("sheets")) {
            titles.add(sheet.path("properties").path("title").asText());
        }
        Map<String, List<String>> missing = new LinkedHashMap<>();
        if (!titles.contains(rowsTab)) {
            missing.put(rowsTab, ROW_HEADERS);
        }
        if (!titles.contains(identitiesTab)) {
            missing.put(identitiesTab, List.of(IDENTITY_HEADER));
        }
        if (!missing.isEmpty()) {
            List<Map<String, Object>> requests = missing.keySet().stream()
                    .map(title -> Map.<String, Object>of("addSheet", Map.of("properties", Map.of("title", title))))
                    .toList();
            googleApi.call("sheets.batchUpdate", () -> sheetsClient.batchUpdate(spreadsheetId, requests));
            for (Map.Entry<String, List<String>> tab : missing.entrySet()) {
                String range = tab.getKey() + "!A1";
                googleApi.call("sheets.values.update " + tab.getKey(),
                        () -> sheetsClient.updateValues(spreadsheetId, range, List.of(tab.getValue())));
            }
            log.info("Created sheet tab(s) {} in spreadsheet {}", missing.keySet(), spreadsheetId);
        }
        layoutReady = true;
    }

    /** Runs after a confirmed append, so it must not fail: a retry would append the rows again. */
    private void logUpdatedRows(String json, String tab, int expected) {
        JsonNode updated;
        try {
            updated = objectMapper.readTree(json == null || json.isBlank() ? "{}" : json)
                    .path("updates").path("updatedRows");
        } catch (JsonProcessingException e) {
            log.warn("Append to '{}' succeeded but the response was unreadable: {}", tab, e.getOriginalMessage());
            return;
        }
        if (updated.isMissingNode()) {
            log.info("Appended {} row(s) to '{}'", expected, tab);
        } else if (updated.asInt() != expected) {
            log.warn("Append to '{}' reported {} updated row(s), expected {}", tab, updated.asInt(), expected);
        } else {
            log.info("Appended {} row(s) to '{}'", updated.asInt(), tab);
        }
    }

    private JsonNode parse(String json, String what) {
        try {
            return objectMapper.readTree(json == null || json.isBlank() ? "{}" : json);
        } catch (JsonProcessingException e) {
            throw RemoteCallException.transientFailure("Unparseable Sheets response for " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
