package com.inboxsync.ingestion.sink;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Google Sheets REST v4 client abstraction for testing. One HTTP request per method; no retries.
 */
public interface SheetsClient {

    /** spreadsheets.get limited to sheet titles. */
    Mono<String> getSheetTitles(String spreadsheetId);

    /** spreadsheets.values.get for an A1 range. Missing {@code values} means the range is empty. */
    Mono<String> getValues(String spreadsheetId, String range);

    /** spreadsheets.values.append with RAW input and INSERT_ROWS. */
    Mono<String> appendValues(String spreadsheetId, String range, List<List<String>> values);

    /** spreadsheets.values.update with RAW input. */
    Mono<String> updateValues(String spreadsheetId, String range, List<List<String>> values);

    /** spreadsheets.batchUpdate with the given request objects. */
    Mono<String> batchUpdate(String spreadsheetId, List<Map<String, Object>> requests);
}
