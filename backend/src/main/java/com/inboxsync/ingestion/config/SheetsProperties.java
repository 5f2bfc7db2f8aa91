package com.inboxsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Destination spreadsheet and its two tabs: user-facing rows and the processed-id ledger.
 */
@ConfigurationProperties(prefix = "inboxsync.sheets")
@NoArgsConstructor
@Getter
@Setter
public class SheetsProperties {

    /** Target spreadsheet id (env SPREADSHEET_ID). Required. */
    private String spreadsheetId;

    /** Tab receiving one row per message: From, Subject, Date, Content. */
    private String rowsTab = "Emails";

    /** Tab holding synchronized message ids, one per row under a "messageId" header. */
    private String identitiesTab = "Processed";
}
