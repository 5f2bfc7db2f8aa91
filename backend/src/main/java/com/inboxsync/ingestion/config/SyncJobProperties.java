package com.inboxsync.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Trigger and execution settings for the sync job.
 */
@ConfigurationProperties(prefix = "inboxsync.job")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncJobProperties {

    /** When false the scheduled trigger does nothing; manual runs still work. */
    private boolean scheduleEnabled = true;

    /** Delay between the end of one scheduled run and the start of the next. */
    @Min(1000)
    private long intervalMs = 300_000;

    /** Run once as soon as the application is ready. */
    private boolean runOnStartup = false;

    /** Threads fetching message content concurrently. Persist stays sequential. */
    @Min(1)
    private int fetchParallelism = 4;

    /** Zone used to render the Date column; blank = system default. */
    private String timeZone = "";
}
