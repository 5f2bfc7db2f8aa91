package com.inboxsync.ingestion.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inboxsync.gmail")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class GmailProperties {

    /** Hard Gmail limit for users.messages.batchModify. */
    public static final int MAX_BATCH_MODIFY_IDS = 1000;

    /** Mailbox owner; "me" is the authenticated user. */
    @NotBlank
    private String userId = "me";

    /** Base search query; subject include keywords are appended when configured. */
    private String baseQuery = "in:inbox is:unread";

    /** Cap on candidates listed per run. 0 = all unread messages. */
    @Min(0)
    private int maxResults = 0;

    /** Ids per acknowledgment call, clamped to 1..1000. */
    @Min(1)
    @Max(MAX_BATCH_MODIFY_IDS)
    private int ackBatchSize = MAX_BATCH_MODIFY_IDS;

    public int effectiveAckBatchSize() {
        return Math.max(1, Math.min(ackBatchSize, MAX_BATCH_MODIFY_IDS));
    }
}
