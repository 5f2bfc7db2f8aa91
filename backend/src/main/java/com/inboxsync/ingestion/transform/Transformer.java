package com.inboxsync.ingestion.transform;

import com.inboxsync.domain.RowRecord;
import com.inboxsync.ingestion.source.RawItem;

/**
 * Maps raw item content to a row. Pure: no network access.
 */
public interface Transformer {

    /**
     * @throws MalformedContentException when the content cannot be interpreted
     */
    RowRecord transform(RawItem item);
}
