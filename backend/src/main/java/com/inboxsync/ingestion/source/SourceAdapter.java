package com.inboxsync.ingestion.source;

import com.inboxsync.domain.ItemIdentity;
import com.inboxsync.ingestion.filter.SubjectFilter;

import java.util.List;

/**
 * Mailbox side of the sync: candidate discovery, content fetch and acknowledgment.
 * Failures surface as {@link com.inboxsync.common.RemoteCallException}.
 */
public interface SourceAdapter {

    /**
     * Identities of candidate items. Implementations push the filter down to the server where they can;
     * callers still apply it locally, so an implementation may return a superset.
     */
    List<ItemIdentity> list(SubjectFilter filter);

    /**
     * Full content of one item. Throws a NOT_FOUND {@code RemoteCallException} when the item is gone.
     */
    RawItem fetch(ItemIdentity id);

    /**
     * Marks the items consumed at the source. Callers keep each call within {@link #maxAcknowledgeBatch()}.
     */
    void acknowledge(List<ItemIdentity> ids);

    default int maxAcknowledgeBatch() {
        return Integer.MAX_VALUE;
    }
}
