package com.inboxsync.ingestion.config;

import com.inboxsync.ingestion.filter.SubjectFilter;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Optional subject keyword filters (env SUBJECT_INCLUDE / SUBJECT_EXCLUDE, comma-separated).
 * Defaults focus the sync on billing mail.
 */
@ConfigurationProperties(prefix = "inboxsync.filter")
@NoArgsConstructor
@Getter
@Setter
public class SubjectFilterProperties {

    private List<String> subjectInclude = List.of("invoice", "receipt", "payment", "bill");

    private List<String> subjectExclude = List.of();

    public SubjectFilter toFilter() {
        return new SubjectFilter(subjectInclude, subjectExclude);
    }
}
