package com.inboxsync.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowRecordTest {

    @Test
    void content_collapsedToSingleLine() {
        RowRecord row = new RowRecord("a@b.c", "Invoice", "2024-01-01", "  Hello,\r\n\r\n  your   invoice\tis ready.\n");
        assertThat(row.content()).isEqualTo("Hello, your invoice is ready.");
    }

    @Test
    void content_unicodeLineSeparatorsCollapsed() {
        RowRecord row = new RowRecord("a", "s", "d", "\u0085line1\u2028line2\u0085line3\u2029line4\u00a0\u0085");
        assertThat(row.content()).isEqualTo("line1 line2 line3 line4");
        assertThat(RowRecord.singleLine("\u2028\u0085 ")).isEmpty();
    }

    @Test
    void nullFields_becomeEmpty() {
        RowRecord row = new RowRecord(null, null, null, null);
        assertThat(row.cells()).containsExactly("", "", "", "");
    }

    @Test
    void itemIdentity_rejectsBlank() {
        assertThatThrownBy(() -> ItemIdentity.of("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(ItemIdentity.of(" 18c ").value()).isEqualTo("18c");
    }
}
