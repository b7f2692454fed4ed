package tech.syncbridge.platform.provider;

import java.util.List;

/**
 * One page of changed records.
 *
 * @param malformed entries the provider returned that could not be parsed; they are counted against the job
 * @param nextCursor opaque cursor to request the following page, the new watermark on the last page,
 *                   or {@code null} when the provider sent none
 */
public record RecordPage(List<ExternalRecord> records, List<MalformedRecord> malformed,
                         String nextCursor, boolean hasMore) {

    public RecordPage {
        records = records == null ? List.of() : List.copyOf(records);
        malformed = malformed == null ? List.of() : List.copyOf(malformed);
    }

    public RecordPage(List<ExternalRecord> records, String nextCursor, boolean hasMore) {
        this(records, List.of(), nextCursor, hasMore);
    }
}
