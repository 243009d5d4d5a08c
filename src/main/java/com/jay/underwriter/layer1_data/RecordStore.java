package com.jay.underwriter.layer1_data;

import com.jay.underwriter.model.BoardItem;
import com.jay.underwriter.model.ColumnWrite;

import java.util.List;

/**
 * External source and sink of investment records.
 * Implementations throw {@link RecordStoreException} on failure; the sync loop owns retries.
 */
public interface RecordStore {

    /** Reads every item on the configured board. An empty list means the board has no records. */
    List<BoardItem> fetchItems();

    /** Overwrites the given output columns of one item. */
    void writeColumns(String itemId, List<ColumnWrite> writes);
}
