package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.table.TabularQuery;
import lombok.Value;

import java.util.List;

/**
 * Distinct categories of one file, in discovery order, with the query the partitions are cut from.
 * In cached scan mode the query is backed by the single materialized read used for discovery.
 */
@Value
public class ResolvedCategories {
    List<String> categories;
    TabularQuery partitionSource;
    CategoryInterner interner;

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    public int size() {
        return categories.size();
    }
}
