package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.MissingColumnException;
import com.company.datasetsplitter.table.TabularQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gate that checks the category column exists before any rows are read.
 * Only the declared column names are consulted.
 */
@Slf4j
@Component
public class SchemaValidator {

    public boolean hasColumn(TabularQuery query, String column) {
        boolean present = query.hasColumn(column);
        if (!present) {
            log.debug("Column {} not declared by {}; available: {}", column, query.getSourceName(), query.columns());
        }
        return present;
    }

    /**
     * @throws MissingColumnException when the column is absent
     */
    public void requireColumn(TabularQuery query, String column) {
        if (!hasColumn(query, column)) {
            throw new MissingColumnException(column, query.getSourceName());
        }
    }
}
