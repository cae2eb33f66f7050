package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.model.NullPolicy;
import com.company.datasetsplitter.table.TabularQuery;
import org.springframework.stereotype.Component;

/**
 * Rewrites the query so that no row carries a null category: nulls are either replaced by the sentinel
 * or filtered out. The result is still deferred.
 */
@Component
public class NullPolicyApplier {

    public TabularQuery apply(TabularQuery query, String column, NullPolicy policy) {
        if (policy.getKind() == NullPolicy.Kind.FILL) {
            return query.fillNull(column, policy.getSentinel().orElseThrow());
        }
        return query.filterNotNull(column);
    }
}
