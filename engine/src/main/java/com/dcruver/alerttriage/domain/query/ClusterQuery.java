package com.dcruver.alerttriage.domain.query;

import com.dcruver.alerttriage.domain.DbscanParams;
import lombok.Builder;
import lombok.Value;

/**
 * Filters and page window applied to a clustering summary.
 * A limit of zero or less means no limit.
 */
@Value
@Builder
public class ClusterQuery {
    int minClusterSize;
    int limit;
    int offset;
    String keyword;
    @Builder.Default
    DbscanParams dbscanParams = DbscanParams.DEFAULT;
}
