package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;

/**
 * Translates one source format into normalized entries. Implementations are stateless and must not throw
 * for network or payload problems: an unusable source is reported through {@link SourceFetchResult#failed}.
 */
public interface SourceAdapter {
    SourceType type();

    SourceFetchResult fetch(SourceConfig config);
}
