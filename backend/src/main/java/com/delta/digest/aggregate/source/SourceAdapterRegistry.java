package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SourceAdapterRegistry {
    private final Map<SourceType, SourceAdapter> adapters = new EnumMap<>(SourceType.class);

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.type(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for source type " + adapter.type().code());
            }
        }
    }

    public SourceAdapter forType(SourceType type) {
        SourceAdapter adapter = adapters.get(type);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for source type " + type);
        }
        return adapter;
    }
}
