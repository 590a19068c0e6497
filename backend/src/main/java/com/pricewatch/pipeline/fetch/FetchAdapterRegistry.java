package com.pricewatch.pipeline.fetch;

import com.pricewatch.pipeline.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class FetchAdapterRegistry {
    private final Map<SourceType, FetchAdapter> adapters = new EnumMap<>(SourceType.class);

    public FetchAdapterRegistry(List<FetchAdapter> adapters) {
        for (FetchAdapter adapter : adapters) {
            FetchAdapter previous = this.adapters.put(adapter.sourceType(), adapter);
            if (previous != null) {
                throw new IllegalStateException(
                    "Two fetch adapters registered for " + adapter.sourceType() + ": "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName()
                );
            }
        }
    }

    public Optional<FetchAdapter> find(SourceType sourceType) {
        if (sourceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(sourceType));
    }
}
