package com.fraudplatform.orchestrator.data;

import com.fraudplatform.common.model.ClaimDataset;
import reactor.core.publisher.Mono;

/**
 * Supplies the claim rows for one run. Failures surface as {@code ClaimDataException}.
 */
public interface ClaimDataSource {
    Mono<ClaimDataset> load();
}
