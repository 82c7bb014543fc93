package com.fraudplatform.orchestrator;

import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;

import java.time.LocalDate;
import java.util.Arrays;

/** Minimal claim rows for orchestrator tests. */
public final class Claims {

    private Claims() {}

    public static ClaimRecord claim(String pharmacy, String coverage, double copay) {
        return new ClaimRecord(pharmacy, pharmacy + " Pharmacy", "Springfield", "IL",
            "PT-" + pharmacy, "00002-7510", "Humalog", coverage, 2,
            copay, copay, 0.0, 100.0, LocalDate.of(2024, 1, 10),
            "Y", "Chain", null, null, null, null, null, null);
    }

    public static ClaimDataset dataset(ClaimRecord... records) {
        return ClaimDataset.of(Arrays.asList(records));
    }
}
