package com.fraudplatform.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of the claims loaded for one run.
 *
 * <p>The pharmacy index is built once at construction; records without a pharmacy
 * number stay in {@link #records()} but are not indexed. Agents share a single
 * instance concurrently and must not attempt to modify it.
 */
public final class ClaimDataset {

    private static final ClaimDataset EMPTY = new ClaimDataset(List.of());

    private final List<ClaimRecord> records;
    private final Map<String, List<ClaimRecord>> byPharmacy;

    private ClaimDataset(List<ClaimRecord> records) {
        this.records = List.copyOf(records);
        Map<String, List<ClaimRecord>> index = this.records.stream()
            .filter(r -> !ClaimRecord.isBlank(r.pharmacyNumber()))
            .collect(Collectors.groupingBy(ClaimRecord::pharmacyNumber,
                LinkedHashMap::new, Collectors.toUnmodifiableList()));
        this.byPharmacy = Collections.unmodifiableMap(index);
    }

    public static ClaimDataset of(List<ClaimRecord> records) {
        Objects.requireNonNull(records, "records");
        return records.isEmpty() ? EMPTY : new ClaimDataset(records);
    }

    public static ClaimDataset empty() {
        return EMPTY;
    }

    public List<ClaimRecord> records() {
        return records;
    }

    /** Claims grouped by pharmacy number, in first-seen order. */
    public Map<String, List<ClaimRecord>> byPharmacy() {
        return byPharmacy;
    }

    public List<ClaimRecord> claimsFor(String pharmacyNumber) {
        return byPharmacy.getOrDefault(pharmacyNumber, List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return "ClaimDataset[records=" + records.size() + ", pharmacies=" + byPharmacy.size() + "]";
    }
}
