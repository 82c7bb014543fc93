package com.fraudplatform.orchestrator.data;

import com.fraudplatform.common.exception.ClaimDataException;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CsvClaimDataSourceTest {

    private final OrchestratorConfig config = new OrchestratorConfig();

    private CsvClaimDataSource source(String path, int limit) {
        return new CsvClaimDataSource(config.csvMapper(), new ClassPathResource(path), limit);
    }

    @Test
    @DisplayName("binds snake_case columns, ignores unknown ones and reads blanks as null")
    void bindsColumns() {
        ClaimDataset dataset = source("claims-sample.csv", 10_000).load().block();

        assertNotNull(dataset);
        assertEquals(3, dataset.size());
        assertEquals(2, dataset.claimsFor("PH001").size());

        ClaimRecord first = dataset.records().get(0);
        assertEquals("PH001", first.pharmacyNumber());
        assertEquals("Main Street Pharmacy", first.pharmacyName());
        assertEquals("Cash", first.coverageType());
        assertEquals(1, first.occ());
        assertEquals(250.0, first.copayCost());
        assertEquals(LocalDate.of(2024, 1, 3), first.dateSubmitted());
        assertEquals("75", first.paRejectionCode1());
        assertNull(first.paRejectionCode2());
        assertEquals("PA Rejected", first.latestPaStatusDesc());
    }

    @Test
    @DisplayName("stops reading at the configured row limit")
    void honoursLimit() {
        ClaimDataset dataset = source("claims-sample.csv", 2).load().block();

        assertNotNull(dataset);
        assertEquals(2, dataset.size());
    }

    @Test
    @DisplayName("bundled sample data loads")
    void bundledSample() {
        ClaimDataset dataset = source("data/claims.csv", 10_000).load().block();

        assertNotNull(dataset);
        assertEquals(10, dataset.size());
        assertEquals(3, dataset.byPharmacy().size());
    }

    @Test
    @DisplayName("a missing file surfaces as ClaimDataException")
    void missingFile() {
        CsvClaimDataSource missing = source("no-such-file.csv", 10);
        assertThrows(ClaimDataException.class, () -> missing.load().block());
    }
}
