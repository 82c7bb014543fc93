package com.fraudplatform.orchestrator.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fraudplatform.common.exception.ClaimDataException;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads claims from a CSV export of the copay detail table. The header row names the
 * columns (snake_case, as in the table); unknown columns are ignored and at most
 * {@code fraud.data.limit} rows are read.
 */
@Component
public class CsvClaimDataSource implements ClaimDataSource {

    private static final Logger log = LoggerFactory.getLogger(CsvClaimDataSource.class);

    private final CsvMapper csvMapper;
    private final Resource csvResource;
    private final int limit;

    public CsvClaimDataSource(CsvMapper csvMapper,
                              @Value("${fraud.data.csv-path:classpath:data/claims.csv}") Resource csvResource,
                              @Value("${fraud.data.limit:10000}") int limit) {
        this.csvMapper = csvMapper;
        this.csvResource = csvResource;
        this.limit = limit;
    }

    @Override
    public Mono<ClaimDataset> load() {
        return Mono.fromCallable(this::read)
            .subscribeOn(Schedulers.boundedElastic());
    }

    private ClaimDataset read() {
        if (!csvResource.exists()) {
            throw new ClaimDataException("Claim file not found: " + csvResource.getDescription());
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<ClaimRecord> records = new ArrayList<>();
        try (InputStream in = csvResource.getInputStream();
             MappingIterator<ClaimRecord> rows = csvMapper.readerFor(ClaimRecord.class).with(schema).readValues(in)) {
            while (rows.hasNextValue() && records.size() < limit) {
                records.add(rows.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new ClaimDataException("Failed to read claims from " + csvResource.getDescription(), e);
        }
        log.info("Loaded {} claims from {} (limit={})", records.size(), csvResource.getDescription(), limit);
        return ClaimDataset.of(records);
    }
}
