package io.seatwatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seatwatch.api.pool.PoolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads seed pool definitions from JSON.
 * <p>
 * Format: an array of objects with the fields {@code tool}, {@code total}, {@code commit_qty},
 * and optionally {@code max_overage}, {@code commit_price}, {@code overage_price_per_license}.
 */
public class PoolSeedLoader {

    private static final Logger log = LoggerFactory.getLogger(PoolSeedLoader.class);

    private final ObjectMapper objectMapper;

    public PoolSeedLoader() {
        this(new ObjectMapper());
    }

    public PoolSeedLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PoolDefinition> fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            List<PoolDefinition> pools = read(in);
            log.info("Loaded {} seed pools from {}", pools.size(), path.toAbsolutePath());
            return pools;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed pools from " + path, e);
        }
    }

    public List<PoolDefinition> fromClasspath(String resource) {
        InputStream in = PoolSeedLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Seed resource not found on classpath: " + resource);
        }
        try (in) {
            List<PoolDefinition> pools = read(in);
            log.info("Loaded {} seed pools from classpath:{}", pools.size(), resource);
            return pools;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed pools from classpath:" + resource, e);
        }
    }

    List<PoolDefinition> read(InputStream in) throws IOException {
        List<SeedEntry> entries = objectMapper.readValue(in, new TypeReference<List<SeedEntry>>() {});
        return entries.stream().map(SeedEntry::toDefinition).toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedEntry(
            @JsonProperty("tool") String tool,
            @JsonProperty("total") int total,
            @JsonProperty("commit_qty") int commitQty,
            @JsonProperty("max_overage") Integer maxOverage,
            @JsonProperty("commit_price") BigDecimal commitPrice,
            @JsonProperty("overage_price_per_license") BigDecimal overagePrice
    ) {

        PoolDefinition toDefinition() {
            PoolDefinition definition = PoolDefinition.named(tool)
                    .totalCapacity(total)
                    .commitQuantity(commitQty);
            if (maxOverage != null) {
                definition.maxOverage(maxOverage);
            }
            if (commitPrice != null) {
                definition.commitFee(commitPrice);
            }
            if (overagePrice != null) {
                definition.overageUnitPrice(overagePrice);
            }
            return definition.validate();
        }
    }
}
