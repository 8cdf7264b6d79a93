package com.visaeligibility.service.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.exception.EligibilityException;
import com.visaeligibility.model.Chunk;
import com.visaeligibility.model.Fact;
import com.visaeligibility.model.FactType;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.model.RuleVersion;
import com.visaeligibility.model.VisaType;
import com.visaeligibility.service.retrieval.InMemoryChunkIndex;
import com.visaeligibility.service.store.memory.InMemoryCaseFactsStore;
import com.visaeligibility.service.store.memory.InMemoryRuleVersionStore;
import com.visaeligibility.service.store.memory.InMemoryVisaCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the in-memory stores from the JSON files named under
 * {@code eligibility.dataset.*}. Paths accept {@code classpath:} and
 * {@code file:} prefixes. Rule expressions are validated while loading, so a
 * file with an unknown operator fails the whole load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedDataLoader {

    static final String DEFAULT_FACT_SOURCE = "seed";

    private final EligibilityProperties properties;
    private final ResourceLoader resourceLoader;
    private final InMemoryCaseFactsStore caseFactsStore;
    private final InMemoryVisaCatalog visaCatalog;
    private final InMemoryRuleVersionStore ruleVersionStore;
    private final InMemoryChunkIndex chunkIndex;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    /**
     * Replaces the content of every store with the configured seed files.
     *
     * @return counts per store
     */
    public synchronized Map<String, Object> load() {
        EligibilityProperties.Dataset dataset = properties.getDataset();
        if (dataset == null) {
            log.warn("No eligibility.dataset configured, stores stay empty");
            return getStatistics();
        }

        try {
            loadVisaTypes(dataset.getVisaTypes());
            loadRuleVersions(dataset.getRuleVersions());
            loadFacts(dataset.getFacts());
            loadChunks(dataset.getChunks());
        } catch (IOException e) {
            log.error("Failed to load seed data: {}", e.getMessage(), e);
            throw new EligibilityException("Failed to load seed data", e);
        }

        Map<String, Object> stats = getStatistics();
        log.info("Seed data loaded: {}", stats);
        return stats;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("visaTypes", visaCatalog.findAll().size());
        stats.put("ruleVersions", ruleVersionStore.size());
        stats.put("cases", caseFactsStore.getCaseCount());
        stats.put("chunks", chunkIndex.size());
        return stats;
    }

    // ============================================================
    // Private Helper Methods
    // ============================================================

    private void loadVisaTypes(String location) throws IOException {
        if (location == null) {
            return;
        }
        List<VisaType> visaTypes = read(location, new TypeReference<>() {});
        visaCatalog.clear();
        visaTypes.forEach(visaCatalog::put);
        log.info("Loaded {} visa types from {}", visaTypes.size(), location);
    }

    private void loadRuleVersions(String location) throws IOException {
        if (location == null) {
            return;
        }
        List<RuleVersion> ruleVersions = read(location, new TypeReference<>() {});
        ruleVersionStore.clear();
        ruleVersions.forEach(ruleVersionStore::add);
        log.info("Loaded {} rule versions from {}", ruleVersions.size(), location);
    }

    private void loadChunks(String location) throws IOException {
        if (location == null) {
            return;
        }
        List<Chunk> chunks = read(location, new TypeReference<>() {});
        chunkIndex.replaceAll(chunks);
    }

    /**
     * Facts file: case id to an object of fact key to value. A value is either
     * a JSON scalar, typed by its JSON kind, or
     * {@code {"type": "DATE", "value": "2025-01-31", "source": "passport"}} where
     * {@code source} is optional.
     */
    private void loadFacts(String location) throws IOException {
        if (location == null) {
            return;
        }
        JsonNode root = readTree(location);
        caseFactsStore.clear();

        Iterator<Map.Entry<String, JsonNode>> cases = root.fields();
        while (cases.hasNext()) {
            Map.Entry<String, JsonNode> entry = cases.next();
            List<Fact> facts = new ArrayList<>();
            entry.getValue().fields().forEachRemaining(fact ->
                    facts.add(toFact(entry.getKey(), fact.getKey(), fact.getValue())));
            caseFactsStore.putFacts(entry.getKey(), facts);
        }
        log.info("Loaded facts for {} cases from {}", caseFactsStore.getCaseCount(), location);
    }

    static Fact toFact(String caseId, String key, JsonNode node) {
        String source = node.isObject() && node.hasNonNull("source")
                ? node.get("source").asText()
                : DEFAULT_FACT_SOURCE;
        return new Fact(caseId, key, toFactValue(caseId, key, node), source);
    }

    static FactValue toFactValue(String caseId, String key, JsonNode node) {
        if (node.isObject() && node.has("type") && node.has("value")) {
            FactType type = FactType.valueOf(node.get("type").asText().toUpperCase(Locale.ROOT));
            String raw = node.get("value").asText();
            return switch (type) {
                case NUMBER -> FactValue.number(raw);
                case DATE -> FactValue.date(raw);
                case BOOLEAN -> FactValue.of(Boolean.parseBoolean(raw));
                case STRING -> FactValue.of(raw);
            };
        }
        if (node.isNumber()) {
            return FactValue.of(node.decimalValue());
        }
        if (node.isBoolean()) {
            return FactValue.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return FactValue.of(node.textValue());
        }
        throw new EligibilityException("Unsupported value for fact '" + key + "' of case " + caseId + ": " + node);
    }

    private <T> T read(String location, TypeReference<T> type) throws IOException {
        try (InputStream in = open(location)) {
            return objectMapper.readValue(in, type);
        }
    }

    private JsonNode readTree(String location) throws IOException {
        try (InputStream in = open(location)) {
            return objectMapper.readTree(in);
        }
    }

    private InputStream open(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Seed file not found: " + location);
        }
        return resource.getInputStream();
    }
}
