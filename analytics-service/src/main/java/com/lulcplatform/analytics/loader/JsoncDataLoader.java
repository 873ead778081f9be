package com.lulcplatform.analytics.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lulcplatform.common.calendar.CropCalendar;
import com.lulcplatform.common.model.Initiative;
import com.lulcplatform.common.model.InitiativeColumns;
import com.lulcplatform.common.model.InitiativeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the commented-JSON source files into core model objects.
 *
 * <p>The initiative file may be either an array of records or an object keyed by
 * initiative name; in the keyed form the key stands in for a missing
 * {@code name}. Records without a usable name are skipped, and repeated names
 * keep their first occurrence. The metadata file is an object keyed by name.
 *
 * <p>Bad rows are logged and skipped. Only a missing or unparseable file raises
 * {@link DataLoadException}.
 */
@Component
public class JsoncDataLoader {

    private static final Logger log = LoggerFactory.getLogger(JsoncDataLoader.class);

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public JsoncDataLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public LoadedSources load(DataLocations locations) {
        long start = System.currentTimeMillis();

        List<Initiative> initiatives = loadInitiatives(locations.initiatives());
        Map<String, InitiativeMetadata> metadata = loadMetadata(locations.metadata());

        Map<String, Object> rawCalendar = null;
        if (locations.hasCalendar()) {
            rawCalendar = loadCalendar(locations.calendar()).getCropCalendar();
            if (rawCalendar == null) {
                log.warn("[Loader] No crop_calendar section. location={}", locations.calendar());
            }
        }
        CropCalendar calendar = CropCalendar.fromRaw(rawCalendar);

        log.info("[Loader] Sources loaded. initiatives={} metadata={} crops={} elapsedMs={}",
            initiatives.size(), metadata.size(), calendar.crops().size(),
            System.currentTimeMillis() - start);
        return new LoadedSources(initiatives, metadata, rawCalendar, calendar, Instant.now());
    }

    // ── Initiatives ────────────────────────────────────────────────

    List<Initiative> loadInitiatives(String location) {
        JsonNode root = readTree(location);
        List<Map<String, Object>> records = new ArrayList<>();

        if (root.isArray()) {
            int index = 0;
            for (JsonNode node : root) {
                if (node.isObject()) {
                    records.add(objectMapper.convertValue(node, RECORD));
                } else {
                    log.warn("[Loader] Skipping non-object initiative record. location={} index={}", location, index);
                }
                index++;
            }
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isObject()) {
                    log.warn("[Loader] Skipping non-object initiative record. location={} key={}",
                        location, field.getKey());
                    continue;
                }
                Map<String, Object> record = new LinkedHashMap<>(objectMapper.convertValue(field.getValue(), RECORD));
                record.putIfAbsent(InitiativeColumns.NAME, field.getKey());
                records.add(record);
            }
        } else {
            throw new DataLoadException(location, "expected an array or object of initiative records");
        }

        Map<String, Initiative> byName = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            Initiative initiative;
            try {
                initiative = Initiative.fromRecord(record);
            } catch (IllegalArgumentException e) {
                log.warn("[Loader] Skipping initiative record. location={} reason={}", location, e.getMessage());
                continue;
            }
            if (byName.putIfAbsent(initiative.name(), initiative) != null) {
                log.warn("[Loader] Duplicate initiative ignored. location={} name={}", location, initiative.name());
            }
        }
        return new ArrayList<>(byName.values());
    }

    // ── Metadata ───────────────────────────────────────────────────

    Map<String, InitiativeMetadata> loadMetadata(String location) {
        JsonNode root = readTree(location);
        if (!root.isObject()) {
            throw new DataLoadException(location, "expected an object keyed by initiative name");
        }

        Map<String, InitiativeMetadata> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                log.warn("[Loader] Skipping non-object metadata entry. location={} key={}", location, field.getKey());
                continue;
            }
            Map<String, Object> record = objectMapper.convertValue(field.getValue(), RECORD);
            metadata.put(field.getKey(), InitiativeMetadata.fromRecord(field.getKey(), record));
        }
        return metadata;
    }

    // ── Calendar ───────────────────────────────────────────────────

    CropCalendarDocument loadCalendar(String location) {
        JsonNode root = readTree(location);
        try {
            return objectMapper.treeToValue(root, CropCalendarDocument.class);
        } catch (IOException e) {
            throw new DataLoadException(location, "invalid crop calendar document", e);
        }
    }

    // ── I/O ────────────────────────────────────────────────────────

    private JsonNode readTree(String location) {
        Resource resource = resourceLoader.getResource(resolve(location));
        if (!resource.exists()) {
            throw new DataLoadException(location, "source file not found");
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new DataLoadException(location, "source file is empty");
            }
            return root;
        } catch (IOException e) {
            throw new DataLoadException(location, "cannot read source file: " + e.getMessage(), e);
        }
    }

    static String resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new DataLoadException(String.valueOf(location), "no source location configured");
        }
        String trimmed = location.trim();
        return trimmed.contains(":") && !isWindowsDrive(trimmed) ? trimmed : "file:" + trimmed;
    }

    private static boolean isWindowsDrive(String location) {
        return location.length() > 2 && location.charAt(1) == ':' && Character.isLetter(location.charAt(0));
    }
}
