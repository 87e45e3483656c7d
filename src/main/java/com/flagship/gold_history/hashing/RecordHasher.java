package com.flagship.gold_history.hashing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.entity.HistoryColumn;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes record_hash values and snapshot checksums.
 *
 * The canonical form of a version is a JSON object whose keys are sorted:
 * <pre>
 * {"attributes":{"first_name":"Ana","last_name":"Diaz","national_id":"1"},"deleted":false}
 * </pre>
 * Values are normalised per column type (decimals at scale 2, ISO dates,
 * text unchanged) before rendering, so the digest does not depend on
 * attribute declaration order, number formatting or locale. Nulls stay
 * JSON nulls and never collide with empty strings.
 *
 * The deletion marker is part of the canonical form: a tombstone and a live
 * version with the same attributes hash differently.
 */
@Component
public class RecordHasher {

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper;

    public RecordHasher() {
        // Private mapper: application-level Jackson settings must not change digests.
        this.canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Digest of an entity version.
     *
     * @param definition entity definition giving column names and types
     * @param entity the business attributes
     * @param deleted whether the version is a tombstone
     * @return lower-case hex SHA-256
     */
    public <T> String digest(EntityDefinition<T> definition, T entity, boolean deleted) {
        Map<String, Object> columns = definition.toColumns(entity);
        Map<String, String> canonical = new HashMap<>();
        for (HistoryColumn column : definition.getBusinessColumns()) {
            canonical.put(column.getName(), column.getType().canonical(columns.get(column.getName())));
        }
        return digestCanonical(canonical, deleted);
    }

    /**
     * Digest of already-normalised attribute values. Key order of the map
     * does not matter.
     */
    public String digestCanonical(Map<String, String> attributes, boolean deleted) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("attributes", new TreeMap<>(attributes));
        document.put("deleted", deleted);
        try {
            return sha256Hex(canonicalMapper.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to render canonical record", e);
        }
    }

    /**
     * Checksum of a whole snapshot, used as the ledger checksum when the
     * caller has no file checksum. Independent of row order.
     */
    public <T> String snapshotChecksum(EntityDefinition<T> definition, Collection<T> rows) {
        List<String> lines = new ArrayList<>(rows.size());
        for (T row : rows) {
            lines.add(definition.naturalKey(row) + "=" + digest(definition, row, false));
        }
        Collections.sort(lines);
        StringBuilder content = new StringBuilder(definition.getDataset()).append('\n');
        lines.forEach(line -> content.append(line).append('\n'));
        return sha256Hex(content.toString());
    }

    static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
