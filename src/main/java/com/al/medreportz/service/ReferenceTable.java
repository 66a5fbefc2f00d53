package com.al.medreportz.service;

import com.al.medreportz.config.ReferenceRangeConfiguration;
import com.al.medreportz.model.ReferenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of the configured reference intervals, in declaration order.
 * Built once at startup and shared by concurrent extraction runs.
 */
@Slf4j
@Component
public class ReferenceTable {

    private final List<ReferenceEntry> entries;
    private final Map<String, ReferenceEntry> byKey;

    @Autowired
    public ReferenceTable(ReferenceRangeConfiguration configuration) {
        Map<String, ReferenceEntry> index = new LinkedHashMap<>();
        for (ReferenceRangeConfiguration.TestDefinition test : configuration.getTests()) {
            if (test.getKey() == null || test.getKey().isBlank()) {
                throw new IllegalArgumentException("Reference test definition without a key");
            }
            if (test.getLow() > test.getHigh()) {
                throw new IllegalArgumentException(String.format(
                        "Invalid reference interval for %s: low %s > high %s",
                        test.getKey(), test.getLow(), test.getHigh()));
            }
            String key = test.getKey().strip().toLowerCase(Locale.ROOT);
            List<String> aliases = new ArrayList<>();
            for (String alias : test.getAliases()) {
                if (alias != null && !alias.isBlank()) {
                    aliases.add(alias.strip().toLowerCase(Locale.ROOT));
                }
            }
            if (aliases.isEmpty()) {
                aliases.add(key);
            }
            String displayName = test.getDisplayName() != null ? test.getDisplayName() : test.getKey();
            ReferenceEntry previous = index.put(key, new ReferenceEntry(key, displayName,
                    List.copyOf(aliases), test.getLow(), test.getHigh(), test.getUnit()));
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate reference test key: " + key);
            }
        }
        this.byKey = Collections.unmodifiableMap(index);
        this.entries = List.copyOf(index.values());
        log.info("Loaded {} reference intervals", entries.size());
    }

    public List<ReferenceEntry> getEntries() {
        return entries;
    }

    public Optional<ReferenceEntry> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key.toLowerCase(Locale.ROOT)));
    }
}
