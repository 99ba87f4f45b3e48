package uk.gegc.railintel.features.analysis.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copies of key-information maps. Null keys, null lists and null or blank items are
 * dropped, since these maps are filled from model output and client posts.
 */
public final class KeyInformationMaps {

    private KeyInformationMaps() {
    }

    public static Map<String, List<String>> copyOf(Map<String, List<String>> keyInformation) {
        if (keyInformation == null || keyInformation.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        keyInformation.forEach((key, items) -> {
            if (key != null) {
                copy.put(key, items == null ? List.of() : items.stream()
                        .filter(Objects::nonNull)
                        .filter(item -> !item.isBlank())
                        .toList());
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
