package org.modulematch.repository;

import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.PhenotypeProfile;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Name and id lookups over the phenotypes of every module. Built once per snapshot.
 */
public class PhenotypeIndex {
    private final Map<String, String> idsByNormalizedId;
    private final Map<String, String> idsByName;
    private final Map<String, Set<Integer>> modulesById;
    private final Map<String, String> displayNames;

    private PhenotypeIndex(Map<String, String> idsByNormalizedId, Map<String, String> idsByName,
                           Map<String, Set<Integer>> modulesById, Map<String, String> displayNames) {
        this.idsByNormalizedId = idsByNormalizedId;
        this.idsByName = idsByName;
        this.modulesById = modulesById;
        this.displayNames = displayNames;
    }

    /**
     * Modules are visited in the given order; the first module defining a name owns it.
     */
    public static PhenotypeIndex build(Collection<DiseaseModule> modules) {
        Map<String, String> idsByNormalizedId = new HashMap<>();
        Map<String, String> idsByName = new HashMap<>();
        Map<String, Set<Integer>> modulesById = new HashMap<>();
        Map<String, String> displayNames = new TreeMap<>();

        for (DiseaseModule module : modules) {
            for (PhenotypeProfile profile : module.getPhenotypes().values()) {
                String id = profile.getPhenotypeId();
                idsByNormalizedId.putIfAbsent(normalize(id), id);
                modulesById.computeIfAbsent(id, k -> new TreeSet<>()).add(module.getModuleId());
                if (profile.getName() != null && !profile.getName().isBlank()) {
                    idsByName.putIfAbsent(normalize(profile.getName()), id);
                    displayNames.putIfAbsent(profile.getName() + " (" + id + ")", id);
                }
            }
        }

        Map<String, Set<Integer>> frozen = new HashMap<>();
        modulesById.forEach((id, ids) -> frozen.put(id, Collections.unmodifiableSet(ids)));
        return new PhenotypeIndex(
                Collections.unmodifiableMap(idsByNormalizedId),
                Collections.unmodifiableMap(idsByName),
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(displayNames));
    }

    /**
     * Canonical id for a code or a name. Codes are tried first.
     */
    public Optional<String> resolve(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(text);
        String id = idsByNormalizedId.get(key);
        if (id == null) {
            id = idsByName.get(key);
        }
        return Optional.ofNullable(id);
    }

    public Set<Integer> modulesContaining(String phenotypeId) {
        return modulesById.getOrDefault(phenotypeId, Set.of());
    }

    public Map<String, String> displayNames() {
        return displayNames;
    }

    public int size() {
        return modulesById.size();
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
