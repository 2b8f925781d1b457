package org.modulematch.repository.entitiesRepository;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.Gene;
import org.modulematch.domain.PhenotypeProfile;
import org.modulematch.domain.StabilityClass;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.RepositoryException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads a module snapshot from its JSON form. The location is either
 * {@code classpath:<resource>} or a file system path.
 */
public class ModuleSnapshotLoader {
    private static final Logger log = LogManager.getLogger(ModuleSnapshotLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final Gson gson = new Gson();
    private final int moduleCount;
    private final double coreThreshold;
    private final double unstableThreshold;

    public ModuleSnapshotLoader(int moduleCount, double coreThreshold, double unstableThreshold) {
        if (unstableThreshold > coreThreshold) {
            throw new IllegalArgumentException("unstableThreshold " + unstableThreshold
                    + " exceeds coreThreshold " + coreThreshold);
        }
        this.moduleCount = moduleCount;
        this.coreThreshold = coreThreshold;
        this.unstableThreshold = unstableThreshold;
    }

    public ModuleSnapshot load(String location) throws RepositoryException {
        log.info("Loading module snapshot from {}", location);
        try (Reader reader = open(location)) {
            return read(reader);
        } catch (IOException e) {
            log.error("Error reading module snapshot from {}", location, e);
            throw new RepositoryException("Could not read module snapshot: " + location, e);
        }
    }

    public ModuleSnapshot read(Reader reader) throws RepositoryException {
        SnapshotDocument document;
        try {
            document = gson.fromJson(reader, SnapshotDocument.class);
        } catch (JsonParseException e) {
            throw new RepositoryException("Malformed module snapshot: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new RepositoryException("Module snapshot is empty");
        }

        try {
            ModuleSnapshot.Builder builder = ModuleSnapshot.builder(moduleCount);
            for (GeneRow row : nullToEmpty(document.genes)) {
                builder.addGene(toGene(row));
            }
            for (ModuleRow module : nullToEmpty(document.modules)) {
                if (module.moduleId == null) {
                    throw new ValidationException("Module entry without module_id");
                }
                for (PhenotypeRow row : nullToEmpty(module.phenotypes)) {
                    builder.addPhenotype(module.moduleId, toProfile(row));
                }
            }
            return builder.build();
        } catch (ValidationException e) {
            log.error("Module snapshot failed validation: {}", e.getMessage());
            throw new RepositoryException("Invalid module snapshot: " + e.getMessage(), e);
        }
    }

    private Gene toGene(GeneRow row) {
        if (row.gene == null || row.gene.isBlank()) {
            throw new ValidationException("Gene entry without symbol");
        }
        if (row.moduleId == null) {
            throw new ValidationException("Gene " + row.gene + " has no module_id");
        }
        StabilityClass classification = StabilityClass.fromLabel(row.classification)
                .orElseGet(() -> StabilityClass.fromScore(row.stabilityScore, coreThreshold, unstableThreshold));
        return new Gene(row.gene.trim(), row.moduleId, row.stabilityScore, classification);
    }

    private static PhenotypeProfile toProfile(PhenotypeRow row) {
        if (row.phenotypeId == null || row.phenotypeId.isBlank()) {
            throw new ValidationException("Phenotype entry without hpo_id");
        }
        return new PhenotypeProfile(
                row.phenotypeId.trim(),
                row.name == null ? "" : row.name.trim(),
                row.prevalence,
                row.specificity,
                new LinkedHashSet<>(nullToEmpty(row.genesWith)),
                nullToEmpty(row.genesWithout),
                nullToEmpty(row.nonTargetGenes),
                nullToEmpty(row.backgroundGenes));
    }

    private Reader open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = getClass().getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new RepositoryException("Module snapshot resource not found on classpath: " + resource);
            }
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(Path.of(location), StandardCharsets.UTF_8);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    static class SnapshotDocument {
        List<ModuleRow> modules;
        List<GeneRow> genes;
    }

    static class ModuleRow {
        @SerializedName("module_id")
        Integer moduleId;
        List<PhenotypeRow> phenotypes;
    }

    static class PhenotypeRow {
        @SerializedName("hpo_id")
        String phenotypeId;
        @SerializedName("phenotype_name")
        String name;
        double prevalence;
        double specificity;
        @SerializedName("genes_with")
        List<String> genesWith;
        @SerializedName("genes_without")
        List<String> genesWithout;
        @SerializedName("non_target_genes")
        List<String> nonTargetGenes;
        @SerializedName("background_genes")
        List<String> backgroundGenes;
    }

    static class GeneRow {
        String gene;
        @SerializedName("module_id")
        Integer moduleId;
        @SerializedName("stability_score")
        double stabilityScore;
        String classification;
    }
}
