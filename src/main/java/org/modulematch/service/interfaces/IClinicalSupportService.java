package org.modulematch.service.interfaces;

import org.modulematch.domain.GeneQueryResult;
import org.modulematch.domain.ModuleSummary;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.QueryResult;
import org.modulematch.service.ServicesException;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for complete phenotype and gene queries.
 */
public interface IClinicalSupportService {

    /**
     * Runs module ranking, gene ranking, prediction and question selection for one query.
     *
     * @param observed phenotype names or ids that are present
     * @param excluded phenotype names or ids that are absent
     * @return the combined result; labels that match nothing are listed as unmatched inputs
     * @throws ServicesException if the query is invalid or the data provider fails
     */
    QueryResult query(List<String> observed, List<String> excluded) throws ServicesException;

    /**
     * Module context of a single gene.
     *
     * @param symbol gene symbol, case-sensitive
     * @return the gene's module context, or empty when the symbol is unknown
     * @throws ServicesException if the data provider fails
     */
    Optional<GeneQueryResult> queryGene(String symbol) throws ServicesException;

    /**
     * @param observed phenotype names or ids that are present
     * @param excluded phenotype names or ids that are absent
     * @return the most informative next phenotype, or none
     * @throws ServicesException if the query is invalid or the data provider fails
     */
    NextQuestion suggestNextPhenotype(List<String> observed, List<String> excluded) throws ServicesException;

    /**
     * @param moduleId the module id
     * @return gene counts, core genes and characteristic phenotypes of the module
     * @throws ServicesException if the module does not exist
     */
    ModuleSummary moduleSummary(int moduleId) throws ServicesException;
}
