package com.disease.normalization.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Namespace prefixes that may appear in concept ids, cross-references and
 * associated-with references, with the system URI used when rendering them
 * as concept mappings.
 *
 * <p>The URI is the source's own lookup prefix where one exists, otherwise an
 * OBO Foundry PURL or the source homepage.</p>
 */
public enum NamespacePrefix {
    NCIT("ncit", "https://ncit.nci.nih.gov/ncitbrowser/ConceptReport.jsp?dictionary=NCI_Thesaurus&code="),
    MONDO("mondo", "https://purl.obolibrary.org/obo/"),
    DOID("DOID", "https://disease-ontology.org/?id="),
    OMIM("MIM", "https://omim.org/MIM:"),
    ONCOTREE("oncotree", "https://oncotree.mskcc.org/?version=oncotree_latest_stable&field=CODE&search="),
    EFO("efo", "http://www.ebi.ac.uk/efo/EFO_"),
    GARD("gard", "https://rarediseases.info.nih.gov"),
    ICD9CM("icd9.cm", "https://archive.cdc.gov/www_cdc_gov/nchs/icd/icd9cm.htm"),
    ICD10("icd10", "https://icd.who.int/browse10/2016/en#/"),
    ICD10CM("icd10.cm", "https://www.cdc.gov/nchs/icd/icd-10-cm/index.html"),
    ICDO("icdo", "https://www.who.int/standards/classifications/other-classifications/international-classification-of-diseases-for-oncology/"),
    IMDRF("imdrf", "https://www.imdrf.org/"),
    KEGG("kegg.disease", "https://www.genome.jp/kegg/disease/"),
    MEDDRA("meddra", "https://bioportal.bioontology.org/ontologies/MEDDRA?p=classes&conceptid="),
    MEDGEN("medgen", "https://www.ncbi.nlm.nih.gov/medgen/"),
    MESH("mesh", "https://meshb.nlm.nih.gov/record/ui?ui="),
    ORPHANET("orphanet", "https://www.orpha.net"),
    UMLS("umls", "https://www.nlm.nih.gov/research/umls/index.html");

    private final String prefix;
    private final String systemUri;

    NamespacePrefix(String prefix, String systemUri) {
        this.prefix = prefix;
        this.systemUri = systemUri;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getSystemUri() {
        return systemUri;
    }

    /**
     * Finds the namespace for a prefix, ignoring case.
     */
    public static Optional<NamespacePrefix> fromPrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        String lower = prefix.toLowerCase(Locale.ROOT);
        for (NamespacePrefix namespace : values()) {
            if (namespace.prefix.toLowerCase(Locale.ROOT).equals(lower)) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}
