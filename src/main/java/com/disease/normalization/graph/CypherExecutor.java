package com.disease.normalization.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cypher statements behind the graph-backed concept store.
 *
 * <p>Graph layout:</p>
 * <ul>
 *   <li>{@code (:SourceConcept)} one node per source record, keyed by {@code conceptIdLower}</li>
 *   <li>{@code (:Term {field, valueLower})-[:TERM_OF]->(:SourceConcept)} one node per
 *       label, alias, xref or associated_with value</li>
 *   <li>{@code (:MergedConcept {version})} merged records of one rebuild, linked from
 *       their members by {@code [:MEMBER_OF]}</li>
 *   <li>{@code (:MergeVersion {id: 'current', version})} names the visible merged set</li>
 *   <li>{@code (:SourceMetadata {sourceName})} per-source license and version info</li>
 * </ul>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private static final String SOURCE_CONCEPT_COLUMNS = """
            c.conceptId as conceptId, c.sourceName as sourceName, c.label as label,
            c.aliases as aliases, c.xrefs as xrefs, c.associatedWith as associatedWith,
            c.pediatricDisease as pediatricDisease, c.oncologicDisease as oncologicDisease,
            m.conceptId as mergeRef
            """;

    private static final String MERGED_CONCEPT_COLUMNS = """
            m.conceptId as conceptId, m.label as label, m.aliases as aliases, m.xrefs as xrefs,
            m.associatedWith as associatedWith, m.pediatricDisease as pediatricDisease,
            m.oncologicDisease as oncologicDisease, m.members as members
            """;

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Schema ==========

    /**
     * Creates indexes and the merge version pointer if they don't exist yet.
     */
    public void initializeSchema() {
        connection.createIndexes();
        connection.execute("""
                MERGE (v:MergeVersion {id: 'current'})
                ON CREATE SET v.version = 0
                """);
    }

    public boolean mergeVersionExists() {
        return !connection.query("MATCH (v:MergeVersion {id: 'current'}) RETURN v.version as version").isEmpty();
    }

    // ========== Source concepts ==========

    /**
     * Creates or overwrites a source concept node. List-valued properties are
     * expected as JSON array strings.
     *
     * @return source name of the node that was overwritten, if there was one
     */
    public Optional<String> upsertSourceConcept(Map<String, Object> properties) {
        String query = """
                OPTIONAL MATCH (old:SourceConcept {conceptIdLower: $conceptIdLower})
                WITH old.sourceName AS previousSourceName
                MERGE (c:SourceConcept {conceptIdLower: $conceptIdLower})
                SET c.conceptId = $conceptId,
                    c.sourceName = $sourceName,
                    c.label = $label,
                    c.aliases = $aliases,
                    c.xrefs = $xrefs,
                    c.associatedWith = $associatedWith,
                    c.pediatricDisease = $pediatricDisease,
                    c.oncologicDisease = $oncologicDisease
                RETURN previousSourceName
                """;
        List<Map<String, Object>> rows = connection.query(query, properties);
        if (rows.isEmpty() || rows.get(0).get("previousSourceName") == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0).get("previousSourceName").toString());
    }

    public void deleteTerms(String conceptIdLower) {
        String query = """
                MATCH (t:Term)-[:TERM_OF]->(c:SourceConcept {conceptIdLower: $conceptIdLower})
                DETACH DELETE t
                """;
        connection.execute(query, Map.of("conceptIdLower", conceptIdLower));
    }

    /**
     * Attaches one Term node per lower-cased value to a source concept.
     */
    public void createTerms(String conceptIdLower, String field, List<String> valuesLower) {
        if (valuesLower.isEmpty()) {
            return;
        }
        String query = """
                MATCH (c:SourceConcept {conceptIdLower: $conceptIdLower})
                UNWIND $valuesLower AS termValue
                CREATE (t:Term {field: $field, valueLower: termValue})-[:TERM_OF]->(c)
                """;
        connection.execute(query, Map.of(
                "conceptIdLower", conceptIdLower,
                "field", field,
                "valuesLower", valuesLower
        ));
    }

    public List<Map<String, Object>> findConceptIdsByTerm(String field, String valueLower) {
        String query = """
                MATCH (t:Term {valueLower: $valueLower})-[:TERM_OF]->(c:SourceConcept)
                WHERE t.field = $field
                RETURN DISTINCT c.conceptId as conceptId
                """;
        return connection.query(query, Map.of("field", field, "valueLower", valueLower));
    }

    public List<Map<String, Object>> findConceptIdsByConceptId(String conceptIdLower) {
        String query = """
                MATCH (c:SourceConcept {conceptIdLower: $conceptIdLower})
                RETURN c.conceptId as conceptId
                """;
        return connection.query(query, Map.of("conceptIdLower", conceptIdLower));
    }

    /**
     * Finds one source concept together with the merge_ref of its group in the
     * visible merged set, if any.
     */
    public List<Map<String, Object>> findSourceConcept(String conceptIdLower) {
        String query = """
                MATCH (c:SourceConcept {conceptIdLower: $conceptIdLower})
                OPTIONAL MATCH (v:MergeVersion {id: 'current'})
                OPTIONAL MATCH (c)-[:MEMBER_OF]->(m:MergedConcept)
                WHERE m.version = v.version
                RETURN %s
                """.formatted(SOURCE_CONCEPT_COLUMNS);
        return connection.query(query, Map.of("conceptIdLower", conceptIdLower));
    }

    public List<Map<String, Object>> findAllSourceConcepts() {
        String query = """
                MATCH (c:SourceConcept)
                OPTIONAL MATCH (v:MergeVersion {id: 'current'})
                OPTIONAL MATCH (c)-[:MEMBER_OF]->(m:MergedConcept)
                WHERE m.version = v.version
                RETURN %s
                """.formatted(SOURCE_CONCEPT_COLUMNS);
        return connection.query(query);
    }

    public long countSourceConcepts(String sourceName) {
        String query = """
                MATCH (c:SourceConcept {sourceName: $sourceName})
                RETURN count(c) as total
                """;
        return firstLong(connection.query(query, Map.of("sourceName", sourceName)), "total");
    }

    public long countAllSourceConcepts() {
        return firstLong(connection.query("MATCH (c:SourceConcept) RETURN count(c) as total"), "total");
    }

    /**
     * Deletes a source's concept nodes with their terms and merge memberships.
     */
    public void deleteSourceConcepts(String sourceName) {
        String deleteTerms = """
                MATCH (t:Term)-[:TERM_OF]->(c:SourceConcept {sourceName: $sourceName})
                DETACH DELETE t
                """;
        String deleteConcepts = """
                MATCH (c:SourceConcept {sourceName: $sourceName})
                DETACH DELETE c
                """;
        connection.execute(deleteTerms, Map.of("sourceName", sourceName));
        connection.execute(deleteConcepts, Map.of("sourceName", sourceName));
        log.debug("graph.source.deleted sourceName={}", sourceName);
    }

    // ========== Merged concepts ==========

    public long currentMergeVersion() {
        return firstLong(connection.query(
                "MATCH (v:MergeVersion {id: 'current'}) RETURN v.version as version"), "version");
    }

    /**
     * Creates a merged concept node under the given version and links its members to it.
     */
    public void createMergedConcept(Map<String, Object> properties, List<String> membersLower, long version) {
        Map<String, Object> params = new HashMap<>(properties);
        params.put("version", version);
        params.put("membersLower", membersLower);
        String query = """
                CREATE (m:MergedConcept {
                    conceptId: $conceptId,
                    conceptIdLower: $conceptIdLower,
                    version: $version,
                    label: $label,
                    aliases: $aliases,
                    xrefs: $xrefs,
                    associatedWith: $associatedWith,
                    pediatricDisease: $pediatricDisease,
                    oncologicDisease: $oncologicDisease,
                    members: $members
                })
                WITH m
                UNWIND $membersLower AS memberId
                MATCH (c:SourceConcept {conceptIdLower: memberId})
                CREATE (c)-[:MEMBER_OF]->(m)
                """;
        connection.execute(query, params);
    }

    /**
     * Makes the merged concepts of the given version the visible set.
     */
    public void setMergeVersion(long version) {
        connection.execute("""
                MERGE (v:MergeVersion {id: 'current'})
                SET v.version = $version
                """, Map.of("version", version));
    }

    public void deleteMergedConceptsOfVersion(long version) {
        connection.execute("""
                MATCH (m:MergedConcept {version: $version})
                DETACH DELETE m
                """, Map.of("version", version));
    }

    /**
     * Deletes every merged concept not belonging to the given version.
     */
    public void deleteMergedConceptsExceptVersion(long version) {
        connection.execute("""
                MATCH (m:MergedConcept)
                WHERE m.version <> $version
                DETACH DELETE m
                """, Map.of("version", version));
    }

    public List<Map<String, Object>> findMergedConcept(String conceptIdLower) {
        String query = """
                MATCH (v:MergeVersion {id: 'current'})
                MATCH (m:MergedConcept {conceptIdLower: $conceptIdLower})
                WHERE m.version = v.version
                RETURN %s
                """.formatted(MERGED_CONCEPT_COLUMNS);
        return connection.query(query, Map.of("conceptIdLower", conceptIdLower));
    }

    /**
     * Finds the visible merged concept a source concept is a member of. Membership
     * and merged node come from one query, so both belong to the same version.
     */
    public List<Map<String, Object>> findMergedConceptOfMember(String conceptIdLower) {
        String query = """
                MATCH (v:MergeVersion {id: 'current'})
                MATCH (c:SourceConcept {conceptIdLower: $conceptIdLower})-[:MEMBER_OF]->(m:MergedConcept)
                WHERE m.version = v.version
                RETURN %s
                """.formatted(MERGED_CONCEPT_COLUMNS);
        return connection.query(query, Map.of("conceptIdLower", conceptIdLower));
    }

    public List<Map<String, Object>> findAllMergedConcepts() {
        String query = """
                MATCH (v:MergeVersion {id: 'current'})
                MATCH (m:MergedConcept)
                WHERE m.version = v.version
                RETURN %s
                ORDER BY m.conceptIdLower
                """.formatted(MERGED_CONCEPT_COLUMNS);
        return connection.query(query);
    }

    public long countCurrentMergedConcepts() {
        String query = """
                MATCH (v:MergeVersion {id: 'current'})
                MATCH (m:MergedConcept)
                WHERE m.version = v.version
                RETURN count(m) as total
                """;
        return firstLong(connection.query(query), "total");
    }

    // ========== Source metadata ==========

    public void upsertSourceMetadata(Map<String, Object> properties) {
        String query = """
                MERGE (s:SourceMetadata {sourceName: $sourceName})
                SET s.dataLicense = $dataLicense,
                    s.dataLicenseUrl = $dataLicenseUrl,
                    s.version = $version,
                    s.dataUrl = $dataUrl,
                    s.rdpUrl = $rdpUrl,
                    s.nonCommercial = $nonCommercial,
                    s.shareAlike = $shareAlike,
                    s.attribution = $attribution
                """;
        connection.execute(query, properties);
    }

    public List<Map<String, Object>> findSourceMetadata(String sourceName) {
        String query = """
                MATCH (s:SourceMetadata {sourceName: $sourceName})
                RETURN s.sourceName as sourceName, s.dataLicense as dataLicense,
                       s.dataLicenseUrl as dataLicenseUrl, s.version as version, s.dataUrl as dataUrl,
                       s.rdpUrl as rdpUrl, s.nonCommercial as nonCommercial,
                       s.shareAlike as shareAlike, s.attribution as attribution
                """;
        return connection.query(query, Map.of("sourceName", sourceName));
    }

    public List<Map<String, Object>> findAllSourceMetadata() {
        String query = """
                MATCH (s:SourceMetadata)
                RETURN s.sourceName as sourceName, s.dataLicense as dataLicense,
                       s.dataLicenseUrl as dataLicenseUrl, s.version as version, s.dataUrl as dataUrl,
                       s.rdpUrl as rdpUrl, s.nonCommercial as nonCommercial,
                       s.shareAlike as shareAlike, s.attribution as attribution
                """;
        return connection.query(query);
    }

    public void deleteSourceMetadata(String sourceName) {
        connection.execute("""
                MATCH (s:SourceMetadata {sourceName: $sourceName})
                DELETE s
                """, Map.of("sourceName", sourceName));
    }

    private static long firstLong(List<Map<String, Object>> rows, String column) {
        if (rows.isEmpty()) {
            return 0L;
        }
        Object value = rows.get(0).get(column);
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
