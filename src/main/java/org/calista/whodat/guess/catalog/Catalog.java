package org.calista.whodat.guess.catalog;

import java.util.*;

/**
 * Immutable, process-wide set of entities and questions.
 *
 * <p>
 * Built once through {@link #load(Collection, Collection)}, never mutated afterwards,
 * so any number of concurrent games may read it without locking.
 * Iteration order is deterministic: entities and questions are sorted by id.
 * </p>
 */
public final class Catalog {

    private final List<Entity> entities;
    private final List<Question> questions;
    private final Map<String, Entity> entitiesById;
    private final Map<String, Question> questionsById;
    private final Map<String, List<Question>> questionsByAttribute;

    private Catalog(List<Entity> entities, List<Question> questions) {
        this.entities = List.copyOf(entities);
        this.questions = List.copyOf(questions);

        LinkedHashMap<String, Entity> eById = new LinkedHashMap<>(entities.size() * 2);
        for (Entity e : entities) eById.put(e.id, e);
        this.entitiesById = Collections.unmodifiableMap(eById);

        LinkedHashMap<String, Question> qById = new LinkedHashMap<>(questions.size() * 2);
        TreeMap<String, List<Question>> byAttr = new TreeMap<>();
        for (Question q : questions) {
            qById.put(q.id, q);
            byAttr.computeIfAbsent(q.attributeKey, k -> new ArrayList<>(2)).add(q);
        }
        byAttr.replaceAll((k, v) -> List.copyOf(v));
        this.questionsById = Collections.unmodifiableMap(qById);
        this.questionsByAttribute = Collections.unmodifiableMap(byAttr);
    }

    /**
     * Validates and freezes the two datasets.
     *
     * @throws DatasetException on blank/duplicate ids, weights outside [0..1], empty entity set,
     *                          or a question whose attribute key no entity carries
     */
    public static Catalog load(Collection<Entity> entityData, Collection<Question> questionData) throws DatasetException {
        if (entityData == null || entityData.isEmpty()) throw new DatasetException("Catalog has no entities");
        if (questionData == null) questionData = List.of();

        ArrayList<Entity> es = new ArrayList<>(entityData.size());
        HashSet<String> entityIds = new HashSet<>(entityData.size() * 2);
        HashSet<String> knownAttributes = new HashSet<>();

        for (Entity e : entityData) {
            if (e == null) throw new DatasetException("Null entity record");
            if (e.id == null || e.id.isBlank()) throw new DatasetException("Entity without id: " + e);
            if (!entityIds.add(e.id)) throw new DatasetException("Duplicate entity id: " + e.id);

            for (Map.Entry<String, Double> a : e.attributes.entrySet()) {
                if (a.getKey() == null || a.getKey().isBlank()) {
                    throw new DatasetException("Entity " + e.id + " has a blank attribute key");
                }
                Double w = a.getValue();
                if (w == null || !Double.isFinite(w) || w < 0.0 || w > 1.0) {
                    throw new DatasetException("Entity " + e.id + " attribute '" + a.getKey() + "' weight out of [0,1]: " + w);
                }
                knownAttributes.add(a.getKey());
            }
            es.add(e);
        }

        ArrayList<Question> qs = new ArrayList<>(questionData.size());
        HashSet<String> questionIds = new HashSet<>(questionData.size() * 2);

        for (Question q : questionData) {
            if (q == null) throw new DatasetException("Null question record");
            if (q.id == null || q.id.isBlank()) throw new DatasetException("Question without id: " + q);
            if (!questionIds.add(q.id)) throw new DatasetException("Duplicate question id: " + q.id);
            if (q.attributeKey == null || q.attributeKey.isBlank()) {
                throw new DatasetException("Question " + q.id + " has no attribute key");
            }
            if (!knownAttributes.contains(q.attributeKey)) {
                throw new DatasetException("Question " + q.id + " asks about unknown attribute '" + q.attributeKey + "'");
            }
            qs.add(q);
        }

        es.sort(Comparator.comparing(x -> x.id));
        qs.sort(Comparator.comparing(x -> x.id));
        return new Catalog(es, qs);
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    /** Sorted by id. */
    public List<Entity> entities() {
        return entities;
    }

    /** Sorted by id. */
    public List<Question> questions() {
        return questions;
    }

    public Optional<Entity> entity(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(entitiesById.get(id));
    }

    public Optional<Question> question(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(questionsById.get(id));
    }

    public boolean hasEntity(String id) {
        return id != null && entitiesById.containsKey(id);
    }

    public boolean hasQuestion(String id) {
        return id != null && questionsById.containsKey(id);
    }

    /** Questions probing the attribute, sorted by id; empty when none. */
    public List<Question> questionsFor(String attributeKey) {
        if (attributeKey == null) return List.of();
        return questionsByAttribute.getOrDefault(attributeKey, List.of());
    }

    public int entityCount() {
        return entities.size();
    }

    public int questionCount() {
        return questions.size();
    }

    @Override
    public String toString() {
        return "Catalog{entities=" + entities.size() + ", questions=" + questions.size()
                + ", attributes=" + questionsByAttribute.size() + '}';
    }
}
