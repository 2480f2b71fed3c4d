package work.lcod.pipeline.store;

import work.lcod.pipeline.model.ResourceCollection;

/**
 * Source and sink of the resource tree a pipeline runs over.
 */
public interface ResourceStore {
    /**
     * Loads every resource, tagging each with its provenance.
     *
     * @throws PersistenceException when the tree cannot be read or a document cannot be parsed
     */
    ResourceCollection load();

    /**
     * Writes {@code collection} back, leaving untouched whatever did not change.
     *
     * @throws PersistenceException when the tree cannot be written
     */
    void persist(ResourceCollection collection);
}
