package dk.cloudcreate.bookstore.projection;

/**
 * Implemented by read model documents that stay in the store when their entity is soft deleted.
 * A change that marks a document deleted is announced as a deletion
 */
public interface SoftDeletable {
    boolean isDeleted();
}
