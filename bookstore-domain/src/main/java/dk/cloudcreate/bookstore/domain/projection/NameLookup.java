package dk.cloudcreate.bookstore.domain.projection;

/**
 * Internal bookkeeping of {@link BookSearchProjection}: the current name of an author or publisher
 */
public class NameLookup {
    private String id;
    private String name;

    NameLookup() {
    }

    public NameLookup(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
