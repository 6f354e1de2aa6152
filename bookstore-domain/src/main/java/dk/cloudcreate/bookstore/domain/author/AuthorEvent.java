package dk.cloudcreate.bookstore.domain.author;

/**
 * The events of an author stream. The stream id is the author id
 */
public abstract class AuthorEvent {
    private String authorId;

    protected AuthorEvent() {
    }

    protected AuthorEvent(String authorId) {
        this.authorId = authorId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visit(AuthorAdded event);

        R visit(AuthorUpdated event);

        R visit(AuthorSoftDeleted event);

        R visit(AuthorRestored event);
    }

    public static class AuthorAdded extends AuthorEvent {
        private String name;
        private String biography;

        public AuthorAdded() {
        }

        public AuthorAdded(String authorId, String name, String biography) {
            super(authorId);
            this.name = name;
            this.biography = biography;
        }

        public String getName() {
            return name;
        }

        public String getBiography() {
            return biography;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class AuthorUpdated extends AuthorEvent {
        private String name;
        private String biography;

        public AuthorUpdated() {
        }

        public AuthorUpdated(String authorId, String name, String biography) {
            super(authorId);
            this.name = name;
            this.biography = biography;
        }

        public String getName() {
            return name;
        }

        public String getBiography() {
            return biography;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class AuthorSoftDeleted extends AuthorEvent {
        public AuthorSoftDeleted() {
        }

        public AuthorSoftDeleted(String authorId) {
            super(authorId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class AuthorRestored extends AuthorEvent {
        public AuthorRestored() {
        }

        public AuthorRestored(String authorId) {
            super(authorId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
