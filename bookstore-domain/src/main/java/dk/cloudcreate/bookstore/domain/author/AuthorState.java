package dk.cloudcreate.bookstore.domain.author;

import dk.cloudcreate.bookstore.domain.author.AuthorEvent.*;

import java.util.Objects;

public final class AuthorState {
    public final String  authorId;
    public final String  name;
    public final String  biography;
    public final boolean deleted;

    private AuthorState(String authorId, String name, String biography, boolean deleted) {
        this.authorId = authorId;
        this.name = name;
        this.biography = biography;
        this.deleted = deleted;
    }

    public static AuthorState initial(String authorId) {
        return new AuthorState(authorId, null, null, false);
    }

    public AuthorState apply(AuthorEvent event) {
        return event.accept(new AuthorEvent.Visitor<>() {
            @Override
            public AuthorState visit(AuthorAdded e) {
                return new AuthorState(authorId, e.getName(), e.getBiography(), false);
            }

            @Override
            public AuthorState visit(AuthorUpdated e) {
                return new AuthorState(authorId, e.getName(), e.getBiography(), deleted);
            }

            @Override
            public AuthorState visit(AuthorSoftDeleted e) {
                return new AuthorState(authorId, name, biography, true);
            }

            @Override
            public AuthorState visit(AuthorRestored e) {
                return new AuthorState(authorId, name, biography, false);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthorState)) return false;
        var that = (AuthorState) o;
        return deleted == that.deleted && authorId.equals(that.authorId) && Objects.equals(name, that.name) && Objects.equals(biography, that.biography);
    }

    @Override
    public int hashCode() {
        return Objects.hash(authorId, name, biography, deleted);
    }

    @Override
    public String toString() {
        return "AuthorState{" + authorId + ", name='" + name + "', deleted=" + deleted + '}';
    }
}
