package dk.cloudcreate.bookstore.domain.author;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.util.List;

public final class AuthorCommands {
    public static final List<Class<? extends Command>> ALL = List.of(AddAuthor.class,
                                                                     UpdateAuthor.class,
                                                                     SoftDeleteAuthor.class,
                                                                     RestoreAuthor.class);

    private AuthorCommands() {
    }

    public abstract static class AuthorCommand implements Command {
        private String authorId;

        protected AuthorCommand() {
        }

        protected AuthorCommand(String authorId) {
            this.authorId = authorId;
        }

        public String getAuthorId() {
            return authorId;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(authorId);
        }
    }

    public static class AddAuthor extends AuthorCommand {
        private String name;
        private String biography;

        AddAuthor() {
        }

        public AddAuthor(String authorId, String name, String biography) {
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
    }

    public static class UpdateAuthor extends AuthorCommand {
        private String name;
        private String biography;

        UpdateAuthor() {
        }

        public UpdateAuthor(String authorId, String name, String biography) {
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
    }

    public static class SoftDeleteAuthor extends AuthorCommand {
        SoftDeleteAuthor() {
        }

        public SoftDeleteAuthor(String authorId) {
            super(authorId);
        }
    }

    public static class RestoreAuthor extends AuthorCommand {
        RestoreAuthor() {
        }

        public RestoreAuthor(String authorId) {
            super(authorId);
        }
    }
}
