package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.types.CharSequenceType;

public class ProjectionName extends CharSequenceType<ProjectionName> {
    public ProjectionName(CharSequence value) {
        super(value);
    }

    public static ProjectionName of(CharSequence value) {
        return new ProjectionName(value);
    }
}
