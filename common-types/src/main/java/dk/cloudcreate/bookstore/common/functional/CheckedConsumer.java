package dk.cloudcreate.bookstore.common.functional;

/**
 * {@link java.util.function.Consumer} variant that is allowed to throw checked exceptions
 */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T argument) throws Exception;
}
