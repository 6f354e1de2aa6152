package dk.cloudcreate.bookstore.common.functional;

/**
 * {@link java.util.function.Function} variant that is allowed to throw checked exceptions
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {
    R apply(T argument) throws Exception;
}
