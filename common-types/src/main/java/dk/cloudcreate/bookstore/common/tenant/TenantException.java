package dk.cloudcreate.bookstore.common.tenant;

/**
 * Base class for tenant resolution failures. These are always hard errors, there is no default tenant
 */
public class TenantException extends RuntimeException {
    public TenantException(String message) {
        super(message);
    }
}
