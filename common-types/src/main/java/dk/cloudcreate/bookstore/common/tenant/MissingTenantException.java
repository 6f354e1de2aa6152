package dk.cloudcreate.bookstore.common.tenant;

public class MissingTenantException extends TenantException {
    public MissingTenantException(String message) {
        super(message);
    }
}
