package dk.cloudcreate.bookstore.projection.test_data;

import dk.cloudcreate.bookstore.projection.SoftDeletable;

public class ProductView implements SoftDeletable {
    private String  productId;
    private String  name;
    private String  category;
    private boolean deleted;

    public ProductView() {
    }

    public ProductView(String productId, String name, String category, boolean deleted) {
        this.productId = productId;
        this.name = name;
        this.category = category;
        this.deleted = deleted;
    }

    public String getProductId() {
        return productId;
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public ProductView withName(String name) {
        return new ProductView(productId, name, category, deleted);
    }

    public ProductView asDeleted() {
        return new ProductView(productId, name, category, true);
    }
}
