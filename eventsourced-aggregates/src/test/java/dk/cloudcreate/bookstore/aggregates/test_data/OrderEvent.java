package dk.cloudcreate.bookstore.aggregates.test_data;

public abstract class OrderEvent {
    private String orderId;

    protected OrderEvent() {
    }

    protected OrderEvent(String orderId) {
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }

    public abstract <R> R accept(OrderEventVisitor<R> visitor);

    public static class OrderPlaced extends OrderEvent {
        private String customerId;

        public OrderPlaced() {
        }

        public OrderPlaced(String orderId, String customerId) {
            super(orderId);
            this.customerId = customerId;
        }

        public String getCustomerId() {
            return customerId;
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class ProductAdded extends OrderEvent {
        private String productId;
        private int    quantity;

        public ProductAdded() {
        }

        public ProductAdded(String orderId, String productId, int quantity) {
            super(orderId);
            this.productId = productId;
            this.quantity = quantity;
        }

        public String getProductId() {
            return productId;
        }

        public int getQuantity() {
            return quantity;
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class OrderAccepted extends OrderEvent {
        public OrderAccepted() {
        }

        public OrderAccepted(String orderId) {
            super(orderId);
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
