package dk.cloudcreate.bookstore.eventstore.test_data;

import java.math.BigDecimal;

public final class OrderEvents {
    private OrderEvents() {
    }

    public static class OrderPlaced {
        private String orderId;
        private String customerId;

        public OrderPlaced() {
        }

        public OrderPlaced(String orderId, String customerId) {
            this.orderId = orderId;
            this.customerId = customerId;
        }

        public String getOrderId() {
            return orderId;
        }

        public String getCustomerId() {
            return customerId;
        }
    }

    public static class ProductAdded {
        private String     orderId;
        private String     productId;
        private int        quantity;
        private BigDecimal unitPrice;

        public ProductAdded() {
        }

        public ProductAdded(String orderId, String productId, int quantity, BigDecimal unitPrice) {
            this.orderId = orderId;
            this.productId = productId;
            this.quantity = quantity;
            this.unitPrice = unitPrice;
        }

        public String getOrderId() {
            return orderId;
        }

        public String getProductId() {
            return productId;
        }

        public int getQuantity() {
            return quantity;
        }

        public BigDecimal getUnitPrice() {
            return unitPrice;
        }
    }

    public static class OrderShipped {
        private String orderId;

        public OrderShipped() {
        }

        public OrderShipped(String orderId) {
            this.orderId = orderId;
        }

        public String getOrderId() {
            return orderId;
        }
    }

    public static dk.cloudcreate.bookstore.eventstore.EventTypeRegistry registry() {
        return new dk.cloudcreate.bookstore.eventstore.EventTypeRegistry().register(OrderPlaced.class)
                                                                          .register(ProductAdded.class)
                                                                          .register(OrderShipped.class);
    }
}
