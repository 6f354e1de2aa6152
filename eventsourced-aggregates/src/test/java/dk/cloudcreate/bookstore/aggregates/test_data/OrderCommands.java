package dk.cloudcreate.bookstore.aggregates.test_data;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.time.OffsetDateTime;
import java.util.List;

public final class OrderCommands {
    public static final List<Class<? extends Command>> ALL = List.of(PlaceOrder.class, AddProduct.class, AcceptOrder.class);

    private OrderCommands() {
    }

    public static class PlaceOrder implements Command {
        private String         orderId;
        private String         customerId;
        private OffsetDateTime acceptBefore;

        public PlaceOrder() {
        }

        public PlaceOrder(String orderId, String customerId, OffsetDateTime acceptBefore) {
            this.orderId = orderId;
            this.customerId = customerId;
            this.acceptBefore = acceptBefore;
        }

        public String getCustomerId() {
            return customerId;
        }

        public OffsetDateTime getAcceptBefore() {
            return acceptBefore;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(orderId);
        }
    }

    public static class AddProduct implements Command {
        private String orderId;
        private String productId;
        private int    quantity;

        public AddProduct() {
        }

        public AddProduct(String orderId, String productId, int quantity) {
            this.orderId = orderId;
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
        public StreamId streamId() {
            return StreamId.of(orderId);
        }
    }

    public static class AcceptOrder implements Command {
        private String orderId;

        public AcceptOrder() {
        }

        public AcceptOrder(String orderId) {
            this.orderId = orderId;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(orderId);
        }
    }
}
