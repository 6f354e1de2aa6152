package dk.cloudcreate.bookstore.aggregates.test_data;

import java.util.*;

public final class OrderState {
    public final String               orderId;
    public final String               customerId;
    public final Map<String, Integer> productAndQuantity;
    public final boolean              accepted;

    private OrderState(String orderId, String customerId, Map<String, Integer> productAndQuantity, boolean accepted) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.productAndQuantity = Map.copyOf(productAndQuantity);
        this.accepted = accepted;
    }

    public static OrderState initial(String orderId) {
        return new OrderState(orderId, null, Map.of(), false);
    }

    public OrderState apply(OrderEvent event) {
        return event.accept(new OrderEventVisitor<>() {
            @Override
            public OrderState visit(OrderEvent.OrderPlaced e) {
                return new OrderState(orderId, e.getCustomerId(), Map.of(), false);
            }

            @Override
            public OrderState visit(OrderEvent.ProductAdded e) {
                var products = new HashMap<>(productAndQuantity);
                products.merge(e.getProductId(), e.getQuantity(), Integer::sum);
                return new OrderState(orderId, customerId, products, accepted);
            }

            @Override
            public OrderState visit(OrderEvent.OrderAccepted e) {
                return new OrderState(orderId, customerId, productAndQuantity, true);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderState)) return false;
        var that = (OrderState) o;
        return accepted == that.accepted &&
                Objects.equals(orderId, that.orderId) &&
                Objects.equals(customerId, that.customerId) &&
                productAndQuantity.equals(that.productAndQuantity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, customerId, productAndQuantity, accepted);
    }

    @Override
    public String toString() {
        return "OrderState{" + orderId + ", customer=" + customerId + ", products=" + productAndQuantity + ", accepted=" + accepted + "}";
    }
}
