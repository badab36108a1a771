package info.mouts.orderprocessing.exception;

public class OrderNotFoundException extends RuntimeException {
    public OrderNotFoundException(String orderId) {
        super("Order not found for ID: " + orderId);
    }
}
