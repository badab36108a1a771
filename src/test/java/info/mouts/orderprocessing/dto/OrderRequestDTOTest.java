package info.mouts.orderprocessing.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

public class OrderRequestDTOTest {

    private static Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private static OrderItemRequestDTO item(String productId, Integer quantity, String price) {
        return new OrderItemRequestDTO(productId, quantity, price == null ? null : new BigDecimal(price));
    }

    private static List<String> messages(OrderRequestDTO request) {
        Set<ConstraintViolation<OrderRequestDTO>> violations = validator.validate(request);
        return violations.stream().map(ConstraintViolation::getMessage).toList();
    }

    @Test
    @DisplayName("A complete order is valid, including a free item")
    void validOrder() {
        OrderRequestDTO request = new OrderRequestDTO("CUST-1",
                List.of(item("PROD-1", 2, "10.00"), item("PROD-2", 1, "0")));

        assertThat(messages(request)).isEmpty();
    }

    @Test
    @DisplayName("A missing customer is reported before item problems")
    void missingCustomerReportedFirst() {
        OrderRequestDTO request = new OrderRequestDTO(" ", List.of());

        assertThat(messages(request)).containsExactly("customer_id is required");
    }

    @Test
    @DisplayName("An empty item list is rejected")
    void emptyItems() {
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of())))
                .containsExactly("items must be a non-empty array");
        assertThat(messages(new OrderRequestDTO("CUST-1", null)))
                .containsExactly("items must be a non-empty array");
    }

    @Test
    @DisplayName("Items need a product, a positive quantity and a non-negative price")
    void invalidItems() {
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("", 1, "1.00")))))
                .containsExactly("Each item must have a product_id");
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("PROD-1", 0, "1.00")))))
                .containsExactly("Each item must have a quantity greater than 0");
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("PROD-1", 1, "-0.01")))))
                .containsExactly("Each item must have a price of at least 0");
    }

    @Test
    @DisplayName("A null entry in the item list is rejected")
    void nullItem() {
        assertThat(messages(new OrderRequestDTO("CUST-1", Arrays.asList((OrderItemRequestDTO) null))))
                .containsExactly("Each item must be an object");
        assertThat(messages(new OrderRequestDTO("CUST-1", Arrays.asList(item("PROD-1", 1, "1.00"), null))))
                .containsExactly("Each item must be an object");
    }

    @Test
    @DisplayName("A total that does not fit the stored amount column is rejected")
    void totalTooLarge() {
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("PROD-1", 1000, "1000000")))))
                .containsExactly("total_amount must not exceed 99999999.99");
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("PROD-1", 1, "99999999.995")))))
                .containsExactly("total_amount must not exceed 99999999.99");
        assertThat(messages(new OrderRequestDTO("CUST-1", List.of(item("PROD-1", 1, "99999999.99")))))
                .isEmpty();
    }
}
