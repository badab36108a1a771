package info.mouts.orderprocessing.controller;

import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.dto.OrderAcceptedResponseDTO;
import info.mouts.orderprocessing.dto.OrderDetailResponseDTO;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderPageResponseDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;
import info.mouts.orderprocessing.mapper.OrderMapper;
import info.mouts.orderprocessing.service.OrderIngestionService;
import info.mouts.orderprocessing.service.OrderQueryService;
import info.mouts.orderprocessing.util.OrderUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for submitting orders and retrieving stored orders.
 * Submission only queues the order; it is stored asynchronously by the queue
 * worker.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders API", description = "Endpoints for submitting and retrieving orders")
@Slf4j
public class OrderController {
    private final OrderIngestionService orderIngestionService;
    private final OrderQueryService orderQueryService;
    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param orderIngestionService Service queueing submitted orders.
     * @param orderQueryService     Service reading stored orders.
     * @param orderMapper           Mapper for converting entities to DTOs.
     */
    public OrderController(OrderIngestionService orderIngestionService, OrderQueryService orderQueryService,
            OrderMapper orderMapper) {
        this.orderIngestionService = orderIngestionService;
        this.orderQueryService = orderQueryService;
        this.orderMapper = orderMapper;
    }

    /**
     * Validates an order and queues it for processing.
     *
     * @param request The order to submit.
     * @return HTTP 202 with the assigned order identifier and total.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Submit an Order", description = "Validates an order and queues it for asynchronous processing.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Order accepted and queued", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrderAcceptedResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid order", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Order could not be queued", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderAcceptedResponseDTO> submitOrder(@Validated @RequestBody OrderRequestDTO request) {
        OrderMessageDTO message = orderIngestionService.submitOrder(request);

        OrderAcceptedResponseDTO response = OrderAcceptedResponseDTO.builder()
                .message(OrderUtils.ACCEPTED_MESSAGE)
                .orderId(message.getOrderId())
                .status(OrderUtils.ACCEPTED_STATUS)
                .totalAmount(message.getTotalAmount())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * Retrieves a page of stored orders, newest first.
     *
     * @param page  1-based page number.
     * @param limit Page size, at most 100.
     * @return The page and the total number of stored orders.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List Orders", description = "Retrieves stored orders, newest first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrderPageResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid page or limit", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderPageResponseDTO> findOrders(
            @Parameter(description = "1-based page number") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Page size, 1 to 100") @RequestParam(defaultValue = "50") int limit) {
        Page<Order> orders = orderQueryService.findPage(page, limit);

        OrderPageResponseDTO response = OrderPageResponseDTO.builder()
                .orders(orderMapper.toOrderResponseDtoList(orders.getContent()))
                .total(orders.getTotalElements())
                .page(page)
                .limit(limit)
                .build();

        return ResponseEntity.ok(response);
    }

    /**
     * Retrieves a stored order by its identifier.
     *
     * @param orderId The order identifier.
     * @return The order wrapped in a {@code data} field.
     */
    @GetMapping(value = "/{orderId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an Order by ID", description = "Retrieves a stored order by its identifier.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrderDetailResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderDetailResponseDTO> findByOrderId(@PathVariable String orderId) {
        Order order = orderQueryService.findByOrderId(orderId);

        return ResponseEntity.ok(new OrderDetailResponseDTO(orderMapper.toOrderResponseDto(order)));
    }
}
