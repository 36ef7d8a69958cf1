package com.flagship.pos_inventory.sale;

import com.flagship.pos_inventory.TestFixtures;
import com.flagship.pos_inventory.inventory.InventoryLedgerService;
import com.flagship.pos_inventory.observability.PostingMetrics;
import com.flagship.pos_inventory.posting.LineItem;
import com.flagship.pos_inventory.posting.PostingError;
import com.flagship.pos_inventory.posting.PostingErrorCode;
import com.flagship.pos_inventory.posting.PostingResult;
import com.flagship.pos_inventory.posting.UnitOfWork;
import com.flagship.pos_inventory.reference.ReferenceValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sale posting against a real database: validation order, totals, and the
 * all-or-nothing guarantee when stock runs out.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SalePostingServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_pos")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private SalePostingService salePostingService;

    @Autowired
    private ReferenceValidator referenceValidator;

    @Autowired
    private InventoryLedgerService ledgerService;

    @Autowired
    private SaleRepository saleRepository;

    @Autowired
    private UnitOfWork unitOfWork;

    @Autowired
    private PostingMetrics postingMetrics;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String customerId;
    private String employeeId;
    private String productA;
    private String productB;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        customerId = TestFixtures.customer(jdbcTemplate);
        employeeId = TestFixtures.employee(jdbcTemplate);
        productA = TestFixtures.product(jdbcTemplate, 10);
        productB = TestFixtures.product(jdbcTemplate, 5);
    }

    private List<LineItem> hundredCart() {
        return List.of(
            LineItem.of(productA, 2, new BigDecimal("30.00")),
            LineItem.of(productB, 1, new BigDecimal("40.00"))
        );
    }

    private void assertNothingWritten() {
        assertEquals(0, TestFixtures.countSalesOfCustomer(jdbcTemplate, customerId));
        assertEquals(0, TestFixtures.countSaleLinesOfProduct(jdbcTemplate, productA));
        assertEquals(0, TestFixtures.countSaleLinesOfProduct(jdbcTemplate, productB));
        assertEquals(10, TestFixtures.stockOf(jdbcTemplate, productA));
        assertEquals(5, TestFixtures.stockOf(jdbcTemplate, productB));
    }

    @Test
    @DisplayName("Valid sale deducts stock and stores header and lines")
    void testCreateSale() {
        printTestHeader("Create Sale");
        printInput("Cart", hundredCart());

        PostingResult<String> result = salePostingService.createSale(customerId, employeeId,
            new BigDecimal("30.00"), hundredCart());

        printOutput("Result", result);
        assertTrue(result.isSuccess());
        assertTrue(result.getValue().startsWith("INV"));
        assertEquals(8, TestFixtures.stockOf(jdbcTemplate, productA));
        assertEquals(4, TestFixtures.stockOf(jdbcTemplate, productB));
        assertEquals(1, TestFixtures.countSalesOfCustomer(jdbcTemplate, customerId));
        printSuccess("Sale posted");
    }

    @Test
    @DisplayName("Created sale reads back with identical totals and lines")
    void testRoundTrip() {
        printTestHeader("Sale Round Trip");
        String invoiceNo = salePostingService.createSale(customerId, employeeId,
            new BigDecimal("30.00"), hundredCart()).orElseThrow();

        SaleOrder sale = salePostingService.findSale(invoiceNo).orElseThrow();

        printOutput("Sale", sale);
        assertEquals(invoiceNo, sale.getInvoiceNo());
        assertEquals(customerId, sale.getCustomerId());
        assertEquals(employeeId, sale.getEmployeeId());
        assertEquals(LocalDate.now(), sale.getSaleDate());
        assertEquals(new BigDecimal("100.00"), sale.getTotalAmount());
        assertEquals(new BigDecimal("30.00"), sale.getDiscount());
        assertEquals(new BigDecimal("70.00"), sale.getNetAmount());
        assertEquals(2, sale.getLines().size());
        assertEquals(productA, sale.getLines().get(0).getProductCode());
        assertEquals(2, sale.getLines().get(0).getQuantity());
        assertEquals(new BigDecimal("30.00"), sale.getLines().get(0).getUnitPrice());
        assertEquals(new BigDecimal("60.00"), sale.getLines().get(0).getLineTotal());
        assertEquals(productB, sale.getLines().get(1).getProductCode());
        assertEquals(new BigDecimal("40.00"), sale.getLines().get(1).getLineTotal());
        printSuccess("Read back matches what was computed at creation");
    }

    @Test
    @DisplayName("Discount larger than total clamps net amount to zero")
    void testNetAmountClamped() {
        String invoiceNo = salePostingService.createSale(customerId, employeeId,
            new BigDecimal("150.00"), hundredCart()).orElseThrow();

        SaleOrder sale = salePostingService.findSale(invoiceNo).orElseThrow();

        assertEquals(new BigDecimal("100.00"), sale.getTotalAmount());
        assertEquals(new BigDecimal("150.00"), sale.getDiscount());
        assertEquals(new BigDecimal("0.00"), sale.getNetAmount());
    }

    @Test
    @DisplayName("Empty cart fails with EMPTY_CART and writes nothing")
    void testEmptyCart() {
        PostingResult<String> result = salePostingService.createSale(customerId, employeeId, BigDecimal.ZERO, List.of());

        assertTrue(result.hasError(PostingErrorCode.EMPTY_CART));
        assertNothingWritten();
    }

    @Test
    @DisplayName("Empty cart is reported before an unknown customer")
    void testEmptyCartBeforeCustomer() {
        PostingResult<String> result = salePostingService.createSale("NOPE", "NOPE", BigDecimal.ZERO, List.of());

        assertTrue(result.hasError(PostingErrorCode.EMPTY_CART));
    }

    @Test
    @DisplayName("Unknown customer, employee or product is rejected in that order")
    void testReferenceValidationOrder() {
        List<LineItem> withUnknownProduct = List.of(LineItem.of("P-MISSING", 1, BigDecimal.ONE));

        assertTrue(salePostingService.createSale("NOPE", "NOPE", null, withUnknownProduct)
            .hasError(PostingErrorCode.CUSTOMER_NOT_FOUND));
        assertTrue(salePostingService.createSale(customerId, "NOPE", null, withUnknownProduct)
            .hasError(PostingErrorCode.EMPLOYEE_NOT_FOUND));

        PostingResult<String> result = salePostingService.createSale(customerId, employeeId, null, withUnknownProduct);
        assertTrue(result.hasError(PostingErrorCode.PRODUCT_NOT_FOUND));
        assertEquals("P-MISSING", result.getError().getProductCode());
        assertNothingWritten();
    }

    @Test
    @DisplayName("Walk-in customer is always available")
    void testWalkInCustomer() {
        PostingResult<String> result = salePostingService.createSale("C000", employeeId, null,
            List.of(LineItem.of(productA, 1, new BigDecimal("10.00"))));

        assertTrue(result.isSuccess());
        assertEquals(9, TestFixtures.stockOf(jdbcTemplate, productA));
    }

    @Test
    @DisplayName("Negative discount and malformed lines are rejected before any lookup")
    void testShapeValidation() {
        assertTrue(salePostingService.createSale(customerId, employeeId, new BigDecimal("-1.00"), hundredCart())
            .hasError(PostingErrorCode.INVALID_DISCOUNT));
        assertTrue(salePostingService.createSale(customerId, employeeId, null,
                List.of(LineItem.of(productA, 0, BigDecimal.ONE)))
            .hasError(PostingErrorCode.INVALID_LINE_ITEM));
        assertTrue(salePostingService.createSale(customerId, employeeId, null,
                List.of(LineItem.of(productA, 1, BigDecimal.ONE), LineItem.of(productA, 1, BigDecimal.ONE)))
            .hasError(PostingErrorCode.INVALID_LINE_ITEM));
        assertNothingWritten();
    }

    @Test
    @DisplayName("Line exceeding stock fails with INSUFFICIENT_STOCK and changes nothing")
    void testInsufficientStock() {
        printTestHeader("Insufficient Stock");
        List<LineItem> cart = List.of(
            LineItem.of(productA, 2, new BigDecimal("30.00")),
            LineItem.of(productB, 6, new BigDecimal("40.00"))
        );
        printInput("Cart", cart);

        PostingResult<String> result = salePostingService.createSale(customerId, employeeId, null, cart);

        printOutput("Error", result.getError());
        assertTrue(result.hasError(PostingErrorCode.INSUFFICIENT_STOCK));
        PostingError error = result.getError();
        assertEquals(productB, error.getProductCode());
        assertEquals(6, error.getRequested());
        assertEquals(5, error.getAvailable());
        assertNothingWritten();
        printSuccess("No header, no lines, no ledger change");
    }

    @Test
    @DisplayName("Stock taken after the snapshot check rolls the whole sale back")
    void testAtomicRecheck() {
        printTestHeader("Atomic Re-check");
        String invoiceNo = TestFixtures.shortId("RCHK");

        // Another till empties product B between the snapshot check and the atomic phase
        SalePostingService racingService = new SalePostingService(
            referenceValidator,
            ledgerService,
            saleRepository,
            unitOfWork,
            () -> {
                jdbcTemplate.update("UPDATE inventory SET current_stock = 0 WHERE product_code = ?", productB);
                return invoiceNo;
            },
            postingMetrics
        );

        PostingResult<String> result = racingService.createSale(customerId, employeeId, null, List.of(
            LineItem.of(productA, 2, new BigDecimal("30.00")),
            LineItem.of(productB, 3, new BigDecimal("40.00"))
        ));

        printOutput("Error", result.getError());
        assertTrue(result.hasError(PostingErrorCode.INSUFFICIENT_STOCK));
        assertEquals(productB, result.getError().getProductCode());
        assertEquals(3, result.getError().getRequested());
        assertEquals(0, result.getError().getAvailable());
        assertEquals(10, TestFixtures.stockOf(jdbcTemplate, productA));
        assertEquals(0, TestFixtures.stockOf(jdbcTemplate, productB));
        assertTrue(saleRepository.findByInvoiceNo(invoiceNo).isEmpty());
        assertTrue(saleRepository.findLines(invoiceNo).isEmpty());
        printSuccess("Ledger re-check caught the race, nothing persisted");
    }

    @Test
    @DisplayName("Same idempotency key posts the sale once")
    void testIdempotencyKey() {
        String key = "sale-" + TestFixtures.shortId("K");
        SaleRequest request = new SaleRequest(customerId, employeeId, null, hundredCart(), key);

        String first = salePostingService.createSale(request).orElseThrow();
        String second = salePostingService.createSale(request).orElseThrow();

        assertEquals(first, second);
        assertEquals(1, TestFixtures.countSalesOfCustomer(jdbcTemplate, customerId));
        assertEquals(8, TestFixtures.stockOf(jdbcTemplate, productA));
        assertEquals(Optional.of(first), saleRepository.findInvoiceNoByIdempotencyKey(key));
    }

    @Test
    @DisplayName("Replaying a key after the sale took the last units returns the original invoice")
    void testIdempotencyKeyAfterSellOut() {
        printTestHeader("Idempotent Replay After Sell-out");
        String key = "sale-" + TestFixtures.shortId("K");
        SaleRequest request = new SaleRequest(customerId, employeeId, null,
            List.of(LineItem.of(productB, 5, new BigDecimal("40.00"))), key);

        String first = salePostingService.createSale(request).orElseThrow();
        assertEquals(0, TestFixtures.stockOf(jdbcTemplate, productB));

        PostingResult<String> replay = salePostingService.createSale(request);
        printOutput("Replay", replay);

        assertTrue(replay.isSuccess());
        assertEquals(first, replay.getValue());
        assertEquals(1, TestFixtures.countSalesOfCustomer(jdbcTemplate, customerId));
        assertEquals(0, TestFixtures.stockOf(jdbcTemplate, productB));
        printSuccess("Replay answered from the stored key, stock untouched");
    }

    @Test
    @DisplayName("Line total beyond the amount columns is rejected before any write")
    void testOversizedLine() {
        PostingResult<String> result = salePostingService.createSale(customerId, employeeId, null,
            List.of(LineItem.of(productA, 10, new BigDecimal("99999999.99"))));

        assertTrue(result.hasError(PostingErrorCode.INVALID_LINE_ITEM));
        assertNothingWritten();

        PostingResult<String> hugeDiscount = salePostingService.createSale(customerId, employeeId,
            new BigDecimal("100000000.00"), List.of(LineItem.of(productA, 1, BigDecimal.TEN)));
        assertTrue(hugeDiscount.hasError(PostingErrorCode.INVALID_DISCOUNT));
        assertNothingWritten();
    }

    @Test
    @DisplayName("Sale lookups by customer, employee, date and recency")
    void testQueries() {
        String first = salePostingService.createSale(customerId, employeeId, null,
            List.of(LineItem.of(productA, 1, BigDecimal.TEN))).orElseThrow();
        String second = salePostingService.createSale(customerId, employeeId, null,
            List.of(LineItem.of(productB, 1, BigDecimal.TEN))).orElseThrow();

        List<String> byCustomer = salePostingService.findSalesByCustomer(customerId).stream()
            .map(SaleOrder::getInvoiceNo).toList();
        assertEquals(2, byCustomer.size());
        assertTrue(byCustomer.containsAll(List.of(first, second)));

        assertEquals(2, salePostingService.findSalesByEmployee(employeeId).size());

        List<String> today = salePostingService.findSalesByDateRange(LocalDate.now(), LocalDate.now()).stream()
            .map(SaleOrder::getInvoiceNo).toList();
        assertTrue(today.containsAll(List.of(first, second)));
        assertTrue(salePostingService.findSalesByDateRange(
            LocalDate.now().minusDays(10), LocalDate.now().minusDays(5)).isEmpty());

        assertEquals(1, salePostingService.findRecentSales(1).size());
        assertThrows(IllegalArgumentException.class, () -> salePostingService.findRecentSales(0));
        assertThrows(IllegalArgumentException.class,
            () -> salePostingService.findSalesByDateRange(LocalDate.now(), LocalDate.now().minusDays(1)));
        assertTrue(salePostingService.findSale("INV-NONE").isEmpty());
    }
}
