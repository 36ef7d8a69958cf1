package com.flagship.pos_inventory;

import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Inserts reference data straight into the tables this service only reads.
 * Every call creates fresh ids so tests sharing a database do not collide.
 */
public final class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    public static String shortId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 10 - prefix.length());
    }

    public static String customer(JdbcTemplate jdbcTemplate) {
        String customerId = shortId("C");
        jdbcTemplate.update("INSERT INTO customers (customer_id, customer_name) VALUES (?, ?)",
            customerId, "Customer " + customerId);
        return customerId;
    }

    public static String employee(JdbcTemplate jdbcTemplate) {
        String employeeId = shortId("E");
        jdbcTemplate.update("INSERT INTO employees (employee_id, employee_name, position) VALUES (?, ?, ?)",
            employeeId, "Employee " + employeeId, "Cashier");
        return employeeId;
    }

    public static String supplier(JdbcTemplate jdbcTemplate) {
        String supplierId = shortId("S");
        jdbcTemplate.update("INSERT INTO suppliers (supplier_id, supplier_name, city) VALUES (?, ?, ?)",
            supplierId, "Supplier " + supplierId, "Colombo");
        return supplierId;
    }

    /**
     * Product with an inventory record holding the given stock and a minimum level of 5.
     */
    public static String product(JdbcTemplate jdbcTemplate, int stock) {
        String productCode = productWithoutInventory(jdbcTemplate);
        jdbcTemplate.update("INSERT INTO inventory (product_code, current_stock) VALUES (?, ?)", productCode, stock);
        return productCode;
    }

    public static String productWithoutInventory(JdbcTemplate jdbcTemplate) {
        String productCode = shortId("P-");
        jdbcTemplate.update(
            "INSERT INTO products (product_code, subcategory_id, product_name, cost_price, retail_price, min_stock_level) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            productCode, "SUB01", "Product " + productCode, new BigDecimal("6.00"), new BigDecimal("10.00"), 5);
        return productCode;
    }

    public static int stockOf(JdbcTemplate jdbcTemplate, String productCode) {
        Integer stock = jdbcTemplate.queryForObject(
            "SELECT current_stock FROM inventory WHERE product_code = ?", Integer.class, productCode);
        return stock == null ? 0 : stock;
    }

    public static int countSalesOfCustomer(JdbcTemplate jdbcTemplate, String customerId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sale_orders WHERE customer_id = ?", Integer.class, customerId);
        return count == null ? 0 : count;
    }

    public static int countSaleLinesOfProduct(JdbcTemplate jdbcTemplate, String productCode) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sale_line_items WHERE product_code = ?", Integer.class, productCode);
        return count == null ? 0 : count;
    }
}
