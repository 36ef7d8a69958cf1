package com.flagship.pos_inventory.sale;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Time;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to sale_orders and sale_line_items.
 *
 * Inserts never run on their own: they are part of the sale posting unit
 * of work, together with the ledger deductions.
 */
@Repository
public class SaleRepository {

    private static final String HEADER_COLUMNS =
        "invoice_no, customer_id, employee_id, sale_date, sale_time, total_amount, discount, net_amount";

    private final JdbcTemplate jdbcTemplate;

    public SaleRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(SaleOrder sale, String idempotencyKey) {
        jdbcTemplate.update(
            "INSERT INTO sale_orders (" + HEADER_COLUMNS + ", idempotency_key) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            sale.getInvoiceNo(),
            sale.getCustomerId(),
            sale.getEmployeeId(),
            Date.valueOf(sale.getSaleDate()),
            Time.valueOf(sale.getSaleTime()),
            sale.getTotalAmount(),
            sale.getDiscount(),
            sale.getNetAmount(),
            idempotencyKey
        );

        List<SaleLineItem> lines = sale.getLines();
        for (int i = 0; i < lines.size(); i++) {
            SaleLineItem line = lines.get(i);
            jdbcTemplate.update(
                "INSERT INTO sale_line_items (invoice_no, product_code, line_no, quantity, unit_price, line_total) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                line.getInvoiceNo(),
                line.getProductCode(),
                i + 1,
                line.getQuantity(),
                line.getUnitPrice(),
                line.getLineTotal()
            );
        }
    }

    public Optional<SaleOrder> findByInvoiceNo(String invoiceNo) {
        List<SaleOrder> headers = jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM sale_orders WHERE invoice_no = ?",
            headerRowMapper(),
            invoiceNo
        );
        return headers.stream().findFirst().map(this::withLines);
    }

    public Optional<String> findInvoiceNoByIdempotencyKey(String idempotencyKey) {
        List<String> invoiceNos = jdbcTemplate.queryForList(
            "SELECT invoice_no FROM sale_orders WHERE idempotency_key = ?",
            String.class,
            idempotencyKey
        );
        return invoiceNos.stream().findFirst();
    }

    /**
     * Headers only; use {@link #findByInvoiceNo} for the lines.
     */
    public List<SaleOrder> findRecent(int limit) {
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM sale_orders ORDER BY sale_date DESC, sale_time DESC, invoice_no DESC LIMIT ?",
            headerRowMapper(),
            limit
        );
    }

    public List<SaleOrder> findByCustomer(String customerId) {
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM sale_orders WHERE customer_id = ? ORDER BY sale_date DESC, sale_time DESC",
            headerRowMapper(),
            customerId
        );
    }

    public List<SaleOrder> findByEmployee(String employeeId) {
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM sale_orders WHERE employee_id = ? ORDER BY sale_date DESC, sale_time DESC",
            headerRowMapper(),
            employeeId
        );
    }

    public List<SaleOrder> findByDateRange(LocalDate start, LocalDate end) {
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM sale_orders WHERE sale_date BETWEEN ? AND ? " +
            "ORDER BY sale_date DESC, sale_time DESC",
            headerRowMapper(),
            Date.valueOf(start),
            Date.valueOf(end)
        );
    }

    public List<SaleLineItem> findLines(String invoiceNo) {
        return jdbcTemplate.query(
            "SELECT invoice_no, product_code, quantity, unit_price, line_total " +
            "FROM sale_line_items WHERE invoice_no = ? ORDER BY line_no",
            (rs, rowNum) -> new SaleLineItem(
                rs.getString("invoice_no"),
                rs.getString("product_code"),
                rs.getInt("quantity"),
                rs.getBigDecimal("unit_price"),
                rs.getBigDecimal("line_total")
            ),
            invoiceNo
        );
    }

    private SaleOrder withLines(SaleOrder header) {
        return new SaleOrder(
            header.getInvoiceNo(),
            header.getCustomerId(),
            header.getEmployeeId(),
            header.getSaleDate(),
            header.getSaleTime(),
            header.getTotalAmount(),
            header.getDiscount(),
            header.getNetAmount(),
            findLines(header.getInvoiceNo())
        );
    }

    private RowMapper<SaleOrder> headerRowMapper() {
        return (rs, rowNum) -> new SaleOrder(
            rs.getString("invoice_no"),
            rs.getString("customer_id"),
            rs.getString("employee_id"),
            rs.getDate("sale_date").toLocalDate(),
            rs.getTime("sale_time").toLocalTime(),
            rs.getBigDecimal("total_amount"),
            rs.getBigDecimal("discount"),
            rs.getBigDecimal("net_amount"),
            List.of()
        );
    }
}
