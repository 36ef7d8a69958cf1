package com.flagship.pos_inventory.inventory;

import com.flagship.pos_inventory.observability.PostingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * The inventory ledger: current stock per product and its mutation contract.
 *
 * Stock only changes through {@link #adjust}, a single conditional UPDATE
 * evaluated by the database. The non-negativity check and the write are
 * one statement, so two sales racing for the last units cannot both win:
 * the second one re-evaluates the WHERE clause against the committed row
 * and updates nothing.
 *
 * No stock levels are cached in the application.
 */
@Service
@Slf4j
public class InventoryLedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final PostingMetrics postingMetrics;

    public InventoryLedgerService(JdbcTemplate jdbcTemplate, PostingMetrics postingMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.postingMetrics = postingMetrics;
    }

    /**
     * Applies current_stock += delta if the result stays non-negative.
     *
     * Must run inside the caller's unit of work; a rejection rolls the
     * whole unit back. last_updated only moves on success.
     *
     * @throws StockAdjustmentRejectedException if no row was updated
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void adjust(String productCode, int delta) {
        int updated = jdbcTemplate.update(
            "UPDATE inventory " +
            "SET current_stock = current_stock + ?, last_updated = CURRENT_TIMESTAMP " +
            "WHERE product_code = ? AND current_stock + ? >= 0",
            delta,
            productCode,
            delta
        );

        if (updated == 0) {
            postingMetrics.recordStockRejection(delta < 0 ? "decrement" : "increment");
            log.debug("Ledger rejected adjustment: productCode={}, delta={}", productCode, delta);
            throw new StockAdjustmentRejectedException(productCode, delta);
        }
    }

    /**
     * Manual stock correction (stock count, damage, shrinkage).
     * Same conditional update as postings; the reason is only logged.
     *
     * @return the record after the adjustment
     */
    @Transactional
    public InventoryRecord applyManualAdjustment(String productCode, int delta, String reason) {
        adjust(productCode, delta);
        InventoryRecord record = findRecord(productCode)
            .orElseThrow(() -> new IllegalStateException("Inventory record vanished for " + productCode));
        log.info("Manual stock adjustment: productCode={}, delta={}, newStock={}, reason={}",
                productCode, delta, record.getCurrentStock(), reason);
        return record;
    }

    /**
     * Snapshot read of one product's stock. Not a reservation: the value
     * may be stale by the time a posting commits.
     */
    @Transactional(readOnly = true)
    public Optional<InventoryRecord> findRecord(String productCode) {
        List<InventoryRecord> records = jdbcTemplate.query(
            "SELECT product_code, current_stock, last_updated FROM inventory WHERE product_code = ?",
            inventoryRecordRowMapper(),
            productCode
        );
        return records.stream().findFirst();
    }

    /**
     * Stock available right now, zero when the product has no record.
     */
    @Transactional(readOnly = true)
    public int availableStock(String productCode) {
        return findRecord(productCode)
            .map(InventoryRecord::getCurrentStock)
            .orElse(0);
    }

    /**
     * Products at or below their minimum stock level, largest shortfall first.
     */
    @Transactional(readOnly = true)
    public List<LowStockItem> findLowStock() {
        return jdbcTemplate.query(
            "SELECT p.product_code, p.product_name, COALESCE(i.current_stock, 0) AS current_stock, " +
            "       p.min_stock_level " +
            "FROM products p LEFT JOIN inventory i ON i.product_code = p.product_code " +
            "WHERE COALESCE(i.current_stock, 0) <= p.min_stock_level " +
            "ORDER BY (p.min_stock_level - COALESCE(i.current_stock, 0)) DESC, p.product_code",
            (rs, rowNum) -> new LowStockItem(
                rs.getString("product_code"),
                rs.getString("product_name"),
                rs.getInt("current_stock"),
                rs.getInt("min_stock_level")
            )
        );
    }

    private RowMapper<InventoryRecord> inventoryRecordRowMapper() {
        return (rs, rowNum) -> new InventoryRecord(
            rs.getString("product_code"),
            rs.getInt("current_stock"),
            rs.getTimestamp("last_updated").toLocalDateTime()
        );
    }
}
