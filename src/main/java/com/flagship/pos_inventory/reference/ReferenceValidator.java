package com.flagship.pos_inventory.reference;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only existence checks against reference data owned by the
 * catalogue and party modules (customers, employees, suppliers, products).
 *
 * Used by the posting engines to fail fast before any write. A null or
 * blank id never exists.
 */
@Service
public class ReferenceValidator {

    private final JdbcTemplate jdbcTemplate;

    public ReferenceValidator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean customerExists(String customerId) {
        return exists("SELECT COUNT(*) FROM customers WHERE customer_id = ?", customerId);
    }

    public boolean employeeExists(String employeeId) {
        return exists("SELECT COUNT(*) FROM employees WHERE employee_id = ?", employeeId);
    }

    public boolean supplierExists(String supplierId) {
        return exists("SELECT COUNT(*) FROM suppliers WHERE supplier_id = ?", supplierId);
    }

    public boolean productExists(String productCode) {
        return exists("SELECT COUNT(*) FROM products WHERE product_code = ?", productCode);
    }

    /**
     * Returns the first product code, in iteration order, that has no product row.
     */
    public Optional<String> findFirstMissingProduct(Collection<String> productCodes) {
        for (String productCode : productCodes) {
            if (!productExists(productCode)) {
                return Optional.of(productCode);
            }
        }
        return Optional.empty();
    }

    private boolean exists(String sql, String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, id);
        return count != null && count > 0;
    }
}
