package com.flagship.pos_inventory.posting;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link NextIdGenerator} backed by a PostgreSQL sequence.
 *
 * Produces prefix + zero-padded number (INV001, INV002, ... INV1000).
 * nextval() is never rolled back, so concurrent postings can't collide.
 */
public class SequenceNextIdGenerator implements NextIdGenerator {

    private final JdbcTemplate jdbcTemplate;
    private final String sequenceName;
    private final String prefix;

    public SequenceNextIdGenerator(JdbcTemplate jdbcTemplate, String sequenceName, String prefix) {
        this.jdbcTemplate = jdbcTemplate;
        this.sequenceName = sequenceName;
        this.prefix = prefix;
    }

    @Override
    public String nextId() {
        Long next = jdbcTemplate.queryForObject("SELECT nextval(?::regclass)", Long.class, sequenceName);
        if (next == null) {
            throw new IllegalStateException("Sequence " + sequenceName + " returned no value");
        }
        return String.format("%s%03d", prefix, next);
    }
}
