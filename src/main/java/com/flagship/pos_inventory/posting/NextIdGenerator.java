package com.flagship.pos_inventory.posting;

/**
 * Source of document numbers (invoice numbers, purchase numbers).
 *
 * Implementations must hand out unique, monotonically increasing strings.
 * Numbers consumed by a rolled-back posting are not reused.
 */
@FunctionalInterface
public interface NextIdGenerator {

    String nextId();
}
