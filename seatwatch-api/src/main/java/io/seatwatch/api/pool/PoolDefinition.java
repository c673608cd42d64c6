package io.seatwatch.api.pool;

import java.math.BigDecimal;

/**
 * Configuration of a single seat pool.
 * Used for seeding at startup, administrative provisioning and budget updates.
 * <p>
 * If {@link #maxOverage(int)} is never called, the overage allowance defaults to
 * {@code totalCapacity - commitQuantity}.
 */
public final class PoolDefinition {

    private final String name;
    private int totalCapacity;
    private int commitQuantity;
    private Integer maxOverage = null; // null = total - commit
    private BigDecimal commitFee = BigDecimal.ZERO;
    private BigDecimal overageUnitPrice = BigDecimal.ZERO;

    private PoolDefinition(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pool name must not be blank");
        }
        this.name = name;
    }

    public static PoolDefinition named(String name) {
        return new PoolDefinition(name);
    }

    public PoolDefinition totalCapacity(int totalCapacity) {
        if (totalCapacity < 0) {
            throw new IllegalArgumentException("Total capacity must not be negative");
        }
        this.totalCapacity = totalCapacity;
        return this;
    }

    public PoolDefinition commitQuantity(int commitQuantity) {
        if (commitQuantity < 0) {
            throw new IllegalArgumentException("Commit quantity must not be negative");
        }
        this.commitQuantity = commitQuantity;
        return this;
    }

    public PoolDefinition maxOverage(int maxOverage) {
        if (maxOverage < 0) {
            throw new IllegalArgumentException("Max overage must not be negative");
        }
        this.maxOverage = maxOverage;
        return this;
    }

    public PoolDefinition commitFee(BigDecimal commitFee) {
        if (commitFee == null || commitFee.signum() < 0) {
            throw new IllegalArgumentException("Commit fee must be zero or positive");
        }
        this.commitFee = commitFee;
        return this;
    }

    public PoolDefinition overageUnitPrice(BigDecimal overageUnitPrice) {
        if (overageUnitPrice == null || overageUnitPrice.signum() < 0) {
            throw new IllegalArgumentException("Overage unit price must be zero or positive");
        }
        this.overageUnitPrice = overageUnitPrice;
        return this;
    }

    /**
     * Cross-field checks that cannot run in the individual setters.
     *
     * @throws PoolConfigurationException if commit exceeds total capacity
     */
    public PoolDefinition validate() {
        if (commitQuantity > totalCapacity) {
            throw new PoolConfigurationException(
                    "Commit quantity " + commitQuantity + " exceeds total capacity " + totalCapacity + " for pool " + name);
        }
        return this;
    }

    public String name() { return name; }
    public int totalCapacity() { return totalCapacity; }
    public int commitQuantity() { return commitQuantity; }
    public BigDecimal commitFee() { return commitFee; }
    public BigDecimal overageUnitPrice() { return overageUnitPrice; }

    public int maxOverage() {
        if (maxOverage != null) {
            return maxOverage;
        }
        return Math.max(0, totalCapacity - commitQuantity);
    }

    @Override
    public String toString() {
        return "PoolDefinition[" + name + ", total=" + totalCapacity + ", commit=" + commitQuantity
                + ", maxOverage=" + maxOverage() + "]";
    }
}
