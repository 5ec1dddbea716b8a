package dev.menuwizard.engine;

import dev.menuwizard.model.SalesSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Keeps price and margin consistent. Whichever one the user edited last wins; the other is
 * recomputed from the total cost.
 */
public final class PriceMarginSync {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PriceMarginSync() {}

    /**
     * Set the price and derive the margin: {@code (price - cost) / price * 100}.
     * Without a positive cost and price, the margin is left as it was.
     */
    public static SalesSettings withPrice(SalesSettings current, BigDecimal totalCost, BigDecimal price) {
        BigDecimal margin = current.margin();
        if (isPositive(totalCost) && isPositive(price)) {
            margin = price.subtract(totalCost)
                .multiply(HUNDRED)
                .divide(price, 2, RoundingMode.HALF_UP);
        }
        return new SalesSettings(price, margin, current.isAvailable());
    }

    /**
     * Set the margin and derive the price: {@code cost / (1 - margin / 100)}.
     * Without a positive cost, or with a margin of 100% or more, the price is left as it was.
     */
    public static SalesSettings withMargin(SalesSettings current, BigDecimal totalCost, BigDecimal margin) {
        BigDecimal price = current.price();
        if (isPositive(totalCost) && margin != null && margin.compareTo(HUNDRED) < 0) {
            BigDecimal share = HUNDRED.subtract(margin);
            price = totalCost.multiply(HUNDRED).divide(share, 2, RoundingMode.HALF_UP);
        }
        return new SalesSettings(price, margin, current.isAvailable());
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
