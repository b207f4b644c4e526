package com.algotrendy.gateway.broker;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Venue minimums for a trading pair.
 *
 * @param minVolume   minimum order volume in base currency
 * @param minNotional minimum order value in quote currency
 */
public record OrderLimits(BigDecimal minVolume, BigDecimal minNotional) {

    public static OrderLimits of(String minVolume, String minNotional) {
        return new OrderLimits(new BigDecimal(minVolume), new BigDecimal(minNotional));
    }

    /**
     * Reason the order breaks a minimum, or empty if it is acceptable.
     * Notional is only checked when a price is known.
     */
    public Optional<String> validate(BigDecimal volume, BigDecimal price) {
        if (volume.compareTo(minVolume) < 0) {
            return Optional.of(String.format("Volume %s below minimum %s", volume.toPlainString(), minVolume.toPlainString()));
        }
        if (price != null) {
            BigDecimal notional = volume.multiply(price);
            if (notional.compareTo(minNotional) < 0) {
                return Optional.of(String.format("Order value %s below minimum %s",
                    notional.toPlainString(), minNotional.toPlainString()));
            }
        }
        return Optional.empty();
    }
}
