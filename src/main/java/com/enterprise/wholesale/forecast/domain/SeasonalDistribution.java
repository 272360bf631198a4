package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * An annual amount spread over quarters and months. Quarters sum to the
 * annual amount and each quarter's months sum to that quarter, to the cent.
 */
public record SeasonalDistribution(
    BigDecimal annual,
    List<BigDecimal> quarterly,
    List<BigDecimal> monthly
) {

    public SeasonalDistribution {
        quarterly = List.copyOf(quarterly);
        monthly = List.copyOf(monthly);
    }

    public BigDecimal quarter(int quarter) {
        return quarterly.get(quarter - 1);
    }

    public BigDecimal month(int month) {
        return monthly.get(month - 1);
    }
}
