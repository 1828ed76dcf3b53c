package com.tresComas.financialData.marketdata.util;

import com.tresComas.financialData.marketdata.model.ExpirationVolatility;
import com.tresComas.financialData.marketdata.model.ImpliedVolatility;
import com.tresComas.financialData.marketdata.model.OptionContract;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Summarizes the implied volatility carried by an options chain.
 *
 * Per expiration: mean of positive call IVs, mean of positive put IVs, and the mean of whichever
 * of those two exist. Overall: mean of the per-expiration figures that could be computed, or 0.0.
 */
public final class ImpliedVolatilityCalculator {

    private ImpliedVolatilityCalculator() {
    }

    public static ImpliedVolatility calculate(String symbol, OptionsChain chain, Instant now) {
        Map<String, ExpirationVolatility> expirations = new LinkedHashMap<>();
        double total = 0.0;
        int computable = 0;

        Map<String, OptionsExpiration> source = chain != null && chain.getExpirations() != null
                ? chain.getExpirations()
                : Map.of();

        for (Map.Entry<String, OptionsExpiration> entry : source.entrySet()) {
            OptionsExpiration expiration = entry.getValue();
            Double callsIv = positiveMean(expiration != null ? expiration.getCalls() : null);
            Double putsIv = positiveMean(expiration != null ? expiration.getPuts() : null);
            Double averageIv = meanOf(callsIv, putsIv);

            expirations.put(entry.getKey(), ExpirationVolatility.builder()
                    .callsIv(callsIv)
                    .putsIv(putsIv)
                    .averageIv(averageIv)
                    .build());

            if (averageIv != null) {
                total += averageIv;
                computable++;
            }
        }

        return ImpliedVolatility.builder()
                .symbol(symbol)
                .averageIv(computable > 0 ? total / computable : 0.0)
                .expirations(expirations)
                .lastUpdated(now)
                .build();
    }

    private static Double positiveMean(List<OptionContract> contracts) {
        if (contracts == null) {
            return null;
        }
        OptionalDouble mean = contracts.stream()
                .map(OptionContract::getImpliedVolatility)
                .filter(iv -> iv != null && iv > 0)
                .mapToDouble(Double::doubleValue)
                .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }

    private static Double meanOf(Double callsIv, Double putsIv) {
        if (callsIv != null && putsIv != null) {
            return (callsIv + putsIv) / 2;
        }
        return callsIv != null ? callsIv : putsIv;
    }
}
