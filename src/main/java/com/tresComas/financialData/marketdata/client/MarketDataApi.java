package com.tresComas.financialData.marketdata.client;

import com.tresComas.financialData.marketdata.dto.HistoryRequest;
import com.tresComas.financialData.marketdata.dto.RawPriceSeries;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;

import java.util.List;
import java.util.Map;

/**
 * Wire-level access to the market data provider.
 * Implementations throw {@link com.tresComas.financialData.common.exception.UpstreamUnavailableException}
 * when the provider cannot be reached or answers with an error.
 */
public interface MarketDataApi {

    /**
     * Quote and profile fields, flattened to the provider's field names
     * (shortName, sector, industry, marketCap, trailingPE, dividendYield, beta,
     * fiftyTwoWeekHigh, fiftyTwoWeekLow, averageVolume).
     */
    Map<String, Object> fetchTickerInfo(String ticker);

    RawPriceSeries fetchHistory(String ticker, HistoryRequest request);

    /**
     * Listed option expirations as yyyy-MM-dd, nearest first.
     */
    List<String> fetchOptionExpirations(String ticker);

    OptionsExpiration fetchOptionChain(String ticker, String expiration);
}
