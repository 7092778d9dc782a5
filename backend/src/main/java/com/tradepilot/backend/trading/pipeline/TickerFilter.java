package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.config.StrategyProperties;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops symbols that are not individual stocks: forum acronyms, indices and
 * broad ETFs. Very short symbols are only trusted from non-noisy sources.
 */
public class TickerFilter {

    private static final Pattern VALID_SYMBOL = Pattern.compile("[A-Z0-9][A-Z0-9.\\-]*");

    static final Set<String> DEFAULT_EXCLUDED = Set.of(
            // forum acronyms
            "FAQ", "DD", "CEO", "GDP", "IPO", "ATH", "ATL", "IMO", "YOLO", "FYI", "EPS", "USA", "USD",
            "EUR", "GBP", "ETF", "SEC", "FED", "CPI", "PPI", "FOMC", "HODL", "DCA", "OEM", "LLC", "INC",
            "YOY", "QOQ", "MOM", "RIP", "FUD", "APE", "TLDR",
            // indices
            "VIX", "GSPC", "DJI", "IXIC", "FTSE", "DAX", "CAC",
            // broad ETFs
            "VOO", "SPY", "QQQ", "SCHD", "VTI", "VEA", "VXUS", "BND", "VIG", "IWM", "DIA", "ARKK",
            "VGT", "SOXL", "SOXS", "TQQQ", "SQQQ", "VT", "QQQM", "JEPI", "JEPQ", "RSP", "XLF", "XLE",
            "XLK", "VYM", "VNQ", "GLD", "SLV", "TLT", "HYG", "LQD", "AGG", "EFA", "EEM", "IEMG",
            "SCHG", "VWCE", "IWDA", "VUSA", "CSPX", "VUAA", "VWRL", "SWDA"
    );

    private final Set<String> excluded;
    private final Set<String> noisySources;
    private final int minTickerLength;

    public TickerFilter(StrategyProperties.Merge config) {
        this.excluded = new HashSet<>(DEFAULT_EXCLUDED);
        config.getExcludedTickers().forEach(ticker -> excluded.add(ticker.trim().toUpperCase(Locale.ROOT)));
        this.noisySources = new HashSet<>();
        config.getNoisySources().forEach(source -> noisySources.add(source.trim().toLowerCase(Locale.ROOT)));
        this.minTickerLength = config.getMinTickerLength();
    }

    public boolean accepts(String ticker, String source) {
        if (ticker == null || ticker.isEmpty() || !VALID_SYMBOL.matcher(ticker).matches()) {
            return false;
        }
        if (excluded.contains(ticker)) {
            return false;
        }
        return !noisySources.contains(source) || ticker.length() >= minTickerLength;
    }
}
