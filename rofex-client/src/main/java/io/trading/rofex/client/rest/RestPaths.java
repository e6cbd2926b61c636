package io.trading.rofex.client.rest;

/**
 * REST API paths, relative to the environment base URI.
 * Placeholders are filled with URL-encoded values.
 */
final class RestPaths {

    static final String SEGMENTS = "rest/segment/all";
    static final String INSTRUMENTS_ALL = "rest/instruments/all";
    static final String INSTRUMENTS_DETAILS = "rest/instruments/details";
    static final String INSTRUMENT_DETAIL = "rest/instruments/detail?symbol=%s&marketId=%s";
    static final String INSTRUMENTS_BY_CFI = "rest/instruments/byCFICode?CFICode=%s";
    static final String INSTRUMENTS_BY_SEGMENT = "rest/instruments/bySegment?MarketSegmentID=%s&MarketID=%s";
    static final String MARKET_DATA = "rest/marketdata/get?marketId=%s&symbol=%s&entries=%s&depth=%d";
    static final String HISTORIC_TRADES = "rest/data/getTrades?marketId=%s&symbol=%s&dateFrom=%s&dateTo=%s";
    static final String ORDER_STATUS = "rest/order/id?clOrdId=%s&proprietary=%s";
    static final String ALL_ORDERS_STATUS = "rest/order/all?accountId=%s";
    static final String NEW_ORDER = "rest/order/newSingleOrder?marketId=%s&symbol=%s&orderQty=%s&ordType=%s"
        + "&side=%s&timeInForce=%s&account=%s&cancelPrevious=%s";
    static final String LIMIT_ORDER = "&price=%s";
    static final String GOOD_TILL_DATE = "&expireDate=%s";
    static final String ICEBERG = "&iceberg=true&displayQty=%s";
    static final String CANCEL_ORDER = "rest/order/cancelById?clOrdId=%s&proprietary=%s";
    static final String ACCOUNT_POSITION = "rest/risk/position/getPositions/%s";
    static final String DETAILED_POSITION = "rest/risk/detailedPosition/%s";
    static final String ACCOUNT_REPORT = "rest/risk/accountReport/%s";

    private RestPaths() {
    }
}
