package io.trading.rofex.protocol.model;

/**
 * CFI codes used to filter instrument queries.
 */
public enum CfiCode {
    STOCK("ESXXXX"),
    BOND("DBXXXX"),
    CEDEAR("EMXXXX"),
    FUTURE("FXXXSX"),
    OPTIONS_FUTURE_CALL("OCAFXS"),
    OPTIONS_FUTURE_PUT("OPAFXS"),
    OPTIONS_STOCK_CALL("OCASPS"),
    OPTIONS_STOCK_PUT("OPASPS"),
    MERVAL_INDEX("MRIXXX"),
    PUBLIC_OBLIGATIONS("DBXXFR");

    private final String code;

    CfiCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
