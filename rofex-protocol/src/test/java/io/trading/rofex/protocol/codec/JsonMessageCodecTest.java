package io.trading.rofex.protocol.codec;

import io.trading.rofex.protocol.message.ErrorMessage;
import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.message.MarketDataMessage;
import io.trading.rofex.protocol.message.MessageCategory;
import io.trading.rofex.protocol.message.OrderReportMessage;
import io.trading.rofex.protocol.model.EntryValue;
import io.trading.rofex.protocol.model.MarketDataEntry;
import io.trading.rofex.protocol.model.OrderStatus;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.Side;
import io.trading.rofex.protocol.model.TimeInForce;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decoding tests using frames shaped like the ones sent by the Primary gateway.
 */
class JsonMessageCodecTest {

    private final JsonMessageCodec codec = new JsonMessageCodec();

    @Test
    void testDecodeMarketDataLast() {
        String frame = """
            {
                "type": "Md",
                "timestamp": 1574696442510,
                "instrumentId": {"marketId": "ROFX", "symbol": "DODic19"},
                "marketData": {"LA": {"price": 55.8, "size": 3, "date": 1574696440000}}
            }
            """;

        InboundMessage message = codec.decode(frame);

        assertEquals(MessageCategory.MARKET_DATA, message.category());
        MarketDataMessage marketData = (MarketDataMessage) message;
        assertEquals("DODic19", marketData.instrument().symbol());
        assertEquals("ROFX", marketData.instrument().marketId());
        assertEquals(1574696442510L, marketData.timestamp());

        EntryValue last = marketData.last().orElseThrow();
        assertEquals(0, new BigDecimal("55.8").compareTo(last.price()));
        assertEquals(0, new BigDecimal("3").compareTo(last.size()));
        assertEquals(1574696440000L, last.date());
        assertSame(frame, marketData.raw());
    }

    @Test
    void testDecodeMarketDataBook() {
        String frame = """
            {
                "type": "Md",
                "timestamp": 1574696442510,
                "instrumentId": {"marketId": "ROFX", "symbol": "DLR/DIC23"},
                "marketData": {
                    "BI": [{"price": 210.5, "size": 10}, {"price": 210.0, "size": 25}],
                    "OF": [],
                    "LA": null,
                    "TV": 1520,
                    "XX": 1
                }
            }
            """;

        MarketDataMessage marketData = (MarketDataMessage) codec.decode(frame);

        assertEquals(2, marketData.bids().size());
        assertEquals(0, new BigDecimal("210.5").compareTo(marketData.bids().get(0).price()));
        assertEquals(0, new BigDecimal("25").compareTo(marketData.bids().get(1).size()));
        assertTrue(marketData.offers().isEmpty());
        assertTrue(marketData.last().isEmpty());
        assertEquals(0, new BigDecimal("1520").compareTo(
            marketData.first(MarketDataEntry.TRADE_VOLUME).orElseThrow().price()));
        assertEquals(4, marketData.entries().size());
    }

    @Test
    void testDecodeOrderReport() {
        String frame = """
            {
                "type": "or",
                "orderReport": {
                    "orderId": "1128056",
                    "clOrdId": "user14545967430231",
                    "proprietary": "PBCP",
                    "execId": "160127155448-fix1-1368",
                    "accountId": {"id": "REM1234"},
                    "instrumentId": {"marketId": "ROFX", "symbol": "DLR/ENE24"},
                    "price": 210,
                    "orderQty": 100,
                    "ordType": "LIMIT",
                    "side": "BUY",
                    "timeInForce": "DAY",
                    "transactTime": "20160204-11:41:54",
                    "avgPx": 210,
                    "lastPx": 210,
                    "lastQty": 40,
                    "cumQty": 40,
                    "leavesQty": 60,
                    "status": "PARTIALLY_FILLED",
                    "text": "Partial fill"
                }
            }
            """;

        OrderReportMessage report = (OrderReportMessage) codec.decode(frame);

        assertEquals(MessageCategory.ORDER_REPORT, report.category());
        assertEquals("1128056", report.orderId());
        assertEquals("user14545967430231", report.clOrdId());
        assertEquals("REM1234", report.accountId());
        assertEquals("DLR/ENE24", report.instrument().symbol());
        assertEquals(OrderType.LIMIT, report.orderType());
        assertEquals(Side.BUY, report.side());
        assertEquals(TimeInForce.DAY, report.timeInForce());
        assertEquals(OrderStatus.PARTIALLY_FILLED, report.status());
        assertEquals(0, new BigDecimal("60").compareTo(report.leavesQty()));
        assertTrue(report.isFill());
        assertFalse(report.status().isFinal());
    }

    @Test
    void testDecodeOrderReportWithStringNumbers() {
        String frame = "{\"type\":\"OR\",\"orderReport\":{\"clOrdId\":\"abc\",\"price\":\"12.25\",\"status\":\"NEW\"}}";

        OrderReportMessage report = (OrderReportMessage) codec.decode(frame);

        assertEquals(0, new BigDecimal("12.25").compareTo(report.price()));
        assertEquals(OrderStatus.NEW, report.status());
        assertNull(report.instrument());
        assertFalse(report.isFill());
    }

    @Test
    void testDecodeGatewayError() {
        String frame = "{\"status\":\"ERROR\",\"message\":\"Invalid instrument\",\"description\":\"InvalidInstrument is not valid\"}";

        ErrorMessage error = (ErrorMessage) codec.decode(frame);

        assertEquals(MessageCategory.ERROR, error.category());
        assertEquals(ErrorMessage.Source.GATEWAY, error.source());
        assertEquals("Invalid instrument", error.code());
        assertEquals("InvalidInstrument is not valid", error.description());
    }

    @Test
    void testDecodeUnknownTypeBecomesError() {
        String frame = "{\"type\":\"XX\",\"foo\":1}";

        ErrorMessage error = (ErrorMessage) codec.decode(frame);

        assertEquals(ErrorMessage.Source.UNSUPPORTED, error.source());
        assertTrue(error.description().contains("XX"));
        assertEquals(frame, error.raw());
    }

    @Test
    void testDecodeMissingTypeBecomesError() {
        ErrorMessage error = (ErrorMessage) codec.decode("{\"foo\":1}");
        assertEquals(ErrorMessage.Source.UNSUPPORTED, error.source());
    }

    @Test
    void testDecodeMalformedJsonBecomesError() {
        String frame = "{\"type\":\"Md\",\"instrumentId\":";

        ErrorMessage error = (ErrorMessage) codec.decode(frame);

        assertEquals(ErrorMessage.Source.MALFORMED, error.source());
        assertEquals(frame, error.raw());
    }

    @Test
    void testDecodeMarketDataWithoutInstrumentBecomesError() {
        ErrorMessage error = (ErrorMessage) codec.decode("{\"type\":\"Md\",\"marketData\":{}}");
        assertEquals(ErrorMessage.Source.MALFORMED, error.source());
    }

    @Test
    void testDecodeInvalidNumberBecomesError() {
        String frame = "{\"type\":\"Md\",\"instrumentId\":{\"symbol\":\"X\"},\"marketData\":{\"LA\":{\"price\":\"abc\"}}}";

        ErrorMessage error = (ErrorMessage) codec.decode(frame);

        assertEquals(ErrorMessage.Source.MALFORMED, error.source());
        assertTrue(error.description().contains("abc"));
    }

    @Test
    void testDecodeBlankAndNonObjectFrames() {
        assertEquals(ErrorMessage.Source.MALFORMED, ((ErrorMessage) codec.decode("  ")).source());
        assertEquals(ErrorMessage.Source.MALFORMED, ((ErrorMessage) codec.decode(null)).source());
        assertEquals(ErrorMessage.Source.UNSUPPORTED, ((ErrorMessage) codec.decode("[1,2]")).source());
    }
}
