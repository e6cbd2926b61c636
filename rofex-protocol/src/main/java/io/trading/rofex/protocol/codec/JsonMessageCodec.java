package io.trading.rofex.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.rofex.protocol.error.ProtocolException;
import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.message.ErrorMessage;
import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.message.MarketDataMessage;
import io.trading.rofex.protocol.message.OrderReportMessage;
import io.trading.rofex.protocol.model.EntryValue;
import io.trading.rofex.protocol.model.InstrumentId;
import io.trading.rofex.protocol.model.MarketDataEntry;
import io.trading.rofex.protocol.model.OrderStatus;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.Side;
import io.trading.rofex.protocol.model.TimeInForce;
import io.trading.rofex.protocol.request.CancelOrderRequest;
import io.trading.rofex.protocol.request.LoginRequest;
import io.trading.rofex.protocol.request.MarketDataSubscription;
import io.trading.rofex.protocol.request.NewOrderRequest;
import io.trading.rofex.protocol.request.OrderReportSubscription;
import io.trading.rofex.protocol.request.SubscriptionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson based codec for the Primary streaming API.
 *
 * Frames are classified by:
 * 1. {@code "status":"ERROR"} - error notice from the gateway
 * 2. {@code "type"} (case-insensitive) - {@code MD} market data, {@code OR} order report
 *
 * Anything else becomes an {@link ErrorMessage}; decoding never throws.
 * Thread-safe and reusable.
 */
public class JsonMessageCodec implements MessageCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonMessageCodec.class);

    public static final String AUTH_HEADER = "X-Auth-Token";

    static final String TYPE_MARKET_DATA = "MD";
    static final String TYPE_ORDER_REPORT = "OR";
    static final String TYPE_SUBSCRIBE_MARKET_DATA = "smd";
    static final String TYPE_UNSUBSCRIBE_MARKET_DATA = "umd";
    static final String TYPE_SUBSCRIBE_ORDERS = "os";
    static final String TYPE_UNSUBSCRIBE_ORDERS = "uos";
    static final String TYPE_NEW_ORDER = "no";
    static final String TYPE_CANCEL_ORDER = "co";

    private static final JsonMessageCodec INSTANCE = new JsonMessageCodec();

    private final ObjectMapper objectMapper;

    public JsonMessageCodec() {
        this.objectMapper = new ObjectMapper()
            // keep prices exact: 55.8 must stay 55.8
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Gets the shared instance.
     */
    public static JsonMessageCodec getInstance() {
        return INSTANCE;
    }

    @Override
    public Map<String, String> encodeLogin(LoginRequest request) {
        RequestValidator.validate(request);
        return Map.of(AUTH_HEADER, request.token());
    }

    @Override
    public String encode(SubscriptionRequest request) {
        RequestValidator.validate(request);
        if (request instanceof MarketDataSubscription marketData) {
            return write(marketDataFrame(TYPE_SUBSCRIBE_MARKET_DATA, marketData));
        }
        return write(orderReportFrame(TYPE_SUBSCRIBE_ORDERS, (OrderReportSubscription) request));
    }

    @Override
    public String encodeCancel(SubscriptionRequest request) {
        RequestValidator.validate(request);
        if (request instanceof MarketDataSubscription marketData) {
            return write(marketDataFrame(TYPE_UNSUBSCRIBE_MARKET_DATA, marketData));
        }
        return write(orderReportFrame(TYPE_UNSUBSCRIBE_ORDERS, (OrderReportSubscription) request));
    }

    @Override
    public String encode(NewOrderRequest request) {
        RequestValidator.validate(request);

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", TYPE_NEW_ORDER);
        ObjectNode product = frame.putObject("product");
        product.put("marketId", request.market().getCode());
        product.put("symbol", request.ticker());
        if (request.price() != null) {
            frame.put("price", request.price());
        }
        frame.put("quantity", request.size());
        frame.put("side", request.side().getWireValue());
        frame.put("ordType", request.orderType().name());
        frame.put("account", request.account());
        frame.put("timeInForce", request.timeInForce().getWireValue());
        frame.put("cancelPrevious", request.cancelPrevious());
        frame.put("iceberg", request.iceberg());
        if (request.iceberg()) {
            frame.put("displayQuantity", request.displayQuantity());
        }
        if (request.expireDate() != null) {
            frame.put("expireDate", request.expireDate());
        }
        if (request.wsClOrdId() != null) {
            frame.put("wsClOrdId", request.wsClOrdId());
        }
        return write(frame);
    }

    @Override
    public String encode(CancelOrderRequest request) {
        RequestValidator.validate(request);

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", TYPE_CANCEL_ORDER);
        frame.put("clientId", request.clOrdId());
        frame.put("proprietary", request.proprietary());
        return write(frame);
    }

    @Override
    public InboundMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            return new ErrorMessage(ErrorMessage.Source.MALFORMED, "EMPTY_FRAME", "Empty frame received", frame);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unparseable frame: {}", e.getOriginalMessage());
            return new ErrorMessage(ErrorMessage.Source.MALFORMED, "MALFORMED_FRAME",
                "Websocket: Message is not valid JSON: " + e.getOriginalMessage(), frame);
        }

        if (root == null || !root.isObject()) {
            return unsupported("Websocket: Message not Supported.", frame);
        }

        if ("ERROR".equalsIgnoreCase(root.path("status").asText(""))) {
            return new ErrorMessage(
                ErrorMessage.Source.GATEWAY,
                textOrDefault(root.get("message"), "ERROR"),
                textOrDefault(root.get("description"), ""),
                frame
            );
        }

        String type = root.path("type").asText("");
        try {
            return switch (type.toUpperCase()) {
                case TYPE_MARKET_DATA -> decodeMarketData(root, frame);
                case TYPE_ORDER_REPORT -> decodeOrderReport(root, frame);
                case "" -> unsupported("Websocket: Message not Supported.", frame);
                default -> unsupported("Websocket: Message Type not Supported. Type: " + type, frame);
            };
        } catch (ProtocolException e) {
            return new ErrorMessage(ErrorMessage.Source.MALFORMED, "MALFORMED_FRAME", e.getMessage(), frame);
        }
    }

    private MarketDataMessage decodeMarketData(JsonNode root, String frame) {
        InstrumentId instrument = instrument(root.get("instrumentId"), frame);
        long timestamp = root.path("timestamp").asLong(0);

        Map<MarketDataEntry, List<EntryValue>> entries = new EnumMap<>(MarketDataEntry.class);
        JsonNode marketData = root.get("marketData");
        if (marketData != null && marketData.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = marketData.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                MarketDataEntry entry = MarketDataEntry.lookup(field.getKey());
                if (entry == null) {
                    LOGGER.trace("Ignoring unknown market data entry {}", field.getKey());
                    continue;
                }
                entries.put(entry, entryValues(field.getValue(), frame));
            }
        }

        return new MarketDataMessage(instrument, timestamp, entries, frame);
    }

    private OrderReportMessage decodeOrderReport(JsonNode root, String frame) {
        JsonNode report = root.get("orderReport");
        if (report == null || !report.isObject()) {
            throw new ProtocolException("Order report frame without orderReport payload", frame);
        }

        String orderId = textOrDefault(report.get("orderId"), null);
        String clOrdId = textOrDefault(report.get("clOrdId"), null);
        if (orderId == null && clOrdId == null) {
            throw new ProtocolException("Order report without orderId or clOrdId", frame);
        }

        JsonNode instrumentNode = report.get("instrumentId");
        InstrumentId instrument = instrumentNode == null || instrumentNode.isNull()
            ? null
            : instrument(instrumentNode, frame);

        return new OrderReportMessage(
            orderId,
            clOrdId,
            textOrDefault(report.get("proprietary"), null),
            textOrDefault(report.get("execId"), null),
            textOrDefault(report.path("accountId").get("id"), null),
            instrument,
            decimal(report.get("price"), frame),
            decimal(report.get("orderQty"), frame),
            OrderType.fromString(textOrDefault(report.get("ordType"), null)),
            Side.fromString(textOrDefault(report.get("side"), null)),
            TimeInForce.fromString(textOrDefault(report.get("timeInForce"), null)),
            textOrDefault(report.get("transactTime"), null),
            decimal(report.get("avgPx"), frame),
            decimal(report.get("lastPx"), frame),
            decimal(report.get("lastQty"), frame),
            decimal(report.get("cumQty"), frame),
            decimal(report.get("leavesQty"), frame),
            OrderStatus.fromString(textOrDefault(report.get("status"), null)),
            textOrDefault(report.get("text"), null),
            frame
        );
    }

    private static ErrorMessage unsupported(String description, String frame) {
        return new ErrorMessage(ErrorMessage.Source.UNSUPPORTED, "UNSUPPORTED_TYPE", description, frame);
    }

    private static InstrumentId instrument(JsonNode node, String frame) {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Frame without instrumentId", frame);
        }
        String symbol = textOrDefault(node.get("symbol"), null);
        if (symbol == null || symbol.isEmpty()) {
            throw new ProtocolException("instrumentId without symbol", frame);
        }
        return new InstrumentId(textOrDefault(node.get("marketId"), null), symbol);
    }

    /**
     * Book entries are arrays of levels, other entries a single object or a bare number.
     */
    private static List<EntryValue> entryValues(JsonNode node, String frame) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<EntryValue> levels = new ArrayList<>(node.size());
            for (JsonNode level : node) {
                EntryValue value = entryValue(level, frame);
                if (value != null) {
                    levels.add(value);
                }
            }
            return List.copyOf(levels);
        }
        EntryValue value = entryValue(node, frame);
        return value == null ? List.of() : List.of(value);
    }

    private static EntryValue entryValue(JsonNode node, String frame) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            JsonNode date = node.get("date");
            return new EntryValue(
                decimal(node.get("price"), frame),
                decimal(node.get("size"), frame),
                date != null && date.canConvertToLong() ? date.asLong() : null
            );
        }
        return EntryValue.of(decimal(node, frame));
    }

    private static BigDecimal decimal(JsonNode node, String frame) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid number '" + text + "'", frame, e);
            }
        }
        throw new ProtocolException("Expected a number but got " + node.getNodeType(), frame);
    }

    private static String textOrDefault(JsonNode node, String defaultValue) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaultValue;
        }
        return node.asText();
    }

    private ObjectNode marketDataFrame(String type, MarketDataSubscription request) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", type);
        frame.put("level", 1);
        ArrayNode entries = frame.putArray("entries");
        for (MarketDataEntry entry : request.entries()) {
            entries.add(entry.getCode());
        }
        ArrayNode products = frame.putArray("products");
        for (String ticker : request.tickers()) {
            ObjectNode product = products.addObject();
            product.put("symbol", ticker);
            product.put("marketId", request.market().getCode());
        }
        frame.put("depth", request.depth());
        return frame;
    }

    private ObjectNode orderReportFrame(String type, OrderReportSubscription request) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", type);
        frame.putObject("account").put("id", request.account());
        frame.put("snapshotOnlyActive", request.snapshotOnlyActive());
        return frame;
    }

    private String write(ObjectNode frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode frame: {}", e.getMessage(), e);
            throw new RofexException("Failed to encode frame", e);
        }
    }
}
