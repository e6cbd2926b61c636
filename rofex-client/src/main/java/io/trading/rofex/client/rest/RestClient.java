package io.trading.rofex.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.rofex.client.auth.CredentialProvider;
import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.protocol.codec.RequestValidator;
import io.trading.rofex.protocol.error.ProtocolException;
import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.error.ValidationException;
import io.trading.rofex.protocol.model.CfiCode;
import io.trading.rofex.protocol.model.Market;
import io.trading.rofex.protocol.model.MarketDataEntry;
import io.trading.rofex.protocol.model.MarketSegment;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.TimeInForce;
import io.trading.rofex.protocol.request.NewOrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Authenticated calls to the REST API. Every call is a GET carrying X-Auth-Token;
 * responses are returned as Jackson trees.
 *
 * A 401 refreshes the token once and retries; a second 401 raises
 * {@link AuthenticationException}. I/O failures raise {@link TransportException}.
 */
public class RestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestClient.class);

    private static final String TOKEN_HEADER = "X-Auth-Token";
    private static final int UNAUTHORIZED = 401;

    private final ClientConfig config;
    private final CredentialProvider credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RestClient(ClientConfig config, CredentialProvider credentials, HttpClient httpClient) {
        this.config = config;
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public JsonNode getSegments() {
        return get(RestPaths.SEGMENTS);
    }

    public JsonNode getAllInstruments() {
        return get(RestPaths.INSTRUMENTS_ALL);
    }

    public JsonNode getDetailedInstruments() {
        return get(RestPaths.INSTRUMENTS_DETAILS);
    }

    public JsonNode getInstrumentDetails(String ticker, Market market) {
        return get(format(RestPaths.INSTRUMENT_DETAIL, ticker, market.getCode()));
    }

    public JsonNode getInstrumentsByCfiCode(CfiCode cfiCode) {
        return get(format(RestPaths.INSTRUMENTS_BY_CFI, cfiCode.getCode()));
    }

    public JsonNode getInstrumentsBySegment(MarketSegment segment, Market market) {
        return get(format(RestPaths.INSTRUMENTS_BY_SEGMENT, segment.getCode(), market.getCode()));
    }

    /**
     * Market data snapshot of an instrument.
     *
     * @param ticker  Instrument symbol
     * @param entries Requested entries; null or empty requests every entry
     * @param depth   Book depth
     * @param market  Market of the instrument
     */
    public JsonNode getMarketData(String ticker, Collection<MarketDataEntry> entries, int depth, Market market) {
        if (depth < 1) {
            throw new ValidationException("Depth must be at least 1, was " + depth);
        }
        Collection<MarketDataEntry> requested = entries == null || entries.isEmpty() ? MarketDataEntry.all() : entries;
        String entryCodes = requested.stream()
            .map(entry -> {
                if (entry == null) {
                    throw new ValidationException("Invalid Market Data Entry: null");
                }
                return entry.getCode();
            })
            .collect(Collectors.joining(","));
        return get(String.format(RestPaths.MARKET_DATA,
            encode(market.getCode()), encode(ticker), encode(entryCodes), depth));
    }

    public JsonNode getTradeHistory(String ticker, LocalDate start, LocalDate end, Market market) {
        return get(format(RestPaths.HISTORIC_TRADES, market.getCode(), ticker, start.toString(), end.toString()));
    }

    public JsonNode getOrderStatus(String clOrdId, String proprietary) {
        return get(format(RestPaths.ORDER_STATUS, clOrdId, proprietaryOrDefault(proprietary)));
    }

    public JsonNode getAllOrdersStatus(String account) {
        return get(format(RestPaths.ALL_ORDERS_STATUS, accountOrDefault(account)));
    }

    /**
     * Sends a new order. A null account in the request means the configured default account.
     */
    public JsonNode sendOrder(NewOrderRequest request) {
        NewOrderRequest order = request.account() == null ? request.withAccount(config.account()) : request;
        RequestValidator.validate(order);

        StringBuilder path = new StringBuilder(format(RestPaths.NEW_ORDER,
            order.market().getCode(),
            order.ticker(),
            order.size().toPlainString(),
            order.orderType().getWireValue(),
            order.side().getWireValue(),
            order.timeInForce().getWireValue(),
            order.account(),
            Boolean.toString(order.cancelPrevious())));
        if (order.orderType() == OrderType.LIMIT) {
            path.append(format(RestPaths.LIMIT_ORDER, order.price().toPlainString()));
        }
        if (order.timeInForce() == TimeInForce.GOOD_TILL_DATE) {
            path.append(format(RestPaths.GOOD_TILL_DATE, order.expireDate()));
        }
        if (order.iceberg()) {
            path.append(format(RestPaths.ICEBERG, order.displayQuantity().toPlainString()));
        }
        return get(path.toString());
    }

    public JsonNode cancelOrder(String clOrdId, String proprietary) {
        return get(format(RestPaths.CANCEL_ORDER, clOrdId, proprietaryOrDefault(proprietary)));
    }

    public JsonNode getAccountPosition(String account) {
        return get(format(RestPaths.ACCOUNT_POSITION, accountOrDefault(account)));
    }

    public JsonNode getDetailedPosition(String account) {
        return get(format(RestPaths.DETAILED_POSITION, accountOrDefault(account)));
    }

    public JsonNode getAccountReport(String account) {
        return get(format(RestPaths.ACCOUNT_REPORT, accountOrDefault(account)));
    }

    JsonNode get(String path) {
        return get(path, true);
    }

    private JsonNode get(String path, boolean retry) {
        HttpRequest request = HttpRequest.newBuilder(config.resolve(path))
            .timeout(Duration.ofMillis(config.requestTimeoutMs()))
            .header(TOKEN_HEADER, credentials.getToken().value())
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException("Request to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during request to " + path, e);
        }

        if (response.statusCode() == UNAUTHORIZED) {
            if (retry) {
                LOGGER.info("[{}] Token rejected on {}, refreshing", config.environment(), path);
                credentials.refresh();
                return get(path, false);
            }
            throw new AuthenticationException("Authentication Fails.", UNAUTHORIZED);
        }
        if (response.statusCode() >= 400) {
            throw new RofexException("Request to " + path + " failed with status " + response.statusCode()
                + ": " + response.body());
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON response from " + path, response.body(), e);
        }
    }

    private String accountOrDefault(String account) {
        String resolved = account != null ? account : config.account();
        if (resolved == null || resolved.isBlank()) {
            throw new ValidationException("Account not specified.");
        }
        return resolved;
    }

    private String proprietaryOrDefault(String proprietary) {
        return proprietary != null ? proprietary : config.proprietary();
    }

    private static String format(String template, String... values) {
        Object[] encoded = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            encoded[i] = encode(values[i]);
        }
        return String.format(template, encoded);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
