package io.trading.rofex.client.dispatch;

import io.trading.rofex.client.error.HandlerException;
import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.message.ErrorMessage;
import io.trading.rofex.protocol.message.MarketDataMessage;
import io.trading.rofex.protocol.message.MessageCategory;
import io.trading.rofex.protocol.model.InstrumentId;
import io.trading.rofex.protocol.model.Market;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DispatchRegistryTest {

    private final DispatchRegistry registry = new DispatchRegistry();

    private static MarketDataMessage marketData(String symbol) {
        return new MarketDataMessage(InstrumentId.of(Market.ROFEX, symbol), 0, Map.of(), "{}");
    }

    @Test
    void testHandlersInvokedInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        registry.addMarketDataHandler(message -> calls.add("first"));
        registry.addMarketDataHandler(message -> calls.add("second"));
        registry.addMarketDataHandler(message -> calls.add("third"));

        registry.dispatch(marketData("DODic19"));

        assertEquals(List.of("first", "second", "third"), calls);
    }

    @Test
    void testDuplicateRegistrationInvokedTwice() {
        List<MarketDataMessage> received = new ArrayList<>();
        MessageHandler<MarketDataMessage> handler = received::add;
        registry.addMarketDataHandler(handler);
        registry.addMarketDataHandler(handler);

        registry.dispatch(marketData("DODic19"));

        assertEquals(2, received.size());
        assertEquals(2, registry.handlerCount(MessageCategory.MARKET_DATA));
    }

    @Test
    void testDispatchOnlyToMatchingCategory() {
        List<Object> marketData = new ArrayList<>();
        List<Object> errors = new ArrayList<>();
        registry.addMarketDataHandler(marketData::add);
        registry.addErrorHandler(errors::add);

        registry.dispatch(new ErrorMessage(ErrorMessage.Source.GATEWAY, "ERROR", "", "{}"));

        assertTrue(marketData.isEmpty());
        assertEquals(1, errors.size());
    }

    @Test
    void testRemoveFirstRegistrationOnly() {
        List<String> calls = new ArrayList<>();
        MessageHandler<MarketDataMessage> handler = message -> calls.add("h");
        registry.addMarketDataHandler(handler);
        registry.addMarketDataHandler(handler);

        assertTrue(registry.removeMarketDataHandler(handler));
        registry.dispatch(marketData("DODic19"));

        assertEquals(1, calls.size());
        assertTrue(registry.removeMarketDataHandler(handler));
        assertFalse(registry.removeMarketDataHandler(handler));
    }

    @Test
    void testFailingHandlerReportedAndOthersStillRun() {
        List<RofexException> reported = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        registry.setExceptionHandler(reported::add);
        registry.addMarketDataHandler(message -> {
            throw new Exception("checked failure");
        });
        registry.addMarketDataHandler(message -> calls.add("after"));

        MarketDataMessage message = marketData("DODic19");
        int failures = registry.dispatch(message);

        assertEquals(1, failures);
        assertEquals(List.of("after"), calls);
        assertEquals(1, reported.size());
        HandlerException failure = assertInstanceOf(HandlerException.class, reported.get(0));
        assertSame(message, failure.getInboundMessage());
        assertEquals("checked failure", failure.getCause().getMessage());
    }

    @Test
    void testHandlerThrowingErrorReportedAndOthersStillRun() {
        List<RofexException> reported = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        registry.setExceptionHandler(reported::add);
        registry.addMarketDataHandler(message -> {
            throw new AssertionError("boom");
        });
        registry.addMarketDataHandler(message -> calls.add("after"));

        assertEquals(1, registry.dispatch(marketData("DODic19")));

        assertEquals(List.of("after"), calls);
        HandlerException failure = assertInstanceOf(HandlerException.class, reported.get(0));
        assertInstanceOf(AssertionError.class, failure.getCause());
    }

    @Test
    void testVirtualMachineErrorPropagates() {
        registry.addMarketDataHandler(message -> {
            throw new OutOfMemoryError("simulated");
        });

        assertThrows(OutOfMemoryError.class, () -> registry.dispatch(marketData("DODic19")));
    }

    @Test
    void testExceptionHandlerThrowingErrorDoesNotPropagate() {
        registry.setExceptionHandler(exception -> {
            throw new AssertionError("exception handler failed");
        });
        registry.addMarketDataHandler(message -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(1, registry.dispatch(marketData("DODic19")));
    }

    @Test
    void testFailingHandlerWithoutExceptionHandlerIsLogged() {
        registry.addMarketDataHandler(message -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(1, registry.dispatch(marketData("DODic19")));
    }

    @Test
    void testFailingExceptionHandlerDoesNotPropagate() {
        registry.setExceptionHandler(exception -> {
            throw new IllegalStateException("exception handler failed");
        });
        registry.addMarketDataHandler(message -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> registry.dispatch(marketData("DODic19")));
    }

    @Test
    void testExceptionHandlerReplaced() {
        List<String> calls = new ArrayList<>();
        registry.setExceptionHandler(exception -> calls.add("old"));
        registry.setExceptionHandler(exception -> calls.add("new"));

        registry.reportError(new RofexException("failure"));

        assertEquals(List.of("new"), calls);
    }

    @Test
    void testHandlerAddedDuringDispatchSeesNextMessageOnly() {
        List<String> calls = new ArrayList<>();
        registry.addMarketDataHandler(message -> {
            calls.add("outer");
            if (calls.size() == 1) {
                registry.addMarketDataHandler(inner -> calls.add("inner"));
            }
        });

        registry.dispatch(marketData("DODic19"));
        assertEquals(List.of("outer"), calls);

        registry.dispatch(marketData("DODic19"));
        assertEquals(List.of("outer", "outer", "inner"), calls);
    }

    @Test
    void testNullHandlerRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.addOrderReportHandler(null));
    }
}
